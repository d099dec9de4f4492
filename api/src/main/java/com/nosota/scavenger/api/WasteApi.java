package com.nosota.scavenger.api;

import com.nosota.scavenger.api.dto.TransferRecordDTO;
import com.nosota.scavenger.api.request.BulkTransferRequest;
import com.nosota.scavenger.api.request.RecordWeightRequest;
import com.nosota.scavenger.api.request.SubmitWasteBatchRequest;
import com.nosota.scavenger.api.request.SubmitWasteRequest;
import com.nosota.scavenger.api.request.TransferWasteRequest;
import com.nosota.scavenger.api.request.UpdateWasteStatusRequest;
import com.nosota.scavenger.api.response.StatusUpdateResponse;
import com.nosota.scavenger.api.response.WasteResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Waste API interface for the waste unit lifecycle.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Submission of waste units (single, batch and bulk)</li>
 *   <li>Ownership transfers along the supply chain</li>
 *   <li>Confirmation, status changes and deactivation</li>
 *   <li>Transfer history and ownership queries</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WasteController - in service module (server-side implementation)</li>
 *   <li>WasteClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/waste")
public interface WasteApi {

    // ==================== Lifecycle Operations ====================

    /**
     * Submits a new waste unit. The submitter becomes its first holder.
     *
     * @param request Category, weight, submitter and location
     * @return Created waste unit
     */
    @PostMapping
    ResponseEntity<WasteResponse> submitWaste(
            @RequestBody @Valid SubmitWasteRequest request) throws Exception;

    /**
     * Submits several waste units of one submitter. Either all units are created or none.
     *
     * @param request Submitter and items
     * @return Created waste units in item order
     */
    @PostMapping("/batch")
    ResponseEntity<List<WasteResponse>> submitWasteBatch(
            @RequestBody @Valid SubmitWasteBatchRequest request) throws Exception;

    /**
     * Transfers a waste unit to the next participant in the chain.
     *
     * <p>Allowed routes: RECYCLER → COLLECTOR, RECYCLER → MANUFACTURER, COLLECTOR → MANUFACTURER.
     *
     * @param wasteId The waste unit ID
     * @param request Sender, recipient and note
     * @return Updated waste unit
     */
    @PostMapping("/{wasteId}/transfer")
    ResponseEntity<WasteResponse> transferWaste(
            @PathVariable("wasteId") Long wasteId,
            @RequestBody @Valid TransferWasteRequest request) throws Exception;

    /**
     * Hands aggregated waste from a collector to a manufacturer.
     * Creates a new waste unit with weight 0 that the manufacturer weighs later.
     *
     * @param request Category, collector, manufacturer, location and note
     * @return Created placeholder waste unit
     */
    @PostMapping("/bulk-transfer")
    ResponseEntity<WasteResponse> transferBulkWaste(
            @RequestBody @Valid BulkTransferRequest request) throws Exception;

    /**
     * Records the measured weight of a bulk waste unit.
     *
     * @param wasteId The waste unit ID
     * @param request Holder and weight in grams
     * @return Updated waste unit
     */
    @PostMapping("/{wasteId}/weight")
    ResponseEntity<WasteResponse> recordBulkWeight(
            @PathVariable("wasteId") Long wasteId,
            @RequestBody @Valid RecordWeightRequest request) throws Exception;

    /**
     * Confirms a waste unit. The holder cannot confirm its own unit.
     *
     * @param wasteId   The waste unit ID
     * @param confirmer Confirming participant
     * @return Updated waste unit
     */
    @PostMapping("/{wasteId}/confirm")
    ResponseEntity<WasteResponse> confirmWaste(
            @PathVariable("wasteId") Long wasteId,
            @RequestParam("confirmer") String confirmer) throws Exception;

    /**
     * Clears the confirmation of a waste unit. Only the holder may do this.
     *
     * @param wasteId The waste unit ID
     * @param caller  Current holder
     * @return Updated waste unit
     */
    @PostMapping("/{wasteId}/confirm/reset")
    ResponseEntity<WasteResponse> resetWasteConfirmation(
            @PathVariable("wasteId") Long wasteId,
            @RequestParam("caller") String caller) throws Exception;

    /**
     * Permanently deactivates a waste unit (administrator only).
     *
     * @param wasteId The waste unit ID
     * @param caller  Administrator address
     * @return Deactivated waste unit
     */
    @PostMapping("/{wasteId}/deactivate")
    ResponseEntity<WasteResponse> deactivateWaste(
            @PathVariable("wasteId") Long wasteId,
            @RequestParam("caller") String caller) throws Exception;

    /**
     * Changes the processing status. A unit in a final status is left unchanged
     * and the response reports {@code updated=false}.
     *
     * @param wasteId The waste unit ID
     * @param request New status
     * @return Outcome of the update
     */
    @PutMapping("/{wasteId}/status")
    ResponseEntity<StatusUpdateResponse> updateWasteStatus(
            @PathVariable("wasteId") Long wasteId,
            @RequestBody @Valid UpdateWasteStatusRequest request) throws Exception;

    // ==================== Queries ====================

    @GetMapping("/{wasteId}")
    ResponseEntity<WasteResponse> getWaste(
            @PathVariable("wasteId") Long wasteId) throws Exception;

    /**
     * Gets several waste units at once.
     *
     * @param ids Waste unit IDs
     * @return One entry per requested ID in request order, {@code null} for unknown IDs
     */
    @GetMapping("/batch")
    ResponseEntity<List<WasteResponse>> getWasteBatch(
            @RequestParam("ids") List<Long> ids);

    /**
     * Gets the transfer history of a waste unit in chronological order.
     * Unknown waste units have an empty history.
     *
     * @param wasteId The waste unit ID
     * @return Transfers, oldest first
     */
    @GetMapping("/{wasteId}/transfers")
    ResponseEntity<List<TransferRecordDTO>> getWasteTransferHistory(
            @PathVariable("wasteId") Long wasteId);

    /**
     * Gets the IDs of the waste units a participant submitted, holds, or sent or received
     * in a transfer.
     *
     * @param participant Participant address
     * @return Waste unit IDs in ascending order
     */
    @GetMapping("/participants/{participant}")
    ResponseEntity<List<Long>> getParticipantWastes(
            @PathVariable("participant") String participant);

    /**
     * Checks whether a transfer between two participants follows an allowed route.
     */
    @GetMapping("/routes/validate")
    ResponseEntity<Boolean> isValidTransfer(
            @RequestParam("from") String from,
            @RequestParam("to") String to);
}
