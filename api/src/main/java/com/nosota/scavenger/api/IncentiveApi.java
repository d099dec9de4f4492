package com.nosota.scavenger.api;

import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.api.request.CreateIncentiveRequest;
import com.nosota.scavenger.api.request.UpdateIncentiveRequest;
import com.nosota.scavenger.api.response.IncentiveResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Incentive API interface for manufacturer-funded incentive programs.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>IncentiveController - in service module (server-side implementation)</li>
 *   <li>IncentiveClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/incentives")
public interface IncentiveApi {

    // ==================== Program Management ====================

    /**
     * Creates an incentive program. Only manufacturers may issue programs.
     *
     * @param request Issuer, category, reward rate and budget
     * @return Created program
     */
    @PostMapping
    ResponseEntity<IncentiveResponse> createIncentive(
            @RequestBody @Valid CreateIncentiveRequest request) throws Exception;

    /**
     * Changes rate and budget of an active program. Budget already paid out is
     * carried into the new budget.
     *
     * @param incentiveId The program ID
     * @param request     Issuer, new rate and new budget
     * @return Updated program
     */
    @PutMapping("/{incentiveId}")
    ResponseEntity<IncentiveResponse> updateIncentive(
            @PathVariable("incentiveId") Long incentiveId,
            @RequestBody @Valid UpdateIncentiveRequest request) throws Exception;

    /**
     * Activates or deactivates a program (issuer only).
     */
    @PutMapping("/{incentiveId}/active")
    ResponseEntity<IncentiveResponse> setIncentiveActive(
            @PathVariable("incentiveId") Long incentiveId,
            @RequestParam("caller") String caller,
            @RequestParam("active") boolean active) throws Exception;

    // ==================== Queries ====================

    @GetMapping("/{incentiveId}")
    ResponseEntity<IncentiveResponse> getIncentiveById(
            @PathVariable("incentiveId") Long incentiveId) throws Exception;

    @GetMapping("/{incentiveId}/exists")
    ResponseEntity<Boolean> incentiveExists(
            @PathVariable("incentiveId") Long incentiveId);

    /**
     * Gets the IDs of all programs of an issuer, in creation order.
     */
    @GetMapping("/issuers/{issuer}")
    ResponseEntity<List<Long>> getIncentivesByIssuer(
            @PathVariable("issuer") String issuer);

    /**
     * Gets the IDs of all programs for a category, active or not, in creation order.
     */
    @GetMapping("/categories/{category}")
    ResponseEntity<List<Long>> getIncentivesByCategory(
            @PathVariable("category") WasteType category);

    /**
     * Gets the active program of an issuer with the highest reward rate for a category.
     *
     * @return The program, or 204 No Content when the issuer has no active program for it
     */
    @GetMapping("/issuers/{issuer}/best")
    ResponseEntity<IncentiveResponse> getBestActiveIncentiveFor(
            @PathVariable("issuer") String issuer,
            @RequestParam("category") WasteType category);

    /**
     * Gets all active programs for a category, highest reward rate first.
     * Programs with equal rates keep their creation order.
     */
    @GetMapping("/categories/{category}/active")
    ResponseEntity<List<IncentiveResponse>> getActiveIncentivesSorted(
            @PathVariable("category") WasteType category);
}
