package com.nosota.scavenger.controller;

import com.nosota.scavenger.api.WasteApi;
import com.nosota.scavenger.api.dto.TransferRecordDTO;
import com.nosota.scavenger.api.request.BulkTransferRequest;
import com.nosota.scavenger.api.request.RecordWeightRequest;
import com.nosota.scavenger.api.request.SubmitWasteBatchRequest;
import com.nosota.scavenger.api.request.SubmitWasteRequest;
import com.nosota.scavenger.api.request.TransferWasteRequest;
import com.nosota.scavenger.api.request.UpdateWasteStatusRequest;
import com.nosota.scavenger.api.response.StatusUpdateResponse;
import com.nosota.scavenger.api.response.WasteResponse;
import com.nosota.scavenger.error.RecordNotFoundException;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.mapper.WasteMapper;
import com.nosota.scavenger.model.WasteUnit;
import com.nosota.scavenger.service.TransferLedgerService;
import com.nosota.scavenger.service.WasteRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the waste unit lifecycle.
 *
 * <p>Implements {@link WasteApi} on top of {@link WasteRegistryService} (the unit record)
 * and {@link TransferLedgerService} (custody changes).
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WasteController implements WasteApi {

    private final WasteRegistryService wasteRegistryService;
    private final TransferLedgerService transferLedgerService;

    // ==================== Lifecycle Operations ====================

    @Override
    public ResponseEntity<WasteResponse> submitWaste(SubmitWasteRequest request) throws ScavengerException {
        WasteUnit waste = wasteRegistryService.submit(
                request.category(),
                request.weight(),
                request.submitter(),
                request.latitude(),
                request.longitude()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<List<WasteResponse>> submitWasteBatch(SubmitWasteBatchRequest request)
            throws ScavengerException {
        List<WasteUnit> created = wasteRegistryService.submitBatch(request.submitter(), request.items());
        return ResponseEntity.status(HttpStatus.CREATED).body(WasteMapper.INSTANCE.toResponseList(created));
    }

    @Override
    public ResponseEntity<WasteResponse> transferWaste(Long wasteId, TransferWasteRequest request)
            throws ScavengerException {
        WasteUnit waste = transferLedgerService.transfer(wasteId, request.from(), request.to(), request.note());
        return ResponseEntity.ok(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<WasteResponse> transferBulkWaste(BulkTransferRequest request) throws ScavengerException {
        WasteUnit waste = transferLedgerService.transferBulk(
                request.category(),
                request.collector(),
                request.manufacturer(),
                request.latitude(),
                request.longitude(),
                request.note()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<WasteResponse> recordBulkWeight(Long wasteId, RecordWeightRequest request)
            throws ScavengerException {
        WasteUnit waste = wasteRegistryService.recordBulkWeight(wasteId, request.caller(), request.weight());
        return ResponseEntity.ok(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<WasteResponse> confirmWaste(Long wasteId, String confirmer) throws ScavengerException {
        WasteUnit waste = wasteRegistryService.confirm(wasteId, confirmer);
        return ResponseEntity.ok(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<WasteResponse> resetWasteConfirmation(Long wasteId, String caller)
            throws ScavengerException {
        WasteUnit waste = wasteRegistryService.resetConfirmation(wasteId, caller);
        return ResponseEntity.ok(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<WasteResponse> deactivateWaste(Long wasteId, String caller) throws ScavengerException {
        WasteUnit waste = wasteRegistryService.deactivate(wasteId, caller);
        return ResponseEntity.ok(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<StatusUpdateResponse> updateWasteStatus(Long wasteId, UpdateWasteStatusRequest request)
            throws ScavengerException {
        boolean updated = wasteRegistryService.updateStatus(wasteId, request.status());
        WasteUnit waste = wasteRegistryService.get(wasteId)
                .orElseThrow(() -> new RecordNotFoundException("Waste not found: " + wasteId));
        return ResponseEntity.ok(new StatusUpdateResponse(wasteId, updated, waste.getStatus()));
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<WasteResponse> getWaste(Long wasteId) throws ScavengerException {
        WasteUnit waste = wasteRegistryService.get(wasteId)
                .orElseThrow(() -> new RecordNotFoundException("Waste not found: " + wasteId));
        return ResponseEntity.ok(WasteMapper.INSTANCE.toResponse(waste));
    }

    @Override
    public ResponseEntity<List<WasteResponse>> getWasteBatch(List<Long> ids) {
        List<WasteResponse> wastes = wasteRegistryService.getBatch(ids).stream()
                .map(waste -> waste.map(WasteMapper.INSTANCE::toResponse).orElse(null))
                .toList();
        return ResponseEntity.ok(wastes);
    }

    @Override
    public ResponseEntity<List<TransferRecordDTO>> getWasteTransferHistory(Long wasteId) {
        return ResponseEntity.ok(WasteMapper.INSTANCE.toDTOList(transferLedgerService.historyOf(wasteId)));
    }

    @Override
    public ResponseEntity<List<Long>> getParticipantWastes(String participant) {
        return ResponseEntity.ok(wasteRegistryService.participantWastes(participant));
    }

    @Override
    public ResponseEntity<Boolean> isValidTransfer(String from, String to) {
        return ResponseEntity.ok(transferLedgerService.isValidRoute(from, to));
    }
}
