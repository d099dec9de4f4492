package com.nosota.scavenger.controller;

import com.nosota.scavenger.api.IncentiveApi;
import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.api.request.CreateIncentiveRequest;
import com.nosota.scavenger.api.request.UpdateIncentiveRequest;
import com.nosota.scavenger.api.response.IncentiveResponse;
import com.nosota.scavenger.error.RecordNotFoundException;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.mapper.IncentiveMapper;
import com.nosota.scavenger.model.IncentiveProgram;
import com.nosota.scavenger.service.IncentiveProgramService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
public class IncentiveController implements IncentiveApi {

    private final IncentiveProgramService incentiveProgramService;

    @Override
    public ResponseEntity<IncentiveResponse> createIncentive(CreateIncentiveRequest request) throws ScavengerException {
        IncentiveProgram program = incentiveProgramService.create(
                request.issuer(),
                request.category(),
                request.rewardRate(),
                request.totalBudget()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(IncentiveMapper.INSTANCE.toResponse(program));
    }

    @Override
    public ResponseEntity<IncentiveResponse> updateIncentive(Long incentiveId, UpdateIncentiveRequest request)
            throws ScavengerException {
        IncentiveProgram program = incentiveProgramService.update(
                incentiveId,
                request.caller(),
                request.rewardRate(),
                request.totalBudget()
        );
        return ResponseEntity.ok(IncentiveMapper.INSTANCE.toResponse(program));
    }

    @Override
    public ResponseEntity<IncentiveResponse> setIncentiveActive(Long incentiveId, String caller, boolean active)
            throws ScavengerException {
        IncentiveProgram program = incentiveProgramService.setActive(incentiveId, caller, active);
        return ResponseEntity.ok(IncentiveMapper.INSTANCE.toResponse(program));
    }

    @Override
    public ResponseEntity<IncentiveResponse> getIncentiveById(Long incentiveId) throws ScavengerException {
        IncentiveProgram program = incentiveProgramService.byId(incentiveId)
                .orElseThrow(() -> new RecordNotFoundException("Incentive not found: " + incentiveId));
        return ResponseEntity.ok(IncentiveMapper.INSTANCE.toResponse(program));
    }

    @Override
    public ResponseEntity<Boolean> incentiveExists(Long incentiveId) {
        return ResponseEntity.ok(incentiveProgramService.exists(incentiveId));
    }

    @Override
    public ResponseEntity<List<Long>> getIncentivesByIssuer(String issuer) {
        return ResponseEntity.ok(incentiveProgramService.byIssuer(issuer));
    }

    @Override
    public ResponseEntity<List<Long>> getIncentivesByCategory(WasteType category) {
        return ResponseEntity.ok(incentiveProgramService.byCategory(category));
    }

    @Override
    public ResponseEntity<IncentiveResponse> getBestActiveIncentiveFor(String issuer, WasteType category) {
        return incentiveProgramService.bestActiveFor(issuer, category)
                .map(program -> ResponseEntity.ok(IncentiveMapper.INSTANCE.toResponse(program)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Override
    public ResponseEntity<List<IncentiveResponse>> getActiveIncentivesSorted(WasteType category) {
        return ResponseEntity.ok(IncentiveMapper.INSTANCE.toResponseList(incentiveProgramService.allActiveFor(category)));
    }
}
