package com.nosota.scavenger.controller;

import com.nosota.scavenger.api.RewardApi;
import com.nosota.scavenger.api.dto.PagedResponse;
import com.nosota.scavenger.api.dto.RewardPayoutDTO;
import com.nosota.scavenger.api.request.SettleRewardsRequest;
import com.nosota.scavenger.api.response.SettlementResponse;
import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import com.nosota.scavenger.dto.RewardDistribution;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.mapper.RewardPayoutMapper;
import com.nosota.scavenger.model.RewardPayout;
import com.nosota.scavenger.service.RewardSettlementService;
import com.nosota.scavenger.service.SupplyChainStatisticService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for reward settlement and supply-chain statistics.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class RewardController implements RewardApi {

    private final RewardSettlementService rewardSettlementService;
    private final SupplyChainStatisticService supplyChainStatisticService;

    @Override
    public ResponseEntity<SettlementResponse> settleRewards(SettleRewardsRequest request) throws ScavengerException {
        RewardDistribution distribution = rewardSettlementService.settle(
                request.wasteId(), request.incentiveId(), request.issuer());
        SettlementResponse response = RewardPayoutMapper.INSTANCE.toSettlementResponse(distribution);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<SettlementResponse> previewRewards(Long wasteId, Long incentiveId, String issuer)
            throws ScavengerException {
        RewardDistribution distribution = rewardSettlementService.preview(wasteId, incentiveId, issuer);
        return ResponseEntity.ok(RewardPayoutMapper.INSTANCE.toSettlementResponse(distribution));
    }

    @Override
    public ResponseEntity<PagedResponse<RewardPayoutDTO>> getParticipantPayouts(String participant, int page, int size) {
        Page<RewardPayout> payouts = rewardSettlementService.payoutsOf(participant, PageRequest.of(page, size));

        List<RewardPayoutDTO> content = RewardPayoutMapper.INSTANCE.toDTOList(payouts.getContent());

        PagedResponse<RewardPayoutDTO> response = new PagedResponse<>(
                content,
                payouts.getNumber(),
                payouts.getSize(),
                payouts.getTotalElements()
        );

        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<SupplyChainStatsResponse> getSupplyChainStats() {
        return ResponseEntity.ok(supplyChainStatisticService.getSupplyChainStats());
    }
}
