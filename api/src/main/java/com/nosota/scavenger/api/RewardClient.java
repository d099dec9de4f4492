package com.nosota.scavenger.api;

import com.nosota.scavenger.api.dto.PagedResponse;
import com.nosota.scavenger.api.dto.RewardPayoutDTO;
import com.nosota.scavenger.api.request.SettleRewardsRequest;
import com.nosota.scavenger.api.response.SettlementResponse;
import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of RewardApi.
 */
@RequiredArgsConstructor
@Slf4j
public class RewardClient implements RewardApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<SettlementResponse> settleRewards(SettleRewardsRequest request) {
        log.debug("Calling settleRewards: wasteId={}, incentiveId={}, issuer={}",
                request.wasteId(), request.incentiveId(), request.issuer());

        return webClient.post()
                .uri("/api/v1/rewards/settle")
                .bodyValue(request)
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SettlementResponse> previewRewards(Long wasteId, Long incentiveId, String issuer) {
        log.debug("Calling previewRewards: wasteId={}, incentiveId={}, issuer={}", wasteId, incentiveId, issuer);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/rewards/preview")
                        .queryParam("wasteId", wasteId)
                        .queryParam("incentiveId", incentiveId)
                        .queryParam("issuer", issuer)
                        .build())
                .retrieve()
                .toEntity(SettlementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<RewardPayoutDTO>> getParticipantPayouts(String participant, int page, int size) {
        log.debug("Calling getParticipantPayouts: participant={}, page={}, size={}", participant, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/rewards/participants/{participant}/payouts")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(participant))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<RewardPayoutDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<SupplyChainStatsResponse> getSupplyChainStats() {
        log.debug("Calling getSupplyChainStats");

        return webClient.get()
                .uri("/api/v1/rewards/stats")
                .retrieve()
                .toEntity(SupplyChainStatsResponse.class)
                .block();
    }
}
