package com.nosota.scavenger.api;

import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.api.request.CreateIncentiveRequest;
import com.nosota.scavenger.api.request.UpdateIncentiveRequest;
import com.nosota.scavenger.api.response.IncentiveResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of IncentiveApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link WasteClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class IncentiveClient implements IncentiveApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<IncentiveResponse> createIncentive(CreateIncentiveRequest request) {
        log.debug("Calling createIncentive: issuer={}, category={}, rewardRate={}, totalBudget={}",
                request.issuer(), request.category(), request.rewardRate(), request.totalBudget());

        return webClient.post()
                .uri("/api/v1/incentives")
                .bodyValue(request)
                .retrieve()
                .toEntity(IncentiveResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IncentiveResponse> updateIncentive(Long incentiveId, UpdateIncentiveRequest request) {
        log.debug("Calling updateIncentive: incentiveId={}, rewardRate={}, totalBudget={}",
                incentiveId, request.rewardRate(), request.totalBudget());

        return webClient.put()
                .uri("/api/v1/incentives/{incentiveId}", incentiveId)
                .bodyValue(request)
                .retrieve()
                .toEntity(IncentiveResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IncentiveResponse> setIncentiveActive(Long incentiveId, String caller, boolean active) {
        log.debug("Calling setIncentiveActive: incentiveId={}, caller={}, active={}", incentiveId, caller, active);

        return webClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/incentives/{incentiveId}/active")
                        .queryParam("caller", caller)
                        .queryParam("active", active)
                        .build(incentiveId))
                .retrieve()
                .toEntity(IncentiveResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IncentiveResponse> getIncentiveById(Long incentiveId) {
        log.debug("Calling getIncentiveById: incentiveId={}", incentiveId);

        return webClient.get()
                .uri("/api/v1/incentives/{incentiveId}", incentiveId)
                .retrieve()
                .toEntity(IncentiveResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<Boolean> incentiveExists(Long incentiveId) {
        log.debug("Calling incentiveExists: incentiveId={}", incentiveId);

        return webClient.get()
                .uri("/api/v1/incentives/{incentiveId}/exists", incentiveId)
                .retrieve()
                .toEntity(Boolean.class)
                .block();
    }

    @Override
    public ResponseEntity<List<Long>> getIncentivesByIssuer(String issuer) {
        log.debug("Calling getIncentivesByIssuer: issuer={}", issuer);

        return webClient.get()
                .uri("/api/v1/incentives/issuers/{issuer}", issuer)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<Long>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<Long>> getIncentivesByCategory(WasteType category) {
        log.debug("Calling getIncentivesByCategory: category={}", category);

        return webClient.get()
                .uri("/api/v1/incentives/categories/{category}", category)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<Long>>() {})
                .block();
    }

    @Override
    public ResponseEntity<IncentiveResponse> getBestActiveIncentiveFor(String issuer, WasteType category) {
        log.debug("Calling getBestActiveIncentiveFor: issuer={}, category={}", issuer, category);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/incentives/issuers/{issuer}/best")
                        .queryParam("category", category)
                        .build(issuer))
                .retrieve()
                .toEntity(IncentiveResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<IncentiveResponse>> getActiveIncentivesSorted(WasteType category) {
        log.debug("Calling getActiveIncentivesSorted: category={}", category);

        return webClient.get()
                .uri("/api/v1/incentives/categories/{category}/active", category)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<IncentiveResponse>>() {})
                .block();
    }
}
