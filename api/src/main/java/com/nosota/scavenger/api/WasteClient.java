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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of WasteApi for consuming the scavenger service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class ScavengerClientConfig {
 *     @Bean
 *     public WebClient scavengerWebClient(WebClient.Builder builder,
 *                                         @Value("${services.scavenger.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public WasteClient wasteClient(WebClient scavengerWebClient) {
 *         return new WasteClient(scavengerWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class WasteClient implements WasteApi {

    private final WebClient webClient;

    // ==================== Lifecycle Operations ====================

    @Override
    public ResponseEntity<WasteResponse> submitWaste(SubmitWasteRequest request) {
        log.debug("Calling submitWaste: category={}, weight={}, submitter={}",
                request.category(), request.weight(), request.submitter());

        return webClient.post()
                .uri("/api/v1/waste")
                .bodyValue(request)
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<WasteResponse>> submitWasteBatch(SubmitWasteBatchRequest request) {
        log.debug("Calling submitWasteBatch: submitter={}, items={}", request.submitter(), request.items().size());

        return webClient.post()
                .uri("/api/v1/waste/batch")
                .bodyValue(request)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<WasteResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<WasteResponse> transferWaste(Long wasteId, TransferWasteRequest request) {
        log.debug("Calling transferWaste: wasteId={}, from={}, to={}", wasteId, request.from(), request.to());

        return webClient.post()
                .uri("/api/v1/waste/{wasteId}/transfer", wasteId)
                .bodyValue(request)
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WasteResponse> transferBulkWaste(BulkTransferRequest request) {
        log.debug("Calling transferBulkWaste: category={}, collector={}, manufacturer={}",
                request.category(), request.collector(), request.manufacturer());

        return webClient.post()
                .uri("/api/v1/waste/bulk-transfer")
                .bodyValue(request)
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WasteResponse> recordBulkWeight(Long wasteId, RecordWeightRequest request) {
        log.debug("Calling recordBulkWeight: wasteId={}, weight={}", wasteId, request.weight());

        return webClient.post()
                .uri("/api/v1/waste/{wasteId}/weight", wasteId)
                .bodyValue(request)
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WasteResponse> confirmWaste(Long wasteId, String confirmer) {
        log.debug("Calling confirmWaste: wasteId={}, confirmer={}", wasteId, confirmer);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/waste/{wasteId}/confirm")
                        .queryParam("confirmer", confirmer)
                        .build(wasteId))
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WasteResponse> resetWasteConfirmation(Long wasteId, String caller) {
        log.debug("Calling resetWasteConfirmation: wasteId={}, caller={}", wasteId, caller);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/waste/{wasteId}/confirm/reset")
                        .queryParam("caller", caller)
                        .build(wasteId))
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WasteResponse> deactivateWaste(Long wasteId, String caller) {
        log.debug("Calling deactivateWaste: wasteId={}, caller={}", wasteId, caller);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/waste/{wasteId}/deactivate")
                        .queryParam("caller", caller)
                        .build(wasteId))
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<StatusUpdateResponse> updateWasteStatus(Long wasteId, UpdateWasteStatusRequest request) {
        log.debug("Calling updateWasteStatus: wasteId={}, status={}", wasteId, request.status());

        return webClient.put()
                .uri("/api/v1/waste/{wasteId}/status", wasteId)
                .bodyValue(request)
                .retrieve()
                .toEntity(StatusUpdateResponse.class)
                .block();
    }

    // ==================== Queries ====================

    @Override
    public ResponseEntity<WasteResponse> getWaste(Long wasteId) {
        log.debug("Calling getWaste: wasteId={}", wasteId);

        return webClient.get()
                .uri("/api/v1/waste/{wasteId}", wasteId)
                .retrieve()
                .toEntity(WasteResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<WasteResponse>> getWasteBatch(List<Long> ids) {
        log.debug("Calling getWasteBatch: ids={}", ids);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/waste/batch")
                        .queryParam("ids", ids.toArray())
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<WasteResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<TransferRecordDTO>> getWasteTransferHistory(Long wasteId) {
        log.debug("Calling getWasteTransferHistory: wasteId={}", wasteId);

        return webClient.get()
                .uri("/api/v1/waste/{wasteId}/transfers", wasteId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<TransferRecordDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<Long>> getParticipantWastes(String participant) {
        log.debug("Calling getParticipantWastes: participant={}", participant);

        return webClient.get()
                .uri("/api/v1/waste/participants/{participant}", participant)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<Long>>() {})
                .block();
    }

    @Override
    public ResponseEntity<Boolean> isValidTransfer(String from, String to) {
        log.debug("Calling isValidTransfer: from={}, to={}", from, to);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/waste/routes/validate")
                        .queryParam("from", from)
                        .queryParam("to", to)
                        .build())
                .retrieve()
                .toEntity(Boolean.class)
                .block();
    }
}
