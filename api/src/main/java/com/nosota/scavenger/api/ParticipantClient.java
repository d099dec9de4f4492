package com.nosota.scavenger.api;

import com.nosota.scavenger.api.request.RegisterParticipantRequest;
import com.nosota.scavenger.api.response.ParticipantResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

@RequiredArgsConstructor
@Slf4j
public class ParticipantClient implements ParticipantApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<ParticipantResponse> registerParticipant(RegisterParticipantRequest request) {
        log.debug("Calling registerParticipant: address={}, role={}", request.address(), request.role());

        return webClient.post()
                .uri("/api/v1/participants")
                .bodyValue(request)
                .retrieve()
                .toEntity(ParticipantResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ParticipantResponse> getParticipant(String address) {
        log.debug("Calling getParticipant: address={}", address);

        return webClient.get()
                .uri("/api/v1/participants/{address}", address)
                .retrieve()
                .toEntity(ParticipantResponse.class)
                .block();
    }
}
