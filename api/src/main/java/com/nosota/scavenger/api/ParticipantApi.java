package com.nosota.scavenger.api;

import com.nosota.scavenger.api.request.RegisterParticipantRequest;
import com.nosota.scavenger.api.response.ParticipantResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Participant API interface for the participant directory.
 */
@RequestMapping("/api/v1/participants")
public interface ParticipantApi {

    @PostMapping
    ResponseEntity<ParticipantResponse> registerParticipant(
            @RequestBody @Valid RegisterParticipantRequest request) throws Exception;

    @GetMapping("/{address}")
    ResponseEntity<ParticipantResponse> getParticipant(
            @PathVariable("address") String address) throws Exception;
}
