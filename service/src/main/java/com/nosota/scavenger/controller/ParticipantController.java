package com.nosota.scavenger.controller;

import com.nosota.scavenger.api.ParticipantApi;
import com.nosota.scavenger.api.request.RegisterParticipantRequest;
import com.nosota.scavenger.api.response.ParticipantResponse;
import com.nosota.scavenger.error.RecordNotFoundException;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.mapper.ParticipantMapper;
import com.nosota.scavenger.model.Participant;
import com.nosota.scavenger.service.ParticipantService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
public class ParticipantController implements ParticipantApi {

    private final ParticipantService participantService;

    @Override
    public ResponseEntity<ParticipantResponse> registerParticipant(RegisterParticipantRequest request)
            throws ScavengerException {
        Participant participant = participantService.register(request.address(), request.role(), request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(ParticipantMapper.INSTANCE.toResponse(participant));
    }

    @Override
    public ResponseEntity<ParticipantResponse> getParticipant(String address) throws ScavengerException {
        Participant participant = participantService.get(address)
                .orElseThrow(() -> new RecordNotFoundException("Participant not found: " + address));
        return ResponseEntity.ok(ParticipantMapper.INSTANCE.toResponse(participant));
    }
}
