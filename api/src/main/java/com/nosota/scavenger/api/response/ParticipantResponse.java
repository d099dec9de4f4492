package com.nosota.scavenger.api.response;

import com.nosota.scavenger.api.model.ParticipantRole;

import java.time.LocalDateTime;

public record ParticipantResponse(
        String address,
        ParticipantRole role,
        String name,
        Long totalWasteSubmitted,
        Long totalTokensEarned,
        LocalDateTime registeredAt
) {
}
