package com.nosota.scavenger.api.request;

import com.nosota.scavenger.api.model.ParticipantRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterParticipantRequest(
        @NotBlank(message = "Address is required")
        @Size(max = 128, message = "Address must be at most 128 characters")
        String address,

        @NotNull(message = "Role is required")
        ParticipantRole role,

        @Size(max = 128, message = "Name must be at most 128 characters")
        String name
) {
}
