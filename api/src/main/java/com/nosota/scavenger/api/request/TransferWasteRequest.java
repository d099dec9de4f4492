package com.nosota.scavenger.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for moving a waste unit to the next participant in the chain.
 *
 * @param from Current holder of the waste unit
 * @param to   Receiving participant
 * @param note Optional note (max 256 characters)
 */
public record TransferWasteRequest(
        @NotBlank(message = "Sender is required")
        String from,

        @NotBlank(message = "Recipient is required")
        String to,

        @Size(max = 256, message = "Note must be at most 256 characters")
        String note
) {
}
