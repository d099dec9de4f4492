package com.nosota.scavenger.api.request;

import com.nosota.scavenger.api.model.WasteStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateWasteStatusRequest(
        @NotNull(message = "Status is required")
        WasteStatus status
) {
}
