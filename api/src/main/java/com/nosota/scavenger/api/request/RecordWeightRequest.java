package com.nosota.scavenger.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for weighing a bulk waste unit after it was received.
 *
 * @param caller Current holder of the waste unit
 * @param weight Measured weight in grams
 */
public record RecordWeightRequest(
        @NotBlank(message = "Caller is required")
        String caller,

        @NotNull(message = "Weight is required")
        Long weight
) {
}
