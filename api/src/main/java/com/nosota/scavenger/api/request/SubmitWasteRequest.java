package com.nosota.scavenger.api.request;

import com.nosota.scavenger.api.model.WasteType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for submitting a new waste unit.
 *
 * @param category  Material category
 * @param weight    Weight in grams (must be positive)
 * @param submitter Address of the submitting participant
 * @param latitude  Latitude in micro-degrees
 * @param longitude Longitude in micro-degrees
 */
public record SubmitWasteRequest(
        @NotNull(message = "Category is required")
        WasteType category,

        @NotNull(message = "Weight is required")
        Long weight,

        @NotBlank(message = "Submitter is required")
        String submitter,

        @NotNull(message = "Latitude is required")
        Long latitude,

        @NotNull(message = "Longitude is required")
        Long longitude
) {
}
