package com.nosota.scavenger.api.request;

import com.nosota.scavenger.api.model.WasteType;
import jakarta.validation.constraints.NotNull;

/**
 * One waste unit of a batch submission.
 *
 * @param category  Material category
 * @param weight    Weight in grams (must be positive)
 * @param latitude  Latitude in micro-degrees
 * @param longitude Longitude in micro-degrees
 */
public record WasteBatchItem(
        @NotNull(message = "Category is required")
        WasteType category,

        @NotNull(message = "Weight is required")
        Long weight,

        @NotNull(message = "Latitude is required")
        Long latitude,

        @NotNull(message = "Longitude is required")
        Long longitude
) {
}
