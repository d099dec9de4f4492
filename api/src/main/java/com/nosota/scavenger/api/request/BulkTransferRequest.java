package com.nosota.scavenger.api.request;

import com.nosota.scavenger.api.model.WasteType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for a collector handing aggregated waste to a manufacturer.
 * The weight is recorded later by the manufacturer.
 *
 * @param category     Material category of the aggregated waste
 * @param collector    Address of the collector
 * @param manufacturer Address of the receiving manufacturer
 * @param latitude     Latitude in micro-degrees
 * @param longitude    Longitude in micro-degrees
 * @param note         Optional note (max 256 characters)
 */
public record BulkTransferRequest(
        @NotNull(message = "Category is required")
        WasteType category,

        @NotBlank(message = "Collector is required")
        String collector,

        @NotBlank(message = "Manufacturer is required")
        String manufacturer,

        @NotNull(message = "Latitude is required")
        Long latitude,

        @NotNull(message = "Longitude is required")
        Long longitude,

        @Size(max = 256, message = "Note must be at most 256 characters")
        String note
) {
}
