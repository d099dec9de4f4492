package com.nosota.scavenger.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for submitting several waste units of one submitter at once.
 *
 * @param submitter Address of the submitting participant
 * @param items     Units to submit
 */
public record SubmitWasteBatchRequest(
        @NotBlank(message = "Submitter is required")
        String submitter,

        @NotEmpty(message = "At least one item is required")
        @Size(max = 100, message = "At most 100 items per batch")
        List<@Valid WasteBatchItem> items
) {
}
