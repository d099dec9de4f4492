package com.nosota.scavenger.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for changing the rate and budget of an active incentive program.
 *
 * @param caller      Must be the program issuer
 * @param rewardRate  New reward tokens per kilogram
 * @param totalBudget New budget ceiling; already spent budget is carried over
 */
public record UpdateIncentiveRequest(
        @NotBlank(message = "Caller is required")
        String caller,

        @NotNull(message = "Reward rate is required")
        Long rewardRate,

        @NotNull(message = "Total budget is required")
        Long totalBudget
) {
}
