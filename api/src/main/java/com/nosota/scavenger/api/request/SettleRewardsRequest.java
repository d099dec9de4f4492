package com.nosota.scavenger.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for settling the reward of a waste unit against an incentive program.
 *
 * @param wasteId     Waste unit to reward
 * @param incentiveId Incentive program that funds the reward
 * @param issuer      Must be the issuer of the incentive program
 */
public record SettleRewardsRequest(
        @NotNull(message = "Waste ID is required")
        Long wasteId,

        @NotNull(message = "Incentive ID is required")
        Long incentiveId,

        @NotBlank(message = "Issuer is required")
        String issuer
) {
}
