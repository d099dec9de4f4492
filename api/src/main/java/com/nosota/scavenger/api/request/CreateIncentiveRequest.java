package com.nosota.scavenger.api.request;

import com.nosota.scavenger.api.model.WasteType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for creating an incentive program.
 *
 * @param issuer      Address of the manufacturer funding the program
 * @param category    Material category the program rewards
 * @param rewardRate  Reward tokens per kilogram (must be positive)
 * @param totalBudget Budget ceiling in reward tokens (must be positive)
 */
public record CreateIncentiveRequest(
        @NotBlank(message = "Issuer is required")
        String issuer,

        @NotNull(message = "Category is required")
        WasteType category,

        @NotNull(message = "Reward rate is required")
        Long rewardRate,

        @NotNull(message = "Total budget is required")
        Long totalBudget
) {
}
