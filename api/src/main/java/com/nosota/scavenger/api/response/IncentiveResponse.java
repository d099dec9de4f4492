package com.nosota.scavenger.api.response;

import com.nosota.scavenger.api.model.WasteType;

import java.time.LocalDateTime;

/**
 * Response DTO describing an incentive program.
 *
 * @param id              Incentive program ID
 * @param issuer          Manufacturer that funds the program
 * @param category        Material category it rewards
 * @param rewardRate      Reward tokens per kilogram
 * @param totalBudget     Budget ceiling
 * @param remainingBudget Budget not yet paid out
 * @param active          Whether rewards can still be settled against it
 * @param createdAt       Creation timestamp
 */
public record IncentiveResponse(
        Long id,
        String issuer,
        WasteType category,
        Long rewardRate,
        Long totalBudget,
        Long remainingBudget,
        boolean active,
        LocalDateTime createdAt
) {
}
