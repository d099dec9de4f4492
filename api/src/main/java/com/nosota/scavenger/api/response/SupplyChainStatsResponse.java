package com.nosota.scavenger.api.response;

/**
 * @param totalWastes       Number of waste units ever registered
 * @param totalActiveWeight Combined weight in grams of active waste units
 * @param totalTokensEarned Reward tokens paid out across all settlements
 */
public record SupplyChainStatsResponse(
        long totalWastes,
        long totalActiveWeight,
        long totalTokensEarned
) {
}
