package com.nosota.scavenger.api.response;

import com.nosota.scavenger.api.dto.RewardPayoutDTO;

import java.util.List;

/**
 * Response DTO for reward settlement (executed or previewed).
 *
 * @param wasteId          Settled waste unit
 * @param incentiveId      Incentive program that funded the reward
 * @param issuer           Issuer of the incentive program
 * @param totalReward      Reward computed for the waste unit
 * @param payouts          Individual payments, in payment order
 * @param remainingBudget  Program budget left after the settlement
 * @param incentiveActive  Whether the program is still active after the settlement
 */
public record SettlementResponse(
        Long wasteId,
        Long incentiveId,
        String issuer,
        Long totalReward,
        List<RewardPayoutDTO> payouts,
        Long remainingBudget,
        boolean incentiveActive
) {
}
