package com.nosota.scavenger.dto;

import com.nosota.scavenger.model.RewardPayout;
import lombok.Builder;

import java.util.List;

/**
 * Internal DTO for settlement calculation results.
 *
 * <p>Produced by both preview and settlement. In a preview the payouts are not persisted
 * and carry no id; after settlement they are the recorded ledger entries.
 *
 * <p>For API responses, use {@link com.nosota.scavenger.api.response.SettlementResponse}.
 *
 * @param wasteId              Settled waste unit
 * @param incentiveId          Incentive program that funds the reward
 * @param issuer               Issuer of the program, payer of every payout
 * @param totalReward          Reward for the unit
 * @param payouts              Payments in payment order: collectors, submitter, holder
 * @param remainingBudgetAfter Program budget left once the reward is paid
 * @param incentiveActiveAfter Whether the program stays active
 */
@Builder(toBuilder = true)
public record RewardDistribution(
        Long wasteId,
        Long incentiveId,
        String issuer,
        Long totalReward,
        List<RewardPayout> payouts,
        Long remainingBudgetAfter,
        boolean incentiveActiveAfter
) {
}
