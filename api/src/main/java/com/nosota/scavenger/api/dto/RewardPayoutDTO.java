package com.nosota.scavenger.api.dto;

import com.nosota.scavenger.api.model.PayoutShare;

import java.time.LocalDateTime;

/**
 * A single reward payment made (or, in a preview, to be made) during settlement.
 *
 * @param id          Payout ID (null in a preview)
 * @param wasteId     Settled waste unit
 * @param incentiveId Incentive program that funded the reward
 * @param payer       Issuer of the incentive program
 * @param payee       Participant receiving the payment
 * @param share       Part of the reward this payment represents
 * @param amount      Amount paid, in reward tokens
 * @param createdAt   When the payment was recorded (null in a preview)
 */
public record RewardPayoutDTO(
        Long id,
        Long wasteId,
        Long incentiveId,
        String payer,
        String payee,
        PayoutShare share,
        Long amount,
        LocalDateTime createdAt
) {
}
