package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.PayoutShare;
import com.nosota.scavenger.model.RewardPayout;

/**
 * Value-transfer facility that moves reward tokens from an incentive issuer to a payee.
 *
 * <p>Called inside the settlement transaction; a failure rolls back the whole settlement.
 */
public interface TokenTransferGateway {

    /**
     * Pays reward tokens.
     *
     * @param wasteId     Settled waste unit
     * @param incentiveId Funding program
     * @param payer       Program issuer
     * @param payee       Receiving participant
     * @param share       Part of the reward being paid
     * @param amount      Positive amount of tokens
     * @return The recorded payment
     */
    RewardPayout transfer(Long wasteId, Long incentiveId, String payer, String payee, PayoutShare share, long amount);
}
