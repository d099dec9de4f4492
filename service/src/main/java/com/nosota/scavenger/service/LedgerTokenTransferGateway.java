package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.PayoutShare;
import com.nosota.scavenger.model.RewardPayout;
import com.nosota.scavenger.repository.RewardPayoutRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * {@link TokenTransferGateway} that books every payment into the {@code reward_payout} ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerTokenTransferGateway implements TokenTransferGateway {

    private final RewardPayoutRepository rewardPayoutRepository;

    @Override
    @Transactional
    public RewardPayout transfer(Long wasteId, Long incentiveId, String payer, String payee,
                                 PayoutShare share, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payout amount must be positive, got " + amount);
        }

        RewardPayout payout = new RewardPayout();
        payout.setWasteId(wasteId);
        payout.setIncentiveId(incentiveId);
        payout.setPayer(payer);
        payout.setPayee(payee);
        payout.setShare(share);
        payout.setAmount(amount);
        payout.setCreatedAt(LocalDateTime.now());
        payout = rewardPayoutRepository.save(payout);

        log.debug("Paid {} tokens {} -> {} ({} share of waste {})", amount, payer, payee, share, wasteId);
        return payout;
    }
}
