package com.nosota.scavenger.service;

import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import com.nosota.scavenger.repository.SupplyChainStatisticRepository;
import jakarta.transaction.Transactional;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@AllArgsConstructor
@Slf4j
public class SupplyChainStatisticService
{
    private final SupplyChainStatisticRepository supplyChainStatisticRepository;

    /**
     * Retrieves system-wide supply-chain totals.
     *
     * <p>{@code totalWastes} counts every waste unit ever registered, deactivated ones
     * included. {@code totalActiveWeight} only covers active units. {@code totalTokensEarned}
     * is the sum of all reward payouts.</p>
     *
     * @return Current totals
     */
    @Transactional
    public SupplyChainStatsResponse getSupplyChainStats() {
        long totalWastes = supplyChainStatisticRepository.count();
        Long activeWeight = supplyChainStatisticRepository.sumActiveWeight();
        Long paidRewards = supplyChainStatisticRepository.sumPaidRewards();

        SupplyChainStatsResponse stats = new SupplyChainStatsResponse(
                totalWastes,
                activeWeight != null ? activeWeight : 0L,
                paidRewards != null ? paidRewards : 0L
        );
        log.debug("Supply chain stats: {}", stats);
        return stats;
    }
}
