package com.nosota.scavenger.repository;

import com.nosota.scavenger.model.WasteUnit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface SupplyChainStatisticRepository extends JpaRepository<WasteUnit, Long> {

    /**
     * Sums the weight of all waste units that have not been deactivated.
     * Bulk units still waiting for their weight contribute 0.
     *
     * @return Total weight in grams, 0 when there are no active units
     */
    @Query("SELECT COALESCE(SUM(w.weight), 0L) FROM WasteUnit w WHERE w.active = true")
    Long sumActiveWeight();

    /**
     * Sums every reward payment ever recorded.
     *
     * <p>Equals the sum of {@code totalTokensEarned} over all participants, since
     * settlement records earnings for exactly the payouts it makes.</p>
     *
     * @return Total tokens paid out, 0 before the first settlement
     */
    @Query("SELECT COALESCE(SUM(p.amount), 0L) FROM RewardPayout p")
    Long sumPaidRewards();
}
