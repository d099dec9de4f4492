package com.nosota.scavenger.repository;

import com.nosota.scavenger.model.RewardPayout;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RewardPayoutRepository extends JpaRepository<RewardPayout, Long> {
    Page<RewardPayout> findByPayeeOrderByIdDesc(String payee, Pageable pageable);

    List<RewardPayout> findByWasteIdOrderByIdAsc(Long wasteId);
}
