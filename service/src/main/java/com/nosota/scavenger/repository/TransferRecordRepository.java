package com.nosota.scavenger.repository;

import com.nosota.scavenger.model.TransferRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransferRecordRepository extends JpaRepository<TransferRecord, Long> {
    List<TransferRecord> findByWasteIdOrderByIdAsc(Long wasteId);
}
