package com.nosota.scavenger.repository;

import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.model.IncentiveProgram;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IncentiveProgramRepository extends JpaRepository<IncentiveProgram, Long> {
    /**
     * Retrieves an incentive program and locks it for update.
     * <p>
     * Settlement debits the remaining budget under this lock, so two settlements against
     * the same program cannot both spend the same budget.
     * </p>
     *
     * @param id The program ID
     * @return The locked program, or empty if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM IncentiveProgram i WHERE i.id = :id")
    Optional<IncentiveProgram> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT i.id FROM IncentiveProgram i WHERE i.issuer = :issuer ORDER BY i.id")
    List<Long> findIdsByIssuer(@Param("issuer") String issuer);

    @Query("SELECT i.id FROM IncentiveProgram i WHERE i.category = :category ORDER BY i.id")
    List<Long> findIdsByCategory(@Param("category") WasteType category);

    /**
     * Active programs of one issuer for a category, best reward rate first.
     * Equal rates are ordered by creation (ascending id).
     */
    List<IncentiveProgram> findByIssuerAndCategoryAndActiveTrueOrderByRewardRateDescIdAsc(
            String issuer, WasteType category);

    List<IncentiveProgram> findByCategoryAndActiveTrueOrderByRewardRateDescIdAsc(WasteType category);
}
