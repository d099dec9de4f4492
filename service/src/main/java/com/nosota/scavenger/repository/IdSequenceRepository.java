package com.nosota.scavenger.repository;

import com.nosota.scavenger.model.IdKind;
import com.nosota.scavenger.model.IdSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IdSequenceRepository extends JpaRepository<IdSequence, IdKind> {
    /**
     * Retrieves the counter row of an id space and locks it for update.
     * <p>
     * Concurrent allocations in the same space queue on this lock, so two callers can
     * never observe the same counter value.
     * </p>
     *
     * @param kind The id space
     * @return The locked counter row
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM IdSequence s WHERE s.name = :kind")
    Optional<IdSequence> findForUpdate(@Param("kind") IdKind kind);
}
