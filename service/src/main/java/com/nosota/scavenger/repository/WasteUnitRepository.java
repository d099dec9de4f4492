package com.nosota.scavenger.repository;

import com.nosota.scavenger.model.WasteUnit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface WasteUnitRepository extends JpaRepository<WasteUnit, Long> {
    /**
     * Retrieves a waste unit and locks it for update.
     * <p>
     * Every mutation of a waste unit (transfer, confirmation, status change,
     * deactivation) reads it through this method so concurrent calls on the same unit
     * are serialized.
     * </p>
     *
     * @param id The waste unit ID
     * @return The locked waste unit, or empty if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WasteUnit w WHERE w.id = :id")
    Optional<WasteUnit> findByIdForUpdate(@Param("id") Long id);

    /**
     * Finds the IDs of the waste units a participant is or was associated with: as submitter,
     * as current holder, or as either side of a recorded transfer.
     *
     * @param participant Participant address
     * @return Distinct IDs in ascending order
     */
    @Query("SELECT w.id FROM WasteUnit w WHERE w.submitter = :participant OR w.currentOwner = :participant "
            + "OR w.id IN (SELECT t.wasteId FROM TransferRecord t "
            + "WHERE t.fromAddress = :participant OR t.toAddress = :participant) ORDER BY w.id")
    List<Long> findIdsByParticipant(@Param("participant") String participant);

    /**
     * Loads every existing unit among the given IDs, in no particular order.
     */
    List<WasteUnit> findByIdIn(Collection<Long> ids);
}
