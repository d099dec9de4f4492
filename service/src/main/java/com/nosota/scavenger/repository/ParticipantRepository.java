package com.nosota.scavenger.repository;

import com.nosota.scavenger.model.Participant;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, String> {
    /**
     * Locks a participant row before its lifetime statistics are changed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Participant p WHERE p.address = :address")
    Optional<Participant> findByAddressForUpdate(@Param("address") String address);
}
