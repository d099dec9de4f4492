package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.ParticipantRole;
import com.nosota.scavenger.model.Capability;

import java.util.Optional;

/**
 * Read-only view of who is registered and what they are allowed to do.
 * The engine consults it for every capability and route check.
 */
public interface ParticipantDirectory {

    Optional<ParticipantRole> roleOf(String address);

    /**
     * @return true only if the participant is registered and its role grants the capability
     */
    boolean hasCapability(String address, Capability capability);
}
