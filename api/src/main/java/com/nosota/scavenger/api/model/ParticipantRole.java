package com.nosota.scavenger.api.model;

/**
 * Role of a participant in the recycling supply chain.
 * <p>
 * Waste moves RECYCLER → COLLECTOR → MANUFACTURER. A recycler may also hand
 * waste directly to a manufacturer.
 * </p>
 */
public enum ParticipantRole {
    /**
     * Submits waste into the system.
     */
    RECYCLER,

    /**
     * Gathers waste from recyclers and delivers it to manufacturers.
     */
    COLLECTOR,

    /**
     * Turns waste into new products and funds incentive programs.
     */
    MANUFACTURER
}
