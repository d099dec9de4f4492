package com.nosota.scavenger.api.model;

/**
 * Processing status of a waste unit.
 * PENDING and PROCESSING can still change; PROCESSED and REJECTED are final.
 */
public enum WasteStatus {
    /**
     * PENDING: Waste unit has been submitted and is waiting for processing.
     */
    PENDING,

    /**
     * PROCESSING: Waste unit is being sorted or recycled.
     */
    PROCESSING,

    /**
     * PROCESSED: Waste unit has been recycled.
     * This is a final state.
     */
    PROCESSED,

    /**
     * REJECTED: Waste unit was refused (contaminated, wrong category, etc.).
     * This is a final state.
     */
    REJECTED
}
