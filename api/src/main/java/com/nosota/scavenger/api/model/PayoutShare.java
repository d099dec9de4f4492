package com.nosota.scavenger.api.model;

/**
 * Part of a settled reward a payout represents.
 */
public enum PayoutShare {
    /** Collector percentage paid to a collector in the transfer chain. */
    COLLECTOR,

    /** Owner percentage paid to the participant who submitted the waste. */
    SUBMITTER,

    /** Remainder paid to the current holder of the waste. */
    HOLDER
}
