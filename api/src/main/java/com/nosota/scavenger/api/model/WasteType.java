package com.nosota.scavenger.api.model;

/**
 * Material category of a waste unit or an incentive program.
 */
public enum WasteType {
    /** Newspapers, cardboard, office paper. */
    PAPER,

    /** Polyethylene terephthalate bottles and containers. */
    PET_PLASTIC,

    /** Other plastic waste. */
    PLASTIC,

    /** Aluminum, steel, copper. */
    METAL,

    /** Bottles, jars, containers. */
    GLASS
}
