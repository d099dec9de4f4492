package com.nosota.scavenger.model;

/**
 * Independent identifier spaces. Each one has its own row in {@code id_sequence}.
 */
public enum IdKind {
    WASTE,
    INCENTIVE,
    TRANSFER
}
