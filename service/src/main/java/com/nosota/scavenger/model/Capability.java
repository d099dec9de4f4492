package com.nosota.scavenger.model;

/**
 * Permissions a participant holds by virtue of its role.
 */
public enum Capability {
    SUBMIT_WASTE,
    CONFIRM_WASTE,
    COLLECT_WASTE,
    MANUFACTURE
}
