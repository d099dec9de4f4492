package com.nosota.scavenger.event;

public enum EventType {
    WASTE_SUBMITTED,
    WASTE_TRANSFERRED,
    BULK_TRANSFERRED,
    BULK_WEIGHT_RECORDED,
    WASTE_STATUS_UPDATED,
    WASTE_CONFIRMED,
    CONFIRMATION_RESET,
    WASTE_DEACTIVATED,
    INCENTIVE_CREATED,
    INCENTIVE_UPDATED,
    INCENTIVE_ACTIVATION_CHANGED,
    REWARDS_SETTLED,
    PARTICIPANT_REGISTERED
}
