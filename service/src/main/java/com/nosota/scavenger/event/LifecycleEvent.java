package com.nosota.scavenger.event;

import java.time.LocalDateTime;

/**
 * Notification that a waste unit, incentive program or participant changed.
 *
 * @param type       What happened
 * @param recordId   ID of the affected waste unit or program (null for participants)
 * @param actor      Participant that caused the change
 * @param detail     Free-form summary of the change
 * @param occurredAt When the change was made
 */
public record LifecycleEvent(
        EventType type,
        Long recordId,
        String actor,
        String detail,
        LocalDateTime occurredAt
) {
}
