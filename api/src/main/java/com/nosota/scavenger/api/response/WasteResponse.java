package com.nosota.scavenger.api.response;

import com.nosota.scavenger.api.model.WasteStatus;
import com.nosota.scavenger.api.model.WasteType;

import java.time.LocalDateTime;

/**
 * Response DTO describing a waste unit.
 *
 * @param id           Waste unit ID
 * @param category     Material category
 * @param weight       Weight in grams (0 while a bulk unit awaits weighing)
 * @param submitter    Participant that brought the unit into the system
 * @param currentOwner Current holder
 * @param status       Processing status
 * @param confirmed    Whether a party other than the holder confirmed the unit
 * @param confirmer    Confirming party, or the holder when unconfirmed
 * @param active       False once the unit was deactivated
 * @param latitude     Latitude in micro-degrees
 * @param longitude    Longitude in micro-degrees
 * @param createdAt    Submission timestamp
 */
public record WasteResponse(
        Long id,
        WasteType category,
        Long weight,
        String submitter,
        String currentOwner,
        WasteStatus status,
        boolean confirmed,
        String confirmer,
        boolean active,
        Long latitude,
        Long longitude,
        LocalDateTime createdAt
) {
}
