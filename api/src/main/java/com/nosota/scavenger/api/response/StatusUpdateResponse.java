package com.nosota.scavenger.api.response;

import com.nosota.scavenger.api.model.WasteStatus;

/**
 * @param wasteId ID of the waste unit
 * @param updated false when the unit was already in a final status
 * @param status  Status after the call
 */
public record StatusUpdateResponse(
        Long wasteId,
        boolean updated,
        WasteStatus status
) {
}
