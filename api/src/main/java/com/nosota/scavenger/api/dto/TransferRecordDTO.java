package com.nosota.scavenger.api.dto;

import java.time.LocalDateTime;

/**
 * One ownership move of a waste unit.
 *
 * @param id        Transfer ID
 * @param wasteId   ID of the transferred waste unit
 * @param from      Previous holder
 * @param to        New holder
 * @param timestamp When the transfer was recorded
 * @param note      Free-form note supplied by the sender
 * @param bulk      Whether this was a collector → manufacturer bulk hand-over
 */
public record TransferRecordDTO(
        Long id,
        Long wasteId,
        String from,
        String to,
        LocalDateTime timestamp,
        String note,
        boolean bulk
) {
}
