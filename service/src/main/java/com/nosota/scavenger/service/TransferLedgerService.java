package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.ParticipantRole;
import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.error.InvalidStateException;
import com.nosota.scavenger.error.RecordNotFoundException;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.error.UnauthorizedOperationException;
import com.nosota.scavenger.event.EventType;
import com.nosota.scavenger.event.LifecycleEventPublisher;
import com.nosota.scavenger.model.IdKind;
import com.nosota.scavenger.model.TransferRecord;
import com.nosota.scavenger.model.WasteUnit;
import com.nosota.scavenger.repository.TransferRecordRepository;
import com.nosota.scavenger.repository.WasteUnitRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only custody history of waste units.
 *
 * <p>Transfer workflow:
 * <pre>
 * 1. Lock the waste unit, require it active and held by the sender
 * 2. Resolve both roles and check the route against {@link TransferRoutePolicy}
 * 3. Append a TransferRecord
 * 4. Move ownership to the recipient
 * </pre>
 *
 * <p>The record and the ownership change commit together or not at all.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class TransferLedgerService {

    private final TransferRecordRepository transferRecordRepository;
    private final WasteUnitRepository wasteUnitRepository;
    private final WasteRegistryService wasteRegistryService;
    private final IdentifierAllocator identifierAllocator;
    private final ParticipantDirectory participantDirectory;
    private final TransferRoutePolicy routePolicy;
    private final LifecycleEventPublisher eventPublisher;

    /**
     * Transfers a waste unit from its holder to the next participant in the chain.
     *
     * @param wasteId The waste unit ID
     * @param from    Current holder
     * @param to      Recipient
     * @param note    Free-form note kept in the history
     * @return The unit with its new owner
     * @throws RecordNotFoundException        if the unit does not exist
     * @throws InvalidStateException          if the unit is deactivated
     * @throws UnauthorizedOperationException if the sender is not the holder, either party is
     *                                        unregistered, or the route is not allowed
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit transfer(@NotNull Long wasteId, @NotBlank String from, @NotBlank String to, String note)
            throws ScavengerException {
        // 1. Lock and check the unit
        WasteUnit waste = wasteUnitRepository.findByIdForUpdate(wasteId)
                .orElseThrow(() -> new RecordNotFoundException("Waste not found: " + wasteId));

        if (!waste.isActive()) {
            throw new InvalidStateException("Cannot transfer deactivated waste " + wasteId);
        }
        if (!waste.getCurrentOwner().equals(from)) {
            throw new UnauthorizedOperationException(
                    String.format("Participant %s does not hold waste %d", from, wasteId));
        }

        // 2. Route check
        if (!isValidRoute(from, to)) {
            throw new UnauthorizedOperationException(
                    String.format("Transfer %s -> %s is not an allowed route", from, to));
        }

        // 3. History
        TransferRecord record = appendRecord(wasteId, from, to, note, false);

        // 4. Ownership
        waste.setCurrentOwner(to);
        waste = wasteUnitRepository.save(waste);

        log.info("Transferred waste {} from {} to {} (record {})", wasteId, from, to, record.getId());
        eventPublisher.publish(EventType.WASTE_TRANSFERRED, wasteId, from, "to=" + to);

        return waste;
    }

    /**
     * Hands aggregated waste from a collector straight to a manufacturer.
     *
     * <p>Creates a placeholder unit of weight 0 held by the manufacturer, plus the
     * collector to manufacturer transfer record. The manufacturer records the real weight
     * later with {@link WasteRegistryService#recordBulkWeight}.
     *
     * @return The placeholder unit
     * @throws UnauthorizedOperationException if the roles are not COLLECTOR and MANUFACTURER
     * @throws com.nosota.scavenger.error.InvalidInputException if the location is out of range
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit transferBulk(@NotNull WasteType category, @NotBlank String collector,
                                  @NotBlank String manufacturer, @NotNull Long latitude,
                                  @NotNull Long longitude, String note) throws ScavengerException {
        ParticipantRole collectorRole = participantDirectory.roleOf(collector).orElse(null);
        if (collectorRole != ParticipantRole.COLLECTOR) {
            throw new UnauthorizedOperationException("Only collectors can hand over bulk waste: " + collector);
        }
        ParticipantRole manufacturerRole = participantDirectory.roleOf(manufacturer).orElse(null);
        if (manufacturerRole != ParticipantRole.MANUFACTURER) {
            throw new UnauthorizedOperationException("Bulk waste recipient must be a manufacturer: " + manufacturer);
        }

        WasteUnit waste = wasteRegistryService.createBulkPlaceholder(
                category, collector, manufacturer, latitude, longitude);
        appendRecord(waste.getId(), collector, manufacturer, note, true);

        log.info("Bulk transfer of {} from {} to {} created waste {}",
                category, collector, manufacturer, waste.getId());
        eventPublisher.publish(EventType.BULK_TRANSFERRED, waste.getId(), collector,
                "to=" + manufacturer + " category=" + category);

        return waste;
    }

    /**
     * Transfer history of a unit, oldest first. Unknown units have an empty history.
     */
    public List<TransferRecord> historyOf(@NotNull Long wasteId) {
        return transferRecordRepository.findByWasteIdOrderByIdAsc(wasteId);
    }

    /**
     * Checks the route table for two registered participants.
     *
     * @return false if either participant is unregistered or the route is not allowed
     */
    public boolean isValidRoute(String from, String to) {
        ParticipantRole fromRole = participantDirectory.roleOf(from).orElse(null);
        ParticipantRole toRole = participantDirectory.roleOf(to).orElse(null);
        return routePolicy.isAllowed(fromRole, toRole);
    }

    private TransferRecord appendRecord(Long wasteId, String from, String to, String note, boolean bulk) {
        TransferRecord record = new TransferRecord();
        record.setId(identifierAllocator.next(IdKind.TRANSFER));
        record.setWasteId(wasteId);
        record.setFromAddress(from);
        record.setToAddress(to);
        record.setTimestamp(LocalDateTime.now());
        record.setNote(note);
        record.setBulk(bulk);
        return transferRecordRepository.save(record);
    }
}
