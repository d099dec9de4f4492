package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.WasteStatus;
import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.api.request.WasteBatchItem;
import com.nosota.scavenger.error.*;
import com.nosota.scavenger.event.EventType;
import com.nosota.scavenger.event.LifecycleEventPublisher;
import com.nosota.scavenger.model.Capability;
import com.nosota.scavenger.model.IdKind;
import com.nosota.scavenger.model.WasteUnit;
import com.nosota.scavenger.repository.WasteUnitRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the canonical waste unit record.
 *
 * <p>The service provides:
 * <ul>
 *   <li>Submission - registers a new unit owned by its submitter, singly or in batches</li>
 *   <li>Confirmation - a party other than the holder vouches for the unit</li>
 *   <li>Status changes - guarded by {@link WasteStatusStateMachine}</li>
 *   <li>Deactivation - one-way, administrator only</li>
 *   <li>Bulk weighing - finalizes the weight of a bulk hand-over</li>
 * </ul>
 *
 * <p>Every mutation locks the unit first and rejects inactive units with
 * {@link InvalidStateException}. Input is validated before an identifier is allocated.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WasteRegistryService {

    static final long MAX_LATITUDE = 90_000_000L;
    static final long MAX_LONGITUDE = 180_000_000L;
    public static final int MAX_BATCH_SIZE = 100;

    private final WasteUnitRepository wasteUnitRepository;
    private final IdentifierAllocator identifierAllocator;
    private final ParticipantDirectory participantDirectory;
    private final ParticipantService participantService;
    private final WasteStatusStateMachine statusStateMachine;
    private final LifecycleEventPublisher eventPublisher;

    @Value("${scavenger.admin-address}")
    private String adminAddress;

    /**
     * Submits a new waste unit.
     *
     * @param category  Material category
     * @param weight    Weight in grams, must be positive
     * @param submitter Submitting participant, needs SUBMIT_WASTE
     * @param latitude  Latitude in micro-degrees
     * @param longitude Longitude in micro-degrees
     * @return The created unit: PENDING, active, unconfirmed, owned by the submitter
     * @throws UnauthorizedOperationException if the submitter may not submit waste
     * @throws InvalidInputException          if weight or location is invalid
     * @throws RewardOverflowException        if the submitter's lifetime total would overflow
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit submit(@NotNull WasteType category, @NotNull Long weight, @NotBlank String submitter,
                            @NotNull Long latitude, @NotNull Long longitude) throws ScavengerException {
        // 1. Validate before allocating an id
        if (!participantDirectory.hasCapability(submitter, Capability.SUBMIT_WASTE)) {
            throw new UnauthorizedOperationException("Participant may not submit waste: " + submitter);
        }
        if (weight <= 0) {
            throw new InvalidInputException("Waste weight must be positive, got " + weight);
        }
        validateLocation(latitude, longitude);

        // 2. Create the unit
        WasteUnit waste = newWasteUnit(category, weight, submitter, submitter, latitude, longitude);
        waste = wasteUnitRepository.save(waste);

        // 3. Lifetime statistics
        participantService.recordSubmission(submitter, weight);

        log.info("Submitted waste {}: category={}, weight={}g, submitter={}",
                waste.getId(), category, weight, submitter);
        eventPublisher.publish(EventType.WASTE_SUBMITTED, waste.getId(), submitter,
                "category=" + category + " weight=" + weight);

        return waste;
    }

    /**
     * Submits several waste units for one submitter in a single transaction.
     * Every item is validated, and the weight total checked, before the first id is allocated.
     * The submitter's lifetime total grows once by the batch total.
     *
     * @param submitter Submitting participant, needs SUBMIT_WASTE
     * @param items     Units to submit, 1 to {@value #MAX_BATCH_SIZE}
     * @return The created units in item order
     * @throws UnauthorizedOperationException if the submitter may not submit waste
     * @throws InvalidInputException          if the batch size, a weight or a location is invalid
     * @throws RewardOverflowException        if the batch total or the submitter's lifetime total overflows
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public List<WasteUnit> submitBatch(@NotBlank String submitter, @NotNull List<WasteBatchItem> items)
            throws ScavengerException {
        // 1. Validate the whole batch
        if (!participantDirectory.hasCapability(submitter, Capability.SUBMIT_WASTE)) {
            throw new UnauthorizedOperationException("Participant may not submit waste: " + submitter);
        }
        if (items.isEmpty() || items.size() > MAX_BATCH_SIZE) {
            throw new InvalidInputException("Batch must hold 1 to " + MAX_BATCH_SIZE + " items, got " + items.size());
        }
        long totalWeight = 0L;
        for (WasteBatchItem item : items) {
            if (item == null || item.category() == null || item.weight() == null
                    || item.latitude() == null || item.longitude() == null) {
                throw new InvalidInputException("Batch item is incomplete: " + item);
            }
            if (item.weight() <= 0) {
                throw new InvalidInputException("Waste weight must be positive, got " + item.weight());
            }
            validateLocation(item.latitude(), item.longitude());
            try {
                totalWeight = Math.addExact(totalWeight, item.weight());
            } catch (ArithmeticException e) {
                throw new RewardOverflowException("Batch weight total overflows", e);
            }
        }

        // 2. Create the units
        List<WasteUnit> created = new ArrayList<>(items.size());
        for (WasteBatchItem item : items) {
            WasteUnit waste = newWasteUnit(item.category(), item.weight(), submitter, submitter,
                    item.latitude(), item.longitude());
            created.add(wasteUnitRepository.save(waste));
        }

        // 3. Lifetime statistics
        participantService.recordSubmission(submitter, totalWeight);

        log.info("Submitted batch of {} waste units ({}g) for {}", created.size(), totalWeight, submitter);
        for (WasteUnit waste : created) {
            eventPublisher.publish(EventType.WASTE_SUBMITTED, waste.getId(), submitter,
                    "category=" + waste.getCategory() + " weight=" + waste.getWeight() + " batch=true");
        }

        return created;
    }

    /**
     * Creates the zero-weight placeholder of a bulk hand-over. The collector is recorded as
     * submitter, the manufacturer as holder and confirmer.
     * Callers are responsible for role checks and for the transfer record.
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit createBulkPlaceholder(@NotNull WasteType category, @NotBlank String collector,
                                           @NotBlank String manufacturer, @NotNull Long latitude,
                                           @NotNull Long longitude) throws ScavengerException {
        validateLocation(latitude, longitude);

        WasteUnit waste = newWasteUnit(category, 0L, collector, manufacturer, latitude, longitude);
        waste.setConfirmer(manufacturer);
        return wasteUnitRepository.save(waste);
    }

    /**
     * Records the measured weight of a bulk placeholder.
     *
     * @throws RecordNotFoundException        if the unit does not exist
     * @throws InvalidStateException          if the unit is inactive or already weighed
     * @throws UnauthorizedOperationException if the caller does not hold the unit
     * @throws InvalidInputException          if the weight is not positive
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit recordBulkWeight(@NotNull Long wasteId, @NotBlank String caller, @NotNull Long weight)
            throws ScavengerException {
        WasteUnit waste = lockActiveWaste(wasteId);

        if (waste.getWeight() != 0L) {
            throw new InvalidStateException("Weight of waste " + wasteId + " is already recorded");
        }
        if (!waste.getCurrentOwner().equals(caller)) {
            throw new UnauthorizedOperationException("Only the holder can weigh waste " + wasteId);
        }
        if (weight <= 0) {
            throw new InvalidInputException("Waste weight must be positive, got " + weight);
        }

        waste.setWeight(weight);
        waste = wasteUnitRepository.save(waste);

        log.info("Recorded bulk weight of waste {}: {}g by {}", wasteId, weight, caller);
        eventPublisher.publish(EventType.BULK_WEIGHT_RECORDED, wasteId, caller, "weight=" + weight);

        return waste;
    }

    /**
     * Changes the processing status of a unit.
     *
     * @return true if the status was changed; false, without any change, if the current
     *         status is final
     * @throws RecordNotFoundException if the unit does not exist
     * @throws InvalidStateException   if the unit is inactive
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public boolean updateStatus(@NotNull Long wasteId, @NotNull WasteStatus newStatus) throws ScavengerException {
        WasteUnit waste = lockActiveWaste(wasteId);

        WasteStatus current = waste.getStatus();
        if (!statusStateMachine.isTransitionAllowed(current, newStatus)) {
            log.info("Status of waste {} is final ({}), {} not applied", wasteId, current, newStatus);
            return false;
        }

        waste.setStatus(newStatus);
        wasteUnitRepository.save(waste);

        log.info("Waste {} status {} -> {}", wasteId, current, newStatus);
        eventPublisher.publish(EventType.WASTE_STATUS_UPDATED, wasteId, null, current + " -> " + newStatus);

        return true;
    }

    /**
     * Confirms a unit on behalf of a party other than its holder.
     *
     * @throws RecordNotFoundException        if the unit does not exist
     * @throws InvalidStateException          if the unit is inactive or already confirmed
     * @throws UnauthorizedOperationException if the confirmer may not confirm waste
     * @throws InvalidInputException          if the confirmer holds the unit
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit confirm(@NotNull Long wasteId, @NotBlank String confirmer) throws ScavengerException {
        WasteUnit waste = lockActiveWaste(wasteId);

        if (!participantDirectory.hasCapability(confirmer, Capability.CONFIRM_WASTE)) {
            throw new UnauthorizedOperationException("Participant may not confirm waste: " + confirmer);
        }
        if (waste.getCurrentOwner().equals(confirmer)) {
            throw new InvalidInputException("Holder cannot confirm own waste " + wasteId);
        }
        if (waste.isConfirmed()) {
            throw new InvalidStateException("Waste " + wasteId + " is already confirmed");
        }

        waste.setConfirmed(true);
        waste.setConfirmer(confirmer);
        waste = wasteUnitRepository.save(waste);

        log.info("Waste {} confirmed by {}", wasteId, confirmer);
        eventPublisher.publish(EventType.WASTE_CONFIRMED, wasteId, confirmer, "");

        return waste;
    }

    /**
     * Clears the confirmation of a unit. Only the holder may do this.
     *
     * @throws RecordNotFoundException        if the unit does not exist
     * @throws InvalidStateException          if the unit is inactive or not confirmed
     * @throws UnauthorizedOperationException if the caller does not hold the unit
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit resetConfirmation(@NotNull Long wasteId, @NotBlank String caller) throws ScavengerException {
        WasteUnit waste = lockActiveWaste(wasteId);

        if (!waste.getCurrentOwner().equals(caller)) {
            throw new UnauthorizedOperationException("Only the holder can reset confirmation of waste " + wasteId);
        }
        if (!waste.isConfirmed()) {
            throw new InvalidStateException("Waste " + wasteId + " is not confirmed");
        }

        waste.setConfirmed(false);
        waste.setConfirmer(waste.getCurrentOwner());
        waste = wasteUnitRepository.save(waste);

        log.info("Confirmation of waste {} reset by {}", wasteId, caller);
        eventPublisher.publish(EventType.CONFIRMATION_RESET, wasteId, caller, "");

        return waste;
    }

    /**
     * Permanently deactivates a unit. There is no way back.
     *
     * @throws UnauthorizedOperationException if the caller is not the administrator
     * @throws RecordNotFoundException        if the unit does not exist
     * @throws InvalidStateException          if the unit is already inactive
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public WasteUnit deactivate(@NotNull Long wasteId, @NotBlank String caller) throws ScavengerException {
        if (!adminAddress.equals(caller)) {
            throw new UnauthorizedOperationException("Only the administrator can deactivate waste");
        }

        WasteUnit waste = lockActiveWaste(wasteId);
        waste.setActive(false);
        waste = wasteUnitRepository.save(waste);

        log.info("Waste {} deactivated by {}", wasteId, caller);
        eventPublisher.publish(EventType.WASTE_DEACTIVATED, wasteId, caller, "");

        return waste;
    }

    // ==================== Queries ====================

    public Optional<WasteUnit> get(@NotNull Long wasteId) {
        return wasteUnitRepository.findById(wasteId);
    }

    /**
     * Looks up several units at once. The result has one entry per requested id, in request
     * order; unknown ids yield an empty entry.
     */
    public List<Optional<WasteUnit>> getBatch(@NotNull List<Long> wasteIds) {
        if (wasteIds.isEmpty()) {
            return List.of();
        }
        Map<Long, WasteUnit> found = wasteUnitRepository.findByIdIn(wasteIds).stream()
                .collect(Collectors.toMap(WasteUnit::getId, Function.identity()));
        return wasteIds.stream()
                .map(id -> Optional.ofNullable(found.get(id)))
                .toList();
    }

    public boolean exists(@NotNull Long wasteId) {
        return wasteUnitRepository.existsById(wasteId);
    }

    /**
     * IDs of the units a participant submitted, holds, or sent or received in a transfer.
     * Distinct and ascending.
     */
    public List<Long> participantWastes(@NotBlank String participant) {
        return wasteUnitRepository.findIdsByParticipant(participant);
    }

    // ==================== Private Helper Methods ====================

    /**
     * Locks a unit for update and requires it to be active.
     */
    private WasteUnit lockActiveWaste(Long wasteId) throws ScavengerException {
        WasteUnit waste = wasteUnitRepository.findByIdForUpdate(wasteId)
                .orElseThrow(() -> new RecordNotFoundException("Waste not found: " + wasteId));
        if (!waste.isActive()) {
            throw new InvalidStateException("Waste " + wasteId + " is deactivated");
        }
        return waste;
    }

    private WasteUnit newWasteUnit(WasteType category, Long weight, String submitter, String owner,
                                   Long latitude, Long longitude) {
        WasteUnit waste = new WasteUnit();
        waste.setId(identifierAllocator.next(IdKind.WASTE));
        waste.setCategory(category);
        waste.setWeight(weight);
        waste.setSubmitter(submitter);
        waste.setCurrentOwner(owner);
        waste.setStatus(WasteStatus.PENDING);
        waste.setConfirmed(false);
        waste.setConfirmer(submitter);
        waste.setActive(true);
        waste.setLatitude(latitude);
        waste.setLongitude(longitude);
        waste.setCreatedAt(LocalDateTime.now());
        return waste;
    }

    private static void validateLocation(long latitude, long longitude) throws InvalidInputException {
        if (latitude < -MAX_LATITUDE || latitude > MAX_LATITUDE) {
            throw new InvalidInputException("Latitude out of range: " + latitude);
        }
        if (longitude < -MAX_LONGITUDE || longitude > MAX_LONGITUDE) {
            throw new InvalidInputException("Longitude out of range: " + longitude);
        }
    }
}
