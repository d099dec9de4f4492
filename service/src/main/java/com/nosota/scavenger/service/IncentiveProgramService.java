package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.error.*;
import com.nosota.scavenger.event.EventType;
import com.nosota.scavenger.event.LifecycleEventPublisher;
import com.nosota.scavenger.model.Capability;
import com.nosota.scavenger.model.IdKind;
import com.nosota.scavenger.model.IncentiveProgram;
import com.nosota.scavenger.repository.IncentiveProgramRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Manufacturer-funded incentive programs.
 *
 * <p>Budget accounting: {@code used = totalBudget - remainingBudget}. Updating the budget
 * carries the used part over, and a program whose remaining budget reaches 0 is
 * deactivated.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class IncentiveProgramService {

    private final IncentiveProgramRepository incentiveProgramRepository;
    private final IdentifierAllocator identifierAllocator;
    private final ParticipantDirectory participantDirectory;
    private final LifecycleEventPublisher eventPublisher;

    /**
     * Creates an active incentive program with its full budget remaining.
     *
     * @param issuer      Manufacturer funding the program
     * @param category    Waste category the program rewards
     * @param rewardRate  Tokens per whole kilogram, must be positive
     * @param totalBudget Budget in tokens, must be positive
     * @return The created program
     * @throws UnauthorizedOperationException if the issuer is not a manufacturer
     * @throws InvalidInputException          if rate or budget is not positive
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public IncentiveProgram create(@NotBlank String issuer, @NotNull WasteType category,
                                   @NotNull Long rewardRate, @NotNull Long totalBudget) throws ScavengerException {
        // 1. Validate before allocating an id
        if (!participantDirectory.hasCapability(issuer, Capability.MANUFACTURE)) {
            throw new UnauthorizedOperationException("Only manufacturers can create incentives: " + issuer);
        }
        validateTerms(rewardRate, totalBudget);

        // 2. Create
        IncentiveProgram program = new IncentiveProgram();
        program.setId(identifierAllocator.next(IdKind.INCENTIVE));
        program.setIssuer(issuer);
        program.setCategory(category);
        program.setRewardRate(rewardRate);
        program.setTotalBudget(totalBudget);
        program.setRemainingBudget(totalBudget);
        program.setActive(true);
        program.setCreatedAt(LocalDateTime.now());
        program = incentiveProgramRepository.save(program);

        log.info("Created incentive {}: issuer={}, category={}, rate={}, budget={}",
                program.getId(), issuer, category, rewardRate, totalBudget);
        eventPublisher.publish(EventType.INCENTIVE_CREATED, program.getId(), issuer,
                "category=" + category + " rate=" + rewardRate + " budget=" + totalBudget);

        return program;
    }

    /**
     * Changes rate and budget of an active program.
     *
     * <p>{@code remaining = max(newTotalBudget - used, 0)}; a remaining budget of 0
     * deactivates the program.
     *
     * @throws RecordNotFoundException        if the program does not exist
     * @throws UnauthorizedOperationException if the caller is not the issuer
     * @throws InvalidStateException          if the program is inactive
     * @throws InvalidInputException          if rate or budget is not positive
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public IncentiveProgram update(@NotNull Long incentiveId, @NotBlank String caller,
                                   @NotNull Long newRewardRate, @NotNull Long newTotalBudget) throws ScavengerException {
        IncentiveProgram program = lockProgram(incentiveId);

        if (!program.getIssuer().equals(caller)) {
            throw new UnauthorizedOperationException("Only the issuer can update incentive " + incentiveId);
        }
        if (!program.isActive()) {
            throw new InvalidStateException("Incentive " + incentiveId + " is not active");
        }
        validateTerms(newRewardRate, newTotalBudget);

        long used = program.getTotalBudget() - program.getRemainingBudget();
        long remaining = Math.max(newTotalBudget - used, 0L);

        program.setRewardRate(newRewardRate);
        program.setTotalBudget(newTotalBudget);
        program.setRemainingBudget(remaining);
        if (remaining == 0L) {
            program.setActive(false);
        }
        program = incentiveProgramRepository.save(program);

        log.info("Updated incentive {}: rate={}, budget={}, remaining={}, active={}",
                incentiveId, newRewardRate, newTotalBudget, remaining, program.isActive());
        eventPublisher.publish(EventType.INCENTIVE_UPDATED, incentiveId, caller,
                "rate=" + newRewardRate + " budget=" + newTotalBudget + " remaining=" + remaining);

        return program;
    }

    /**
     * Activates or deactivates a program.
     *
     * @throws RecordNotFoundException        if the program does not exist
     * @throws UnauthorizedOperationException if the caller is not the issuer
     * @throws InvalidStateException          if reactivating a program with no budget left
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public IncentiveProgram setActive(@NotNull Long incentiveId, @NotBlank String caller, boolean active)
            throws ScavengerException {
        IncentiveProgram program = lockProgram(incentiveId);

        if (!program.getIssuer().equals(caller)) {
            throw new UnauthorizedOperationException("Only the issuer can change incentive " + incentiveId);
        }
        if (active && program.getRemainingBudget() == 0L) {
            throw new InvalidStateException("Incentive " + incentiveId + " has no budget left");
        }

        program.setActive(active);
        program = incentiveProgramRepository.save(program);

        log.info("Incentive {} active={}", incentiveId, active);
        eventPublisher.publish(EventType.INCENTIVE_ACTIVATION_CHANGED, incentiveId, caller, "active=" + active);

        return program;
    }

    // ==================== Queries ====================

    public Optional<IncentiveProgram> byId(@NotNull Long incentiveId) {
        return incentiveProgramRepository.findById(incentiveId);
    }

    public boolean exists(@NotNull Long incentiveId) {
        return incentiveProgramRepository.existsById(incentiveId);
    }

    public List<Long> byIssuer(@NotBlank String issuer) {
        return incentiveProgramRepository.findIdsByIssuer(issuer);
    }

    public List<Long> byCategory(@NotNull WasteType category) {
        return incentiveProgramRepository.findIdsByCategory(category);
    }

    /**
     * The issuer's active program with the highest reward rate for a category.
     * The earliest created program wins a tie.
     */
    public Optional<IncentiveProgram> bestActiveFor(@NotBlank String issuer, @NotNull WasteType category) {
        return incentiveProgramRepository
                .findByIssuerAndCategoryAndActiveTrueOrderByRewardRateDescIdAsc(issuer, category)
                .stream()
                .findFirst();
    }

    /**
     * All active programs for a category, highest reward rate first, ties in creation order.
     */
    public List<IncentiveProgram> allActiveFor(@NotNull WasteType category) {
        return incentiveProgramRepository.findByCategoryAndActiveTrueOrderByRewardRateDescIdAsc(category);
    }

    // ==================== Private Helper Methods ====================

    private IncentiveProgram lockProgram(Long incentiveId) throws RecordNotFoundException {
        return incentiveProgramRepository.findByIdForUpdate(incentiveId)
                .orElseThrow(() -> new RecordNotFoundException("Incentive not found: " + incentiveId));
    }

    private static void validateTerms(long rewardRate, long totalBudget) throws InvalidInputException {
        if (rewardRate <= 0) {
            throw new InvalidInputException("Reward rate must be positive, got " + rewardRate);
        }
        if (totalBudget <= 0) {
            throw new InvalidInputException("Total budget must be positive, got " + totalBudget);
        }
    }
}
