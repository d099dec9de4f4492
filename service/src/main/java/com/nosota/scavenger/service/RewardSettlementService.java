package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.PayoutShare;
import com.nosota.scavenger.dto.RewardDistribution;
import com.nosota.scavenger.error.*;
import com.nosota.scavenger.event.EventType;
import com.nosota.scavenger.event.LifecycleEventPublisher;
import com.nosota.scavenger.model.Capability;
import com.nosota.scavenger.model.IncentiveProgram;
import com.nosota.scavenger.model.RewardPayout;
import com.nosota.scavenger.model.TransferRecord;
import com.nosota.scavenger.model.WasteUnit;
import com.nosota.scavenger.repository.IncentiveProgramRepository;
import com.nosota.scavenger.repository.RewardPayoutRepository;
import com.nosota.scavenger.repository.TransferRecordRepository;
import com.nosota.scavenger.repository.WasteUnitRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for reward settlement.
 *
 * <p>Settlement pays the reward of one waste unit out of one incentive program,
 * split across the supply chain:
 * <ul>
 *   <li>every transfer recipient holding COLLECT_WASTE gets the collector percentage</li>
 *   <li>the submitter gets the owner percentage</li>
 *   <li>the current holder gets the remainder</li>
 * </ul>
 *
 * <p>Settlement workflow:
 * <pre>
 * 1. Lock and check the waste unit
 * 2. Lock and check the incentive program
 * 3. Calculate the distribution (no writes)
 * 4. Check every payee's lifetime earnings for overflow (no writes)
 * 5. Pay each share through the {@link TokenTransferGateway}
 * 6. Debit the program budget, deactivating it at 0
 * 7. Record lifetime earnings
 * </pre>
 *
 * <p>Every failure is raised before step 5, and the whole call is one transaction.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RewardSettlementService {

    private final WasteUnitRepository wasteUnitRepository;
    private final IncentiveProgramRepository incentiveProgramRepository;
    private final TransferRecordRepository transferRecordRepository;
    private final RewardPayoutRepository rewardPayoutRepository;
    private final ParticipantDirectory participantDirectory;
    private final ParticipantService participantService;
    private final TokenTransferGateway tokenTransferGateway;
    private final RewardSplitCalculator splitCalculator;
    private final LifecycleEventPublisher eventPublisher;

    /**
     * Calculates the settlement of a waste unit without executing it.
     *
     * <p>Runs the same checks as {@link #settle} and fails the same way.
     *
     * @param wasteId     Waste unit to settle
     * @param incentiveId Funding program
     * @param issuer      Caller, must be the program issuer
     * @return Distribution with unsaved payouts
     */
    public RewardDistribution preview(@NotNull Long wasteId, @NotNull Long incentiveId, @NotBlank String issuer)
            throws ScavengerException {
        WasteUnit waste = wasteUnitRepository.findById(wasteId)
                .orElseThrow(() -> new RecordNotFoundException("Waste not found: " + wasteId));
        checkWaste(waste);

        IncentiveProgram program = incentiveProgramRepository.findById(incentiveId)
                .orElseThrow(() -> new RecordNotFoundException("Incentive not found: " + incentiveId));
        checkProgram(program, waste, issuer);

        return calculateDistribution(waste, program);
    }

    /**
     * Settles the reward of a waste unit against an incentive program.
     *
     * @param wasteId     Waste unit to settle
     * @param incentiveId Funding program
     * @param issuer      Caller, must be the program issuer
     * @return Executed distribution with the recorded payouts
     * @throws RecordNotFoundException        if the unit or the program does not exist
     * @throws InvalidStateException          if the unit is inactive or not yet weighed, or the
     *                                        program is inactive
     * @throws UnauthorizedOperationException if the caller is not the issuer
     * @throws InvalidInputException          if unit and program categories differ
     * @throws InsufficientBudgetException    if the reward exceeds the remaining budget
     * @throws RewardOverflowException        if any amount overflows
     */
    @Transactional(rollbackOn = Exception.class)
    public RewardDistribution settle(@NotNull Long wasteId, @NotNull Long incentiveId, @NotBlank String issuer)
            throws ScavengerException {
        log.info("Settling rewards for waste {} against incentive {}", wasteId, incentiveId);

        // 1. Lock and check the waste unit
        WasteUnit waste = wasteUnitRepository.findByIdForUpdate(wasteId)
                .orElseThrow(() -> new RecordNotFoundException("Waste not found: " + wasteId));
        checkWaste(waste);

        // 2. Lock and check the program
        IncentiveProgram program = incentiveProgramRepository.findByIdForUpdate(incentiveId)
                .orElseThrow(() -> new RecordNotFoundException("Incentive not found: " + incentiveId));
        checkProgram(program, waste, issuer);

        // 3. Calculate
        RewardDistribution distribution = calculateDistribution(waste, program);

        // 4. Earnings headroom
        Map<String, Long> earningsByPayee = earningsByPayee(distribution.payouts());
        participantService.checkEarningsHeadroom(earningsByPayee);

        // 5. Pay
        List<RewardPayout> recorded = new ArrayList<>();
        for (RewardPayout payout : distribution.payouts()) {
            recorded.add(tokenTransferGateway.transfer(wasteId, incentiveId, program.getIssuer(),
                    payout.getPayee(), payout.getShare(), payout.getAmount()));
        }

        // 6. Debit budget
        program.setRemainingBudget(distribution.remainingBudgetAfter());
        program.setActive(distribution.incentiveActiveAfter());
        incentiveProgramRepository.save(program);

        if (!distribution.incentiveActiveAfter()) {
            log.info("Incentive {} exhausted its budget and was deactivated", incentiveId);
        }

        // 7. Lifetime earnings
        for (Map.Entry<String, Long> entry : earningsByPayee.entrySet()) {
            participantService.recordEarnings(entry.getKey(), entry.getValue());
        }

        log.info("Settled waste {} against incentive {}: total={}, payouts={}, remainingBudget={}",
                wasteId, incentiveId, distribution.totalReward(), recorded.size(),
                distribution.remainingBudgetAfter());
        eventPublisher.publish(EventType.REWARDS_SETTLED, wasteId, issuer,
                "incentive=" + incentiveId + " total=" + distribution.totalReward());

        return distribution.toBuilder()
                .payouts(recorded)
                .build();
    }

    /**
     * Payouts received by a participant, newest first.
     */
    public Page<RewardPayout> payoutsOf(@NotBlank String participant, Pageable pageable) {
        return rewardPayoutRepository.findByPayeeOrderByIdDesc(participant, pageable);
    }

    // ==================== Private Helper Methods ====================

    private void checkWaste(WasteUnit waste) throws ScavengerException {
        if (!waste.isActive()) {
            throw new InvalidStateException("Waste " + waste.getId() + " is deactivated");
        }
        if (waste.getWeight() == 0L) {
            throw new InvalidStateException("Waste " + waste.getId() + " has not been weighed yet");
        }
    }

    private void checkProgram(IncentiveProgram program, WasteUnit waste, String issuer) throws ScavengerException {
        if (!program.getIssuer().equals(issuer)) {
            throw new UnauthorizedOperationException(
                    String.format("Participant %s is not the issuer of incentive %d", issuer, program.getId()));
        }
        if (!program.isActive()) {
            throw new InvalidStateException("Incentive " + program.getId() + " is not active");
        }
        if (program.getCategory() != waste.getCategory()) {
            throw new InvalidInputException(String.format(
                    "Incentive %d rewards %s, waste %d is %s",
                    program.getId(), program.getCategory(), waste.getId(), waste.getCategory()));
        }
    }

    /**
     * Computes every payment of a settlement. Performs no writes.
     */
    private RewardDistribution calculateDistribution(WasteUnit waste, IncentiveProgram program)
            throws ScavengerException {
        // 1. Total reward and budget
        long totalReward = splitCalculator.totalReward(program.getRewardRate(), waste.getWeight());
        if (totalReward > program.getRemainingBudget()) {
            throw new InsufficientBudgetException(String.format(
                    "Reward %d exceeds remaining budget %d of incentive %d",
                    totalReward, program.getRemainingBudget(), program.getId()));
        }

        long collectorShare = splitCalculator.collectorShare(totalReward);
        long ownerShare = splitCalculator.ownerShare(totalReward);

        List<RewardPayout> payouts = new ArrayList<>();
        long distributed = 0L;

        // 2. Collectors along the transfer history
        List<TransferRecord> history = transferRecordRepository.findByWasteIdOrderByIdAsc(waste.getId());
        int collectorsPaid = 0;
        for (TransferRecord record : history) {
            if (participantDirectory.hasCapability(record.getToAddress(), Capability.COLLECT_WASTE)) {
                addPayout(payouts, waste, program, record.getToAddress(), PayoutShare.COLLECTOR, collectorShare);
                distributed = checkedAdd(distributed, collectorShare);
                collectorsPaid++;
            }
        }
        if (collectorsPaid > 1) {
            log.warn("Waste {} passed through {} collectors, each receives the collector share",
                    waste.getId(), collectorsPaid);
        }

        // 3. Submitter
        addPayout(payouts, waste, program, waste.getSubmitter(), PayoutShare.SUBMITTER, ownerShare);
        distributed = checkedAdd(distributed, ownerShare);

        // 4. Holder gets the remainder
        long remainder = totalReward - distributed;
        if (remainder < 0) {
            log.warn("Shares of waste {} exceed its reward: total={}, distributed={}",
                    waste.getId(), totalReward, distributed);
            throw new InvalidStateException(String.format(
                    "Shares of waste %d exceed its reward %d", waste.getId(), totalReward));
        }
        addPayout(payouts, waste, program, waste.getCurrentOwner(), PayoutShare.HOLDER, remainder);

        long remainingAfter = program.getRemainingBudget() - totalReward;

        log.debug("Distribution for waste {}: total={}, collectorShare={}, ownerShare={}, remainder={}",
                waste.getId(), totalReward, collectorShare, ownerShare, remainder);

        return RewardDistribution.builder()
                .wasteId(waste.getId())
                .incentiveId(program.getId())
                .issuer(program.getIssuer())
                .totalReward(totalReward)
                .payouts(payouts)
                .remainingBudgetAfter(remainingAfter)
                .incentiveActiveAfter(remainingAfter > 0)
                .build();
    }

    /**
     * Adds a planned payout. Zero amounts are not paid.
     */
    private static void addPayout(List<RewardPayout> payouts, WasteUnit waste, IncentiveProgram program,
                                  String payee, PayoutShare share, long amount) {
        if (amount == 0L) {
            return;
        }
        RewardPayout payout = new RewardPayout();
        payout.setWasteId(waste.getId());
        payout.setIncentiveId(program.getId());
        payout.setPayer(program.getIssuer());
        payout.setPayee(payee);
        payout.setShare(share);
        payout.setAmount(amount);
        payouts.add(payout);
    }

    private static Map<String, Long> earningsByPayee(List<RewardPayout> payouts) throws RewardOverflowException {
        Map<String, Long> earnings = new LinkedHashMap<>();
        for (RewardPayout payout : payouts) {
            long current = earnings.getOrDefault(payout.getPayee(), 0L);
            earnings.put(payout.getPayee(), checkedAdd(current, payout.getAmount()));
        }
        return earnings;
    }

    private static long checkedAdd(long a, long b) throws RewardOverflowException {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new RewardOverflowException("Overflow adding reward shares", e);
        }
    }
}
