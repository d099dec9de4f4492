package com.nosota.scavenger.tests;

import com.nosota.scavenger.TestBase;
import com.nosota.scavenger.api.model.ParticipantRole;
import com.nosota.scavenger.api.model.PayoutShare;
import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import com.nosota.scavenger.dto.RewardDistribution;
import com.nosota.scavenger.error.InsufficientBudgetException;
import com.nosota.scavenger.error.InvalidInputException;
import com.nosota.scavenger.error.InvalidStateException;
import com.nosota.scavenger.error.RecordNotFoundException;
import com.nosota.scavenger.error.RewardOverflowException;
import com.nosota.scavenger.error.UnauthorizedOperationException;
import com.nosota.scavenger.model.IncentiveProgram;
import com.nosota.scavenger.model.RewardPayout;
import com.nosota.scavenger.model.WasteUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Settlement against a 10% collector share and a 20% owner share.
 */
@DisplayName("4. Reward Settlement Tests")
public class RewardSettlementTest extends TestBase {

    @Test
    @DisplayName("RWD-001: Reward is split between collector, submitter and holder")
    void testSettleFullChain() throws Exception {
        SupplyChain chain = buildChain(WasteType.PLASTIC, 5000L);
        String issuer = registerParticipant(ParticipantRole.MANUFACTURER);
        IncentiveProgram program = createIncentive(issuer, WasteType.PLASTIC, 100L, 10_000L);

        RewardDistribution distribution = rewardSettlementService.settle(chain.wasteId(), program.getId(), issuer);

        assertThat(distribution.totalReward()).isEqualTo(500L);
        assertThat(distribution.remainingBudgetAfter()).isEqualTo(9_500L);
        assertThat(distribution.incentiveActiveAfter()).isTrue();
        assertThat(distribution.payouts())
                .extracting(RewardPayout::getPayee, RewardPayout::getShare, RewardPayout::getAmount)
                .containsExactly(
                        tuple(chain.collector(), PayoutShare.COLLECTOR, 50L),
                        tuple(chain.recycler(), PayoutShare.SUBMITTER, 100L),
                        tuple(chain.manufacturer(), PayoutShare.HOLDER, 350L));
        assertThat(distribution.payouts()).allSatisfy(payout -> {
            assertThat(payout.getId()).isNotNull();
            assertThat(payout.getPayer()).isEqualTo(issuer);
            assertThat(payout.getWasteId()).isEqualTo(chain.wasteId());
        });

        assertThat(incentiveProgramService.byId(program.getId()).orElseThrow().getRemainingBudget())
                .isEqualTo(9_500L);
        assertThat(participantService.get(chain.collector()).orElseThrow().getTotalTokensEarned()).isEqualTo(50L);
        assertThat(participantService.get(chain.recycler()).orElseThrow().getTotalTokensEarned()).isEqualTo(100L);
        assertThat(participantService.get(chain.manufacturer()).orElseThrow().getTotalTokensEarned()).isEqualTo(350L);
        assertThat(participantService.get(issuer).orElseThrow().getTotalTokensEarned()).isZero();
    }

    @Test
    @DisplayName("RWD-002: Submitter who still holds the unit earns both shares")
    void testSettleWithoutTransfers() throws Exception {
        String recycler = registerParticipant(ParticipantRole.RECYCLER);
        String issuer = registerParticipant(ParticipantRole.MANUFACTURER);
        WasteUnit waste = submitWaste(recycler, WasteType.PAPER, 2500L);
        IncentiveProgram program = createIncentive(issuer, WasteType.PAPER, 100L, 1_000L);

        RewardDistribution distribution = rewardSettlementService.settle(waste.getId(), program.getId(), issuer);

        // 2 whole kilograms
        assertThat(distribution.totalReward()).isEqualTo(200L);
        assertThat(distribution.payouts())
                .extracting(RewardPayout::getShare, RewardPayout::getAmount)
                .containsExactly(tuple(PayoutShare.SUBMITTER, 40L), tuple(PayoutShare.HOLDER, 160L));
        assertThat(participantService.get(recycler).orElseThrow().getTotalTokensEarned()).isEqualTo(200L);
    }

    @Test
    @DisplayName("RWD-003: Insufficient budget changes nothing")
    void testInsufficientBudget() throws Exception {
        SupplyChain first = buildChain(WasteType.GLASS, 5000L);
        SupplyChain second = buildChain(WasteType.GLASS, 5000L);
        String issuer = registerParticipant(ParticipantRole.MANUFACTURER);
        IncentiveProgram program = createIncentive(issuer, WasteType.GLASS, 100L, 800L);

        rewardSettlementService.settle(first.wasteId(), program.getId(), issuer);
        SupplyChainStatsResponse statsBefore = supplyChainStatisticService.getSupplyChainStats();

        assertThatThrownBy(() -> rewardSettlementService.settle(second.wasteId(), program.getId(), issuer))
                .isInstanceOf(InsufficientBudgetException.class);

        IncentiveProgram reloaded = incentiveProgramService.byId(program.getId()).orElseThrow();
        assertThat(reloaded.getRemainingBudget()).isEqualTo(300L);
        assertThat(reloaded.isActive()).isTrue();
        assertThat(participantService.get(second.collector()).orElseThrow().getTotalTokensEarned()).isZero();
        assertThat(rewardSettlementService.payoutsOf(second.recycler(), PageRequest.of(0, 10))).isEmpty();
        assertThat(supplyChainStatisticService.getSupplyChainStats().totalTokensEarned())
                .isEqualTo(statsBefore.totalTokensEarned());
    }

    @Test
    @DisplayName("RWD-004: Spending the exact remaining budget deactivates the program")
    void testExactBudgetDeactivates() throws Exception {
        SupplyChain chain = buildChain(WasteType.METAL, 5000L);
        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.METAL, 100L, 500L);

        RewardDistribution distribution = rewardSettlementService.settle(
                chain.wasteId(), program.getId(), chain.manufacturer());

        assertThat(distribution.remainingBudgetAfter()).isZero();
        assertThat(distribution.incentiveActiveAfter()).isFalse();

        IncentiveProgram reloaded = incentiveProgramService.byId(program.getId()).orElseThrow();
        assertThat(reloaded.getRemainingBudget()).isZero();
        assertThat(reloaded.isActive()).isFalse();

        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), program.getId(), chain.manufacturer()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("RWD-005: Settlement preconditions")
    void testSettlePreconditions() throws Exception {
        SupplyChain chain = buildChain(WasteType.PLASTIC, 3000L);
        String otherManufacturer = registerParticipant(ParticipantRole.MANUFACTURER);
        IncentiveProgram glass = createIncentive(chain.manufacturer(), WasteType.GLASS, 10L, 1_000L);
        IncentiveProgram plastic = createIncentive(chain.manufacturer(), WasteType.PLASTIC, 10L, 1_000L);

        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), glass.getId(), chain.manufacturer()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), plastic.getId(), otherManufacturer))
                .isInstanceOf(UnauthorizedOperationException.class);
        assertThatThrownBy(() -> rewardSettlementService.settle(333_333L, plastic.getId(), chain.manufacturer()))
                .isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), 333_333L, chain.manufacturer()))
                .isInstanceOf(RecordNotFoundException.class);

        incentiveProgramService.setActive(plastic.getId(), chain.manufacturer(), false);
        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), plastic.getId(), chain.manufacturer()))
                .isInstanceOf(InvalidStateException.class);

        incentiveProgramService.setActive(plastic.getId(), chain.manufacturer(), true);
        wasteRegistryService.deactivate(chain.wasteId(), adminAddress);
        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), plastic.getId(), chain.manufacturer()))
                .isInstanceOf(InvalidStateException.class);

        assertThat(incentiveProgramService.byId(plastic.getId()).orElseThrow().getRemainingBudget())
                .isEqualTo(1_000L);
    }

    @Test
    @DisplayName("RWD-006: Overflowing reward is rejected")
    void testRewardOverflow() throws Exception {
        SupplyChain chain = buildChain(WasteType.PET_PLASTIC, 5000L);
        IncentiveProgram program = createIncentive(
                chain.manufacturer(), WasteType.PET_PLASTIC, Long.MAX_VALUE / 2, Long.MAX_VALUE);

        assertThatThrownBy(() -> rewardSettlementService.settle(chain.wasteId(), program.getId(), chain.manufacturer()))
                .isInstanceOf(RewardOverflowException.class);

        assertThat(incentiveProgramService.byId(program.getId()).orElseThrow().getRemainingBudget())
                .isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("RWD-007: Zero shares are not paid")
    void testZeroShareSkipped() throws Exception {
        SupplyChain chain = buildChain(WasteType.PAPER, 1000L);
        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.PAPER, 5L, 100L);

        RewardDistribution distribution = rewardSettlementService.settle(
                chain.wasteId(), program.getId(), chain.manufacturer());

        assertThat(distribution.totalReward()).isEqualTo(5L);
        assertThat(distribution.payouts())
                .extracting(RewardPayout::getShare, RewardPayout::getAmount)
                .containsExactly(tuple(PayoutShare.SUBMITTER, 1L), tuple(PayoutShare.HOLDER, 4L));
        assertThat(participantService.get(chain.collector()).orElseThrow().getTotalTokensEarned()).isZero();
    }

    @Test
    @DisplayName("RWD-008: Less than a kilogram earns nothing")
    void testPartialKilogram() throws Exception {
        SupplyChain chain = buildChain(WasteType.PAPER, 999L);
        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.PAPER, 1_000L, 100L);

        RewardDistribution distribution = rewardSettlementService.settle(
                chain.wasteId(), program.getId(), chain.manufacturer());

        assertThat(distribution.totalReward()).isZero();
        assertThat(distribution.payouts()).isEmpty();
        assertThat(incentiveProgramService.byId(program.getId()).orElseThrow().getRemainingBudget()).isEqualTo(100L);
    }

    @Test
    @DisplayName("RWD-009: Preview calculates without paying")
    void testPreview() throws Exception {
        SupplyChain chain = buildChain(WasteType.PLASTIC, 5000L);
        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.PLASTIC, 100L, 10_000L);

        RewardDistribution preview = rewardSettlementService.preview(
                chain.wasteId(), program.getId(), chain.manufacturer());

        assertThat(preview.totalReward()).isEqualTo(500L);
        assertThat(preview.remainingBudgetAfter()).isEqualTo(9_500L);
        assertThat(preview.payouts()).hasSize(3).allSatisfy(payout -> assertThat(payout.getId()).isNull());

        assertThat(incentiveProgramService.byId(program.getId()).orElseThrow().getRemainingBudget())
                .isEqualTo(10_000L);
        assertThat(participantService.get(chain.recycler()).orElseThrow().getTotalTokensEarned()).isZero();
        assertThat(rewardSettlementService.payoutsOf(chain.recycler(), PageRequest.of(0, 10))).isEmpty();

        assertThatThrownBy(() -> rewardSettlementService.preview(chain.wasteId(), program.getId(), "someone-else"))
                .isInstanceOf(UnauthorizedOperationException.class);
    }

    @Test
    @DisplayName("RWD-010: Re-settling a unit is bounded by the budget only")
    void testRepeatedSettlement() throws Exception {
        SupplyChain chain = buildChain(WasteType.GLASS, 2000L);
        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.GLASS, 100L, 1_000L);

        rewardSettlementService.settle(chain.wasteId(), program.getId(), chain.manufacturer());
        rewardSettlementService.settle(chain.wasteId(), program.getId(), chain.manufacturer());

        assertThat(incentiveProgramService.byId(program.getId()).orElseThrow().getRemainingBudget()).isEqualTo(600L);
        // 2 x 20% of 200
        assertThat(participantService.get(chain.recycler()).orElseThrow().getTotalTokensEarned()).isEqualTo(80L);
    }

    @Test
    @DisplayName("RWD-011: Payouts of a participant are paged newest first")
    void testPayoutsPaging() throws Exception {
        String recycler = registerParticipant(ParticipantRole.RECYCLER);
        String issuer = registerParticipant(ParticipantRole.MANUFACTURER);
        IncentiveProgram program = createIncentive(issuer, WasteType.METAL, 10L, 10_000L);

        for (int i = 0; i < 3; i++) {
            WasteUnit waste = submitWaste(recycler, WasteType.METAL, 1000L * (i + 1));
            rewardSettlementService.settle(waste.getId(), program.getId(), issuer);
        }

        // Each settlement pays the recycler twice: submitter and holder
        Page<RewardPayout> firstPage = rewardSettlementService.payoutsOf(recycler, PageRequest.of(0, 4));
        assertThat(firstPage.getTotalElements()).isEqualTo(6);
        assertThat(firstPage.getTotalPages()).isEqualTo(2);
        assertThat(firstPage.getContent()).hasSize(4);
        assertThat(firstPage.getContent().get(0).getId())
                .isGreaterThan(firstPage.getContent().get(3).getId());

        Page<RewardPayout> secondPage = rewardSettlementService.payoutsOf(recycler, PageRequest.of(1, 4));
        assertThat(secondPage.getContent()).hasSize(2);
        assertThat(secondPage.getContent().get(0).getId())
                .isLessThan(firstPage.getContent().get(3).getId());
    }

    @Test
    @DisplayName("RWD-012: Statistics follow submissions, deactivations and payouts")
    void testStatistics() throws Exception {
        SupplyChainStatsResponse before = supplyChainStatisticService.getSupplyChainStats();

        SupplyChain chain = buildChain(WasteType.PLASTIC, 5000L);
        String recycler = registerParticipant(ParticipantRole.RECYCLER);
        WasteUnit discarded = submitWaste(recycler, WasteType.PLASTIC, 700L);
        wasteRegistryService.deactivate(discarded.getId(), adminAddress);

        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.PLASTIC, 100L, 10_000L);
        rewardSettlementService.settle(chain.wasteId(), program.getId(), chain.manufacturer());

        SupplyChainStatsResponse after = supplyChainStatisticService.getSupplyChainStats();
        assertThat(after.totalWastes() - before.totalWastes()).isEqualTo(2L);
        assertThat(after.totalActiveWeight() - before.totalActiveWeight()).isEqualTo(5000L);
        assertThat(after.totalTokensEarned() - before.totalTokensEarned()).isEqualTo(500L);
    }
}
