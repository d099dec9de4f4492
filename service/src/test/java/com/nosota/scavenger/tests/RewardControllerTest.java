package com.nosota.scavenger.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.scavenger.TestBase;
import com.nosota.scavenger.api.dto.PagedResponse;
import com.nosota.scavenger.api.dto.RewardPayoutDTO;
import com.nosota.scavenger.api.model.ParticipantRole;
import com.nosota.scavenger.api.model.PayoutShare;
import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.api.request.SettleRewardsRequest;
import com.nosota.scavenger.api.response.SettlementResponse;
import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import com.nosota.scavenger.model.IncentiveProgram;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Settlement, payouts and statistics through the REST API.
 */
@DisplayName("9. Reward Controller Tests")
public class RewardControllerTest extends TestBase {

    @Test
    @DisplayName("RCT-001: Preview then settle a full chain")
    void fullFlow_PreviewThenSettle_ShouldSucceed() throws Exception {
        SupplyChain chain = buildChain(WasteType.PLASTIC, 5000L);
        String issuer = registerParticipant(ParticipantRole.MANUFACTURER);
        IncentiveProgram program = createIncentive(issuer, WasteType.PLASTIC, 100L, 10_000L);

        mockMvc.perform(get("/api/v1/rewards/preview")
                        .param("wasteId", chain.wasteId().toString())
                        .param("incentiveId", program.getId().toString())
                        .param("issuer", issuer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalReward").value(500))
                .andExpect(jsonPath("$.remainingBudget").value(9500))
                .andExpect(jsonPath("$.payouts.length()").value(3));

        MvcResult result = mockMvc.perform(post("/api/v1/rewards/settle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SettleRewardsRequest(chain.wasteId(), program.getId(), issuer))))
                .andExpect(status().isCreated())
                .andReturn();

        SettlementResponse settlement = objectMapper.readValue(
                result.getResponse().getContentAsString(), SettlementResponse.class);
        assertThat(settlement.totalReward()).isEqualTo(500L);
        assertThat(settlement.remainingBudget()).isEqualTo(9_500L);
        assertThat(settlement.incentiveActive()).isTrue();
        assertThat(settlement.payouts())
                .extracting(RewardPayoutDTO::payee, RewardPayoutDTO::share, RewardPayoutDTO::amount)
                .containsExactly(
                        tuple(chain.collector(), PayoutShare.COLLECTOR, 50L),
                        tuple(chain.recycler(), PayoutShare.SUBMITTER, 100L),
                        tuple(chain.manufacturer(), PayoutShare.HOLDER, 350L));
        assertThat(settlement.payouts()).allSatisfy(payout -> assertThat(payout.id()).isNotNull());

        mockMvc.perform(get("/api/v1/participants/{address}", chain.manufacturer()))
                .andExpect(jsonPath("$.totalTokensEarned").value(350));
    }

    @Test
    @DisplayName("RCT-002: Settlement errors map to their status codes")
    void settleRewards_WhenRejected_ShouldReturnErrorCodes() throws Exception {
        SupplyChain chain = buildChain(WasteType.METAL, 5000L);
        String otherManufacturer = registerParticipant(ParticipantRole.MANUFACTURER);
        IncentiveProgram small = createIncentive(chain.manufacturer(), WasteType.METAL, 100L, 100L);
        IncentiveProgram paper = createIncentive(chain.manufacturer(), WasteType.PAPER, 100L, 10_000L);

        settle(new SettleRewardsRequest(chain.wasteId(), small.getId(), chain.manufacturer()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_BUDGET"));

        settle(new SettleRewardsRequest(chain.wasteId(), paper.getId(), chain.manufacturer()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        settle(new SettleRewardsRequest(chain.wasteId(), small.getId(), otherManufacturer))
                .andExpect(status().isForbidden());

        settle(new SettleRewardsRequest(999_004L, small.getId(), chain.manufacturer()))
                .andExpect(status().isNotFound());

        settle(new SettleRewardsRequest(null, small.getId(), chain.manufacturer()))
                .andExpect(status().isBadRequest());

        IncentiveProgram huge = createIncentive(chain.manufacturer(), WasteType.METAL, Long.MAX_VALUE / 2, Long.MAX_VALUE);
        settle(new SettleRewardsRequest(chain.wasteId(), huge.getId(), chain.manufacturer()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("OVERFLOW"));
    }

    @Test
    @DisplayName("RCT-003: Payout history is paged")
    void getParticipantPayouts_ShouldReturnPage() throws Exception {
        SupplyChain chain = buildChain(WasteType.GLASS, 3000L);
        IncentiveProgram program = createIncentive(chain.manufacturer(), WasteType.GLASS, 10L, 1_000L);
        rewardSettlementService.settle(chain.wasteId(), program.getId(), chain.manufacturer());

        MvcResult result = mockMvc.perform(get("/api/v1/rewards/participants/{participant}/payouts", chain.recycler())
                        .param("page", "0")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andReturn();

        PagedResponse<RewardPayoutDTO> page = objectMapper.readValue(
                result.getResponse().getContentAsString(), new TypeReference<>() {});
        assertThat(page.getTotalRecords()).isEqualTo(1);
        assertThat(page.getData()).singleElement()
                .satisfies(payout -> {
                    assertThat(payout.share()).isEqualTo(PayoutShare.SUBMITTER);
                    assertThat(payout.amount()).isEqualTo(6L);
                    assertThat(payout.payer()).isEqualTo(chain.manufacturer());
                });

        mockMvc.perform(get("/api/v1/rewards/participants/{participant}/payouts", "rest-nobody"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(0))
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("RCT-004: Statistics endpoint")
    void getSupplyChainStats_ShouldReflectActivity() throws Exception {
        SupplyChainStatsResponse before = supplyChainStatisticService.getSupplyChainStats();
        buildChain(WasteType.PAPER, 2500L);

        MvcResult result = mockMvc.perform(get("/api/v1/rewards/stats"))
                .andExpect(status().isOk())
                .andReturn();
        SupplyChainStatsResponse after = objectMapper.readValue(
                result.getResponse().getContentAsString(), SupplyChainStatsResponse.class);

        assertThat(after.totalWastes()).isEqualTo(before.totalWastes() + 1);
        assertThat(after.totalActiveWeight()).isEqualTo(before.totalActiveWeight() + 2500L);
        assertThat(after.totalTokensEarned()).isEqualTo(before.totalTokensEarned());
    }

    private ResultActions settle(SettleRewardsRequest request) throws Exception {
        return mockMvc.perform(post("/api/v1/rewards/settle")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }
}
