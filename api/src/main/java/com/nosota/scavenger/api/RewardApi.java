package com.nosota.scavenger.api;

import com.nosota.scavenger.api.dto.PagedResponse;
import com.nosota.scavenger.api.dto.RewardPayoutDTO;
import com.nosota.scavenger.api.request.SettleRewardsRequest;
import com.nosota.scavenger.api.response.SettlementResponse;
import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Reward API interface for incentive settlement.
 *
 * <p>Settlement pays the reward of one waste unit out of one incentive program:
 * <ul>
 *   <li>every collector in the transfer chain receives the collector percentage</li>
 *   <li>the submitter receives the owner percentage</li>
 *   <li>the current holder receives the remainder</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>RewardController - in service module (server-side implementation)</li>
 *   <li>RewardClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/rewards")
public interface RewardApi {

    /**
     * Settles rewards for a waste unit against an incentive program.
     *
     * @param request Waste unit, program and issuer
     * @return Executed settlement with all payouts
     */
    @PostMapping("/settle")
    ResponseEntity<SettlementResponse> settleRewards(
            @RequestBody @Valid SettleRewardsRequest request) throws Exception;

    /**
     * Calculates a settlement without executing it.
     */
    @GetMapping("/preview")
    ResponseEntity<SettlementResponse> previewRewards(
            @RequestParam("wasteId") Long wasteId,
            @RequestParam("incentiveId") Long incentiveId,
            @RequestParam("issuer") String issuer) throws Exception;

    /**
     * Gets payouts received by a participant, newest first.
     *
     * @param participant Participant address
     * @param page        Page number (0-indexed)
     * @param size        Page size
     * @return Paginated list of payouts
     */
    @GetMapping("/participants/{participant}/payouts")
    ResponseEntity<PagedResponse<RewardPayoutDTO>> getParticipantPayouts(
            @PathVariable("participant") String participant,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);

    @GetMapping("/stats")
    ResponseEntity<SupplyChainStatsResponse> getSupplyChainStats();
}
