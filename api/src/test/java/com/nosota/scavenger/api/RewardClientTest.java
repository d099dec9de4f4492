package com.nosota.scavenger.api;

import com.nosota.scavenger.api.dto.PagedResponse;
import com.nosota.scavenger.api.dto.RewardPayoutDTO;
import com.nosota.scavenger.api.model.PayoutShare;
import com.nosota.scavenger.api.request.SettleRewardsRequest;
import com.nosota.scavenger.api.response.SettlementResponse;
import com.nosota.scavenger.api.response.SupplyChainStatsResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the requests built by {@link RewardClient} and the decoding of responses,
 * against a canned exchange function instead of a running service.
 */
class RewardClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private RewardClient clientReturning(HttpStatus status, String json) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://scavenger.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(json)
                            .build());
                })
                .build();
        return new RewardClient(webClient);
    }

    @Test
    @DisplayName("Settle posts to the settle endpoint and decodes the distribution")
    void settleRewards() {
        String json = """
                {"wasteId":7,"incentiveId":3,"issuer":"maker","totalReward":500,
                 "payouts":[{"id":1,"wasteId":7,"incentiveId":3,"payer":"maker","payee":"picker",
                             "share":"COLLECTOR","amount":50,"createdAt":"2024-05-01T10:15:30"}],
                 "remainingBudget":9500,"incentiveActive":true}
                """;
        RewardClient client = clientReturning(HttpStatus.CREATED, json);

        ResponseEntity<SettlementResponse> response = client.settleRewards(new SettleRewardsRequest(7L, 3L, "maker"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().totalReward()).isEqualTo(500L);
        assertThat(response.getBody().incentiveActive()).isTrue();
        assertThat(response.getBody().payouts()).singleElement()
                .satisfies(payout -> {
                    assertThat(payout.share()).isEqualTo(PayoutShare.COLLECTOR);
                    assertThat(payout.amount()).isEqualTo(50L);
                });

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/api/v1/rewards/settle");
    }

    @Test
    @DisplayName("Preview passes ids and issuer as query parameters")
    void previewRewards() {
        String json = """
                {"wasteId":7,"incentiveId":3,"issuer":"maker","totalReward":0,"payouts":[],
                 "remainingBudget":100,"incentiveActive":true}
                """;
        RewardClient client = clientReturning(HttpStatus.OK, json);

        ResponseEntity<SettlementResponse> response = client.previewRewards(7L, 3L, "maker");

        assertThat(response.getBody().payouts()).isEmpty();
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getPath()).isEqualTo("/api/v1/rewards/preview");
        assertThat(request.url().getQuery()).contains("wasteId=7", "incentiveId=3", "issuer=maker");
    }

    @Test
    @DisplayName("Payout page is decoded with its generic content type")
    void getParticipantPayouts() {
        String json = """
                {"data":[{"id":9,"wasteId":7,"incentiveId":3,"payer":"maker","payee":"picker",
                          "share":"HOLDER","amount":350,"createdAt":null}],
                 "pageNumber":1,"pageSize":5,"totalRecords":6,"totalPages":2}
                """;
        RewardClient client = clientReturning(HttpStatus.OK, json);

        ResponseEntity<PagedResponse<RewardPayoutDTO>> response = client.getParticipantPayouts("picker", 1, 5);

        PagedResponse<RewardPayoutDTO> page = response.getBody();
        assertThat(page.getTotalRecords()).isEqualTo(6L);
        assertThat(page.getData().get(0).share()).isEqualTo(PayoutShare.HOLDER);

        ClientRequest request = requests.get(0);
        assertThat(request.url().getPath()).isEqualTo("/api/v1/rewards/participants/picker/payouts");
        assertThat(request.url().getQuery()).isEqualTo("page=1&size=5");
    }

    @Test
    @DisplayName("Statistics")
    void getSupplyChainStats() {
        RewardClient client = clientReturning(HttpStatus.OK,
                "{\"totalWastes\":12,\"totalActiveWeight\":34000,\"totalTokensEarned\":900}");

        SupplyChainStatsResponse stats = client.getSupplyChainStats().getBody();

        assertThat(stats).isEqualTo(new SupplyChainStatsResponse(12L, 34_000L, 900L));
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/rewards/stats");
    }
}
