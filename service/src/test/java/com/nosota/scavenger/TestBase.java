package com.nosota.scavenger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.scavenger.api.model.ParticipantRole;
import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.model.IncentiveProgram;
import com.nosota.scavenger.model.WasteUnit;
import com.nosota.scavenger.service.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared Spring context for integration tests: in-memory H2 in PostgreSQL mode,
 * migrated by Flyway, collector share 10% and owner share 20%.
 *
 * <p>The database is shared by all test classes, so every helper creates participants
 * with fresh addresses and tests assert on their own records or on deltas.
 */
@SpringBootTest(
        classes = ScavengerApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.MOCK
)
@AutoConfigureMockMvc
@Import(TestAsyncConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {

    protected static final long LATITUDE = 52_520_008L;
    protected static final long LONGITUDE = 13_404_954L;

    @Autowired
    protected ParticipantService participantService;

    @Autowired
    protected WasteRegistryService wasteRegistryService;

    @Autowired
    protected TransferLedgerService transferLedgerService;

    @Autowired
    protected IncentiveProgramService incentiveProgramService;

    @Autowired
    protected RewardSettlementService rewardSettlementService;

    @Autowired
    protected SupplyChainStatisticService supplyChainStatisticService;

    @Autowired
    protected IdentifierAllocator identifierAllocator;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Value("${scavenger.admin-address}")
    protected String adminAddress;

    // Counter for generating unique participant addresses in tests
    private static final AtomicLong addressCounter = new AtomicLong(1);

    /**
     * Registers a participant with a generated address (recycler-1, collector-2, ...).
     */
    protected String registerParticipant(ParticipantRole role) throws Exception {
        String address = role.name().toLowerCase() + "-" + addressCounter.getAndIncrement();
        participantService.register(address, role, "Test " + role.name().toLowerCase());
        return address;
    }

    protected WasteUnit submitWaste(String submitter, WasteType category, long weight) throws Exception {
        return wasteRegistryService.submit(category, weight, submitter, LATITUDE, LONGITUDE);
    }

    protected IncentiveProgram createIncentive(String issuer, WasteType category, long rewardRate, long totalBudget)
            throws Exception {
        return incentiveProgramService.create(issuer, category, rewardRate, totalBudget);
    }

    /**
     * Submits a unit as a fresh recycler and moves it recycler → collector → manufacturer.
     *
     * @return the chain: [recycler, collector, manufacturer] and the waste unit id
     */
    protected SupplyChain buildChain(WasteType category, long weight) throws Exception {
        String recycler = registerParticipant(ParticipantRole.RECYCLER);
        String collector = registerParticipant(ParticipantRole.COLLECTOR);
        String manufacturer = registerParticipant(ParticipantRole.MANUFACTURER);

        WasteUnit waste = submitWaste(recycler, category, weight);
        transferLedgerService.transfer(waste.getId(), recycler, collector, "pickup");
        transferLedgerService.transfer(waste.getId(), collector, manufacturer, "delivery");

        return new SupplyChain(waste.getId(), recycler, collector, manufacturer);
    }

    protected record SupplyChain(Long wasteId, String recycler, String collector, String manufacturer) {
    }
}
