package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.ParticipantRole;
import com.nosota.scavenger.error.InvalidInputException;
import com.nosota.scavenger.error.InvalidStateException;
import com.nosota.scavenger.error.RewardOverflowException;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.event.EventType;
import com.nosota.scavenger.event.LifecycleEventPublisher;
import com.nosota.scavenger.model.Capability;
import com.nosota.scavenger.model.Participant;
import com.nosota.scavenger.repository.ParticipantRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Participant directory backed by the {@code participant} table.
 *
 * <p>Besides registration it keeps each participant's lifetime statistics: grams of
 * waste submitted and reward tokens earned.
 *
 * <p>Capabilities by role:
 * <pre>
 * RECYCLER      SUBMIT_WASTE, CONFIRM_WASTE
 * COLLECTOR     SUBMIT_WASTE, CONFIRM_WASTE, COLLECT_WASTE
 * MANUFACTURER  SUBMIT_WASTE, CONFIRM_WASTE, MANUFACTURE
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ParticipantService implements ParticipantDirectory {

    private static final Map<ParticipantRole, Set<Capability>> CAPABILITIES = Map.of(
            ParticipantRole.RECYCLER, EnumSet.of(
                    Capability.SUBMIT_WASTE,
                    Capability.CONFIRM_WASTE
            ),
            ParticipantRole.COLLECTOR, EnumSet.of(
                    Capability.SUBMIT_WASTE,
                    Capability.CONFIRM_WASTE,
                    Capability.COLLECT_WASTE
            ),
            ParticipantRole.MANUFACTURER, EnumSet.of(
                    Capability.SUBMIT_WASTE,
                    Capability.CONFIRM_WASTE,
                    Capability.MANUFACTURE
            )
    );

    private final ParticipantRepository participantRepository;
    private final LifecycleEventPublisher eventPublisher;

    /**
     * Registers a participant under an address.
     *
     * @param address Participant address
     * @param role    Supply-chain role
     * @param name    Display name (optional)
     * @return The registered participant with zeroed statistics
     * @throws InvalidStateException if the address is already registered
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public Participant register(@NotBlank String address, @NotNull ParticipantRole role, String name)
            throws ScavengerException {
        if (participantRepository.existsById(address)) {
            throw new InvalidStateException("Participant already registered: " + address);
        }

        Participant participant = new Participant();
        participant.setAddress(address);
        participant.setRole(role);
        participant.setName(name);
        participant.setTotalWasteSubmitted(0L);
        participant.setTotalTokensEarned(0L);
        participant.setRegisteredAt(LocalDateTime.now());
        participant = participantRepository.save(participant);

        log.info("Registered participant {} as {}", address, role);
        eventPublisher.publish(EventType.PARTICIPANT_REGISTERED, null, address, "role=" + role);

        return participant;
    }

    public Optional<Participant> get(@NotBlank String address) {
        return participantRepository.findById(address);
    }

    @Override
    public Optional<ParticipantRole> roleOf(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return participantRepository.findById(address).map(Participant::getRole);
    }

    @Override
    public boolean hasCapability(String address, Capability capability) {
        return roleOf(address)
                .map(role -> CAPABILITIES.getOrDefault(role, Set.of()).contains(capability))
                .orElse(false);
    }

    /**
     * Adds submitted grams to a participant's lifetime total.
     *
     * @throws InvalidStateException    if the participant is not registered
     * @throws RewardOverflowException  if the total would overflow
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public void recordSubmission(@NotBlank String address, long grams) throws ScavengerException {
        Participant participant = lockParticipant(address);
        participant.setTotalWasteSubmitted(checkedAdd(participant.getTotalWasteSubmitted(), grams, address));
        participantRepository.save(participant);
    }

    /**
     * Verifies that every payee can absorb its earnings without overflowing.
     * Performs no writes.
     *
     * @param earningsByPayee Amount each participant is about to earn
     * @throws InvalidStateException    if a payee is not registered
     * @throws RewardOverflowException  if a payee's lifetime earnings would overflow
     */
    public void checkEarningsHeadroom(Map<String, Long> earningsByPayee) throws ScavengerException {
        for (Map.Entry<String, Long> entry : earningsByPayee.entrySet()) {
            Participant participant = participantRepository.findById(entry.getKey())
                    .orElseThrow(() -> new InvalidStateException("Payee is not registered: " + entry.getKey()));
            checkedAdd(participant.getTotalTokensEarned(), entry.getValue(), entry.getKey());
        }
    }

    /**
     * Adds reward tokens to a participant's lifetime earnings.
     */
    @Transactional(rollbackOn = ScavengerException.class)
    public void recordEarnings(@NotBlank String address, long amount) throws ScavengerException {
        if (amount < 0) {
            throw new InvalidInputException("Earnings must not be negative: " + amount);
        }
        Participant participant = lockParticipant(address);
        participant.setTotalTokensEarned(checkedAdd(participant.getTotalTokensEarned(), amount, address));
        participantRepository.save(participant);
    }

    private Participant lockParticipant(String address) throws InvalidStateException {
        return participantRepository.findByAddressForUpdate(address)
                .orElseThrow(() -> new InvalidStateException("Participant is not registered: " + address));
    }

    private static long checkedAdd(long current, long delta, String address) throws RewardOverflowException {
        try {
            return Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new RewardOverflowException("Lifetime statistics overflow for participant " + address, e);
        }
    }
}
