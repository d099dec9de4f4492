package com.nosota.scavenger.service;

import com.nosota.scavenger.model.IdKind;
import com.nosota.scavenger.model.IdSequence;
import com.nosota.scavenger.repository.IdSequenceRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hands out monotonically increasing identifiers per {@link IdKind}.
 *
 * <p>{@link #next(IdKind)} joins the caller's transaction. If the caller fails after
 * allocating, the counter increment rolls back with everything else, so ids of failed
 * calls are reused and the sequence of committed ids has no gaps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentifierAllocator {

    private final IdSequenceRepository idSequenceRepository;

    /**
     * Allocates the next identifier of a kind. The first identifier of every kind is 1.
     *
     * @param kind The id space
     * @return The newly allocated identifier
     * @throws IllegalStateException if the id space was never initialized
     */
    @Transactional
    public long next(IdKind kind) {
        IdSequence sequence = idSequenceRepository.findForUpdate(kind)
                .orElseThrow(() -> new IllegalStateException("Id sequence not initialized: " + kind));

        long nextValue = Math.addExact(sequence.getValue(), 1L);
        sequence.setValue(nextValue);
        idSequenceRepository.save(sequence);

        log.debug("Allocated {} id {}", kind, nextValue);
        return nextValue;
    }

    /**
     * Returns the last identifier allocated for a kind, or 0 if none was.
     */
    public long current(IdKind kind) {
        return idSequenceRepository.findById(kind)
                .map(IdSequence::getValue)
                .orElse(0L);
    }
}
