package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.WasteStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for waste unit processing status.
 *
 * <p>PENDING and PROCESSING are working states; a unit in either one may move to any
 * status. PROCESSED and REJECTED are final and immutable.
 *
 * <p>State diagram:
 * <pre>
 *   PENDING &lt;-----&gt; PROCESSING
 *      |  \          /  |
 *      |   +--------+   |
 *      v   v        v   v
 *   PROCESSED      REJECTED
 * </pre>
 */
@Component
public class WasteStatusStateMachine {

    private static final Map<WasteStatus, Set<WasteStatus>> ALLOWED_TRANSITIONS = Map.of(
            WasteStatus.PENDING, EnumSet.of(
                    WasteStatus.PROCESSING,
                    WasteStatus.PROCESSED,
                    WasteStatus.REJECTED
            ),
            WasteStatus.PROCESSING, EnumSet.of(
                    WasteStatus.PENDING,
                    WasteStatus.PROCESSED,
                    WasteStatus.REJECTED
            )
            // PROCESSED and REJECTED are final
    );

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(WasteStatus fromStatus, WasteStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        // A working state may be re-applied (no-op)
        if (fromStatus == toStatus) {
            return !isFinalState(fromStatus);
        }

        Set<WasteStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    public boolean isFinalState(WasteStatus status) {
        return status == WasteStatus.PROCESSED
                || status == WasteStatus.REJECTED;
    }

    public Set<WasteStatus> getAllowedTransitions(WasteStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
