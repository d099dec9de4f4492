package com.nosota.scavenger.service;

import com.nosota.scavenger.api.model.ParticipantRole;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed custody hand-offs between roles.
 *
 * <pre>
 * RECYCLER  ---&gt; COLLECTOR ---&gt; MANUFACTURER
 *     \__________________________/^
 * </pre>
 *
 * <p>A manufacturer is always the last hop. Transfers within one role are not allowed.
 */
@Component
public class TransferRoutePolicy {

    private static final Map<ParticipantRole, Set<ParticipantRole>> ROUTES = Map.of(
            ParticipantRole.RECYCLER, EnumSet.of(
                    ParticipantRole.COLLECTOR,
                    ParticipantRole.MANUFACTURER
            ),
            ParticipantRole.COLLECTOR, EnumSet.of(
                    ParticipantRole.MANUFACTURER
            ),
            ParticipantRole.MANUFACTURER, EnumSet.noneOf(ParticipantRole.class)
    );

    public boolean isAllowed(ParticipantRole fromRole, ParticipantRole toRole) {
        if (fromRole == null || toRole == null) {
            return false;
        }
        return ROUTES.getOrDefault(fromRole, Set.of()).contains(toRole);
    }

    public Set<ParticipantRole> getAllowedTargets(ParticipantRole fromRole) {
        return ROUTES.getOrDefault(fromRole, Set.of());
    }
}
