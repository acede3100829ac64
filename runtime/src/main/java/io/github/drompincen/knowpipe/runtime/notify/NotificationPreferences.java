package io.github.drompincen.knowpipe.runtime.notify;

import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a subscriber wants to hear about. Empty sets accept everything on that axis.
 *
 * @param ownTasksOnly only events of tasks requested by {@code userId}
 * @param progress     whether PROGRESS events are wanted at all
 */
public record NotificationPreferences(
        String userId,
        Set<NotificationKind> kinds,
        Set<String> domains,
        Set<ResearchType> researchTypes,
        Set<TaskOrigin> origins,
        boolean ownTasksOnly,
        boolean progress
) {
    public NotificationPreferences {
        kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
        domains = domains == null ? Set.of() : Set.copyOf(domains);
        researchTypes = researchTypes == null ? Set.of() : Set.copyOf(researchTypes);
        origins = origins == null ? Set.of() : Set.copyOf(origins);
    }

    public static NotificationPreferences all() {
        return new NotificationPreferences(null, Set.of(), Set.of(), Set.of(), Set.of(), false, true);
    }

    public static NotificationPreferences forUser(String userId) {
        return new NotificationPreferences(userId, Set.of(), Set.of(), Set.of(), Set.of(), true, true);
    }

    public static NotificationPreferences terminalOnly() {
        return new NotificationPreferences(null, EnumSet.of(NotificationKind.COMPLETED, NotificationKind.FAILED),
                Set.of(), Set.of(), Set.of(), false, false);
    }

    public NotificationPreferences withDomains(Set<String> value) {
        return new NotificationPreferences(userId, kinds, value, researchTypes, origins, ownTasksOnly, progress);
    }

    public NotificationPreferences withOrigins(Set<TaskOrigin> value) {
        return new NotificationPreferences(userId, kinds, domains, researchTypes, value, ownTasksOnly, progress);
    }

    public boolean accepts(NotificationEvent event) {
        if (event.kind() == NotificationKind.PROGRESS && !progress) return false;
        if (!kinds.isEmpty() && !kinds.contains(event.kind())) return false;
        if (!domains.isEmpty() && !domains.contains(event.payloadString(NotificationEvent.DOMAIN))) return false;
        if (!researchTypes.isEmpty()) {
            String type = event.payloadString(NotificationEvent.RESEARCH_TYPE);
            if (type == null || researchTypes.stream().noneMatch(t -> t.name().equals(type))) return false;
        }
        if (!origins.isEmpty()) {
            String origin = event.payloadString(NotificationEvent.ORIGIN);
            if (origin == null || origins.stream().noneMatch(o -> o.name().equals(origin))) return false;
        }
        if (ownTasksOnly) {
            return userId != null && userId.equals(event.payloadString(NotificationEvent.REQUESTED_BY));
        }
        return true;
    }
}
