package io.github.drompincen.knowpipe.protocol.api;

import io.github.drompincen.knowpipe.protocol.event.NotificationKind;

import java.util.Map;
import java.util.UUID;

public record DeliveryReport(
        UUID taskId,
        NotificationKind kind,
        Map<UUID, DeliveryStatus> outcomes
) {
    public DeliveryReport {
        outcomes = outcomes == null ? Map.of() : Map.copyOf(outcomes);
    }

    public long count(DeliveryStatus status) {
        return outcomes.values().stream().filter(s -> s == status).count();
    }
}
