package io.github.drompincen.knowpipe.protocol.api;

import io.github.drompincen.knowpipe.protocol.event.NotificationKind;

import java.time.Instant;
import java.util.UUID;

public record DeliveryRecord(
        UUID taskId,
        String channel,
        UUID subscriptionId,
        NotificationKind kind,
        DeliveryStatus status,
        int attempts,
        String lastError,
        Instant recordedAt
) {}
