package io.github.drompincen.knowpipe.protocol.api;

import java.time.Instant;
import java.util.UUID;

public record ScheduledTask(
        UUID id,
        TaskOrigin origin,
        ClassifiedRequest request,
        KnowledgeGap gap,
        TaskState state,
        int attempts,
        int maxAttempts,
        Instant enqueuedAt,
        Instant updatedAt,
        Instant nextAttemptAt,
        String cacheKeyId,
        String lastError,
        String requestedBy
) {}
