package io.github.drompincen.knowpipe.protocol.api;

import java.time.Duration;
import java.time.Instant;

/** Read-only view of a cached research result. */
public record CacheEntry(
        CacheKey key,
        String query,
        ResearchResult result,
        Instant createdAt,
        Duration ttl,
        long hitCount,
        double qualityScore,
        long sizeBytes
) {
    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
