package io.github.drompincen.knowpipe.protocol.api;

public record CacheStats(
        double hitRate,
        long sizeBytes,
        int entryCount,
        long hits,
        long misses,
        long evictions
) {}
