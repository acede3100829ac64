package io.github.drompincen.knowpipe.runtime.pipeline;

import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of {@link KnowledgePipeline#submit}. On a cache hit {@code cachedEntry} is set and no
 * task was enqueued; {@code taskId} is then the id the request would have had.
 */
public record Submission(
        UUID taskId,
        ClassifiedRequest request,
        CacheKey cacheKey,
        CacheEntry cachedEntry
) {
    public boolean cacheHit() {
        return cachedEntry != null;
    }

    public Optional<CacheEntry> cached() {
        return Optional.ofNullable(cachedEntry);
    }
}
