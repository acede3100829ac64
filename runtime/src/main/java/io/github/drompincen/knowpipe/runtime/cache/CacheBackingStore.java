package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.protocol.api.CacheEntry;

import java.time.Instant;
import java.util.List;

/**
 * Durable mirror of the in-memory cache. Implementations may throw; the cache logs and carries on.
 */
public interface CacheBackingStore {

    void save(CacheEntry entry, String checksum);

    void delete(String keyId);

    List<StoredEntry> loadLive(Instant now);

    long deleteExpired(Instant now);

    record StoredEntry(CacheEntry entry, String checksum) {}

    CacheBackingStore NONE = new CacheBackingStore() {
        @Override
        public void save(CacheEntry entry, String checksum) {}

        @Override
        public void delete(String keyId) {}

        @Override
        public List<StoredEntry> loadLive(Instant now) {
            return List.of();
        }

        @Override
        public long deleteExpired(Instant now) {
            return 0;
        }
    };
}
