package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.CacheStats;
import io.github.drompincen.knowpipe.protocol.api.Caller;
import io.github.drompincen.knowpipe.protocol.api.InvalidationReport;
import io.github.drompincen.knowpipe.protocol.api.ResearchResult;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.PermissionDeniedException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.CRC32;

/**
 * In-memory research cache with TTL, LRU eviction under an entry bound and a byte budget, slice
 * indexes per key dimension, and write-through to a {@link CacheBackingStore}.
 *
 * <p>Per-key operations go through {@link ConcurrentHashMap#compute} so they are linearizable per
 * key while different keys never block each other. Recency is a monotonic tick in a skip list;
 * eviction is serialized by a single lock.
 */
@Service
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);
    private static final long ENTRY_OVERHEAD_BYTES = 256;

    private final Map<String, Slot> entries = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, String> recency = new ConcurrentSkipListMap<>();
    private final AtomicLong ticks = new AtomicLong();
    private final SliceIndex index = new SliceIndex();
    private final ReentrantLock evictionLock = new ReentrantLock();

    private final AtomicLong bytes = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private final CacheBackingStore backingStore;
    private final Clock clock;
    private final int maxEntries;
    private final long maxSizeBytes;
    private final Duration defaultTtl;

    public CacheStore(CacheBackingStore backingStore, Clock clock, PipelineProperties properties) {
        this.backingStore = backingStore;
        this.clock = clock;
        PipelineProperties.Cache cfg = properties.getCache();
        this.maxEntries = cfg.getMaxEntries();
        this.maxSizeBytes = cfg.getMaxSizeBytes();
        this.defaultTtl = cfg.getDefaultTtl();
    }

    // ---------------------------------------------------------------- lookups

    /**
     * Hit: increments the hit count and refreshes recency. Expired or corrupted entries are
     * removed and reported as a miss.
     */
    public Optional<CacheEntry> get(CacheKey key) {
        String id = key.id();
        Slot slot = entries.get(id);
        if (slot == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (slot.isExpired(clock.instant())) {
            remove(id, slot, false);
            misses.incrementAndGet();
            log.debug("[Cache] Expired entry {} removed on read", id);
            return Optional.empty();
        }
        if (!slot.checksumValid()) {
            remove(id, slot, false);
            misses.incrementAndGet();
            log.warn("[Cache] Checksum mismatch for entry {}: evicted as corrupt", id);
            return Optional.empty();
        }
        Slot touched = entries.computeIfPresent(id, (k, current) -> {
            if (current == slot) {
                current.hitCount.incrementAndGet();
                retick(current);
            }
            return current;
        });
        if (touched != slot) {
            // replaced or removed between the read and the touch
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(slot.snapshot());
    }

    /** Entries matching the filter, newest first. Does not count hits or touch recency. */
    public List<CacheEntry> search(CacheFilter filter) {
        CacheFilter f = filter == null ? CacheFilter.any() : filter;
        Instant now = clock.instant();
        List<CacheEntry> out = new ArrayList<>();
        for (String id : candidates(f)) {
            Slot slot = entries.get(id);
            if (slot == null || slot.isExpired(now)) continue;
            CacheEntry entry = slot.snapshot();
            if (f.matches(entry)) out.add(entry);
        }
        out.sort(Comparator.comparing(CacheEntry::createdAt).reversed()
                .thenComparing(e -> e.key().id()));
        return out;
    }

    /** True when a live entry exists for the topic hash, whatever its other key dimensions. */
    public boolean hasLiveTopic(String topicHash) {
        return !search(CacheFilter.any().withTopicHash(topicHash)).isEmpty();
    }

    // ---------------------------------------------------------------- mutations

    public CacheEntry put(CacheKey key, String query, ResearchResult result) {
        return put(key, query, result, defaultTtl);
    }

    public CacheEntry put(CacheKey key, String query, ResearchResult result, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
        Slot slot = new Slot(key, query, result, clock.instant(), effectiveTtl, 0, checksum(result),
                estimateSize(query, result));
        install(slot);
        try {
            backingStore.save(slot.snapshot(), slot.checksum);
        } catch (RuntimeException e) {
            log.warn("[Cache] Write-through failed for {}: {}", slot.keyId, e.getMessage());
        }
        evictIfNeeded();
        log.debug("[Cache] Stored {} ({} bytes, ttl {})", slot.keyId, slot.sizeBytes, effectiveTtl);
        return slot.snapshot();
    }

    /**
     * Removes every entry the selector matches. Requires the caller's ADMIN role. A dry run reports
     * the same matches without touching anything.
     */
    public InvalidationReport invalidate(Caller caller, CacheInvalidation selector, boolean dryRun) {
        if (caller == null || !caller.isAdmin()) {
            throw new PermissionDeniedException("cache invalidation requires the " + Caller.ADMIN + " role");
        }
        Objects.requireNonNull(selector, "selector");
        Collection<String> ids = selector.keyIds()
                .map(s -> (Collection<String>) s)
                .orElseGet(() -> selector.filter().map(this::candidates).orElseGet(() -> List.copyOf(entries.keySet())));

        List<String> matched = new ArrayList<>();
        long reclaimed = 0;
        for (String id : ids) {
            Slot slot = entries.get(id);
            if (slot == null || !selector.matches(slot.snapshot())) continue;
            if (dryRun || remove(id, slot, false)) {
                matched.add(id);
                reclaimed += slot.sizeBytes;
            }
        }
        matched.sort(Comparator.naturalOrder());
        log.info("[Cache] Invalidation by {} matched {} entries ({} bytes){}",
                caller.userId(), matched.size(), reclaimed, dryRun ? " [dry run]" : "");
        return new InvalidationReport(dryRun, matched, reclaimed);
    }

    @Scheduled(fixedDelayString = "${knowpipe.cache.sweep-interval-ms:60000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Slot> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && remove(e.getKey(), e.getValue(), false)) {
                removed++;
            }
        }
        try {
            backingStore.deleteExpired(now);
        } catch (RuntimeException e) {
            log.warn("[Cache] Backing store sweep failed: {}", e.getMessage());
        }
        if (removed > 0) {
            log.info("[Cache] Swept {} expired entries", removed);
        }
        return removed;
    }

    /** Reloads live entries from the backing store. */
    @PostConstruct
    public void warmUp() {
        List<CacheBackingStore.StoredEntry> stored;
        try {
            stored = backingStore.loadLive(clock.instant());
        } catch (RuntimeException e) {
            log.warn("[Cache] Warm-up skipped, backing store unavailable: {}", e.getMessage());
            return;
        }
        for (CacheBackingStore.StoredEntry s : stored) {
            CacheEntry e = s.entry();
            install(new Slot(e.key(), e.query(), e.result(), e.createdAt(), e.ttl(), e.hitCount(),
                    s.checksum(), e.sizeBytes() > 0 ? e.sizeBytes() : estimateSize(e.query(), e.result())));
        }
        evictIfNeeded();
        if (!stored.isEmpty()) {
            log.info("[Cache] Warmed up with {} entries", entries.size());
        }
    }

    // ---------------------------------------------------------------- stats

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        double rate = h + m == 0 ? 0.0 : (double) h / (h + m);
        return new CacheStats(rate, bytes.get(), entries.size(), h, m, evictions.get());
    }

    public int size() {
        return entries.size();
    }

    // ---------------------------------------------------------------- internals

    private void install(Slot slot) {
        entries.compute(slot.keyId, (id, old) -> {
            if (old != null) {
                index.remove(old);
                recency.remove(old.tick, id);
                bytes.addAndGet(-old.sizeBytes);
            }
            slot.tick = ticks.incrementAndGet();
            recency.put(slot.tick, id);
            index.add(slot);
            bytes.addAndGet(slot.sizeBytes);
            return slot;
        });
    }

    private void retick(Slot slot) {
        recency.remove(slot.tick, slot.keyId);
        slot.tick = ticks.incrementAndGet();
        recency.put(slot.tick, slot.keyId);
    }

    /** Removes {@code slot} only if it is still the current value for {@code id}. */
    private boolean remove(String id, Slot slot, boolean evicted) {
        boolean[] removed = new boolean[1];
        entries.computeIfPresent(id, (k, current) -> {
            if (current != slot) return current;
            index.remove(current);
            recency.remove(current.tick, k);
            bytes.addAndGet(-current.sizeBytes);
            removed[0] = true;
            return null;
        });
        if (!removed[0]) return false;
        if (evicted) evictions.incrementAndGet();
        try {
            backingStore.delete(id);
        } catch (RuntimeException e) {
            log.warn("[Cache] Backing store delete failed for {}: {}", id, e.getMessage());
        }
        return true;
    }

    private void evictIfNeeded() {
        if (entries.size() <= maxEntries && bytes.get() <= maxSizeBytes) return;
        evictionLock.lock();
        try {
            while (entries.size() > maxEntries || bytes.get() > maxSizeBytes) {
                Map.Entry<Long, String> eldest = recency.pollFirstEntry();
                if (eldest == null) break;
                Slot slot = entries.get(eldest.getValue());
                // a stale tick means the entry was touched or replaced meanwhile
                if (slot != null && slot.tick == eldest.getKey() && remove(slot.keyId, slot, true)) {
                    log.debug("[Cache] Evicted LRU entry {}", slot.keyId);
                }
            }
        } finally {
            evictionLock.unlock();
        }
    }

    private Collection<String> candidates(CacheFilter f) {
        Set<String> narrowest = null;
        for (Set<String> slice : index.slicesFor(f)) {
            if (narrowest == null || slice.size() < narrowest.size()) narrowest = slice;
        }
        return narrowest == null ? List.copyOf(entries.keySet()) : List.copyOf(narrowest);
    }

    static String checksum(ResearchResult result) {
        CRC32 crc = new CRC32();
        crc.update(result.content().getBytes(StandardCharsets.UTF_8));
        for (String source : result.sources()) {
            crc.update(source.getBytes(StandardCharsets.UTF_8));
        }
        return Long.toHexString(crc.getValue());
    }

    static long estimateSize(String query, ResearchResult result) {
        long size = ENTRY_OVERHEAD_BYTES + result.content().getBytes(StandardCharsets.UTF_8).length;
        if (query != null) size += query.getBytes(StandardCharsets.UTF_8).length;
        for (String source : result.sources()) size += source.length();
        for (Map.Entry<String, String> m : result.metadata().entrySet()) {
            size += m.getKey().length() + (m.getValue() == null ? 0 : m.getValue().length());
        }
        return size;
    }

    /** Mutable cache slot; callers only ever see {@link CacheEntry} snapshots of it. */
    static final class Slot {
        final CacheKey key;
        final String keyId;
        final String query;
        final ResearchResult result;
        final Instant createdAt;
        final Duration ttl;
        final AtomicLong hitCount;
        final String checksum;
        final long sizeBytes;
        volatile long tick;

        Slot(CacheKey key, String query, ResearchResult result, Instant createdAt, Duration ttl,
             long hitCount, String checksum, long sizeBytes) {
            this.key = key;
            this.keyId = key.id();
            this.query = query;
            this.result = result;
            this.createdAt = createdAt;
            this.ttl = ttl;
            this.hitCount = new AtomicLong(hitCount);
            this.checksum = checksum;
            this.sizeBytes = sizeBytes;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(createdAt.plus(ttl));
        }

        boolean checksumValid() {
            return checksum != null && checksum.equals(CacheStore.checksum(result));
        }

        CacheEntry snapshot() {
            return new CacheEntry(key, query, result, createdAt, ttl, hitCount.get(),
                    result.qualityScore(), sizeBytes);
        }
    }

    /** Key ids per dimension value, so slice lookups avoid full scans. */
    static final class SliceIndex {
        private final Map<String, Set<String>> slices = new ConcurrentHashMap<>();

        void add(Slot slot) {
            for (String token : tokens(slot.key)) {
                slices.compute(token, (t, ids) -> {
                    Set<String> set = ids == null ? ConcurrentHashMap.newKeySet() : ids;
                    set.add(slot.keyId);
                    return set;
                });
            }
        }

        void remove(Slot slot) {
            for (String token : tokens(slot.key)) {
                slices.computeIfPresent(token, (t, ids) -> {
                    ids.remove(slot.keyId);
                    return ids.isEmpty() ? null : ids;
                });
            }
        }

        List<Set<String>> slicesFor(CacheFilter f) {
            List<Set<String>> out = new ArrayList<>();
            if (f.researchType() != null) out.add(slice("type:" + f.researchType().name()));
            if (f.audience() != null) out.add(slice("audience:" + f.audience().name()));
            if (f.domain() != null) out.add(slice("domain:" + f.domain()));
            if (f.topicHash() != null) out.add(slice("topic:" + f.topicHash()));
            if (f.contextHash() != null) out.add(slice("context:" + f.contextHash()));
            return out;
        }

        private Set<String> slice(String token) {
            return slices.getOrDefault(token, Set.of());
        }

        private static List<String> tokens(CacheKey key) {
            return List.of(
                    "type:" + key.researchType().name(),
                    "audience:" + key.audience().name(),
                    "domain:" + key.domain(),
                    "topic:" + key.topicHash(),
                    "context:" + key.contextHash());
        }
    }
}
