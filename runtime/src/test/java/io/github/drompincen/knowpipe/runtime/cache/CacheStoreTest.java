package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.CacheStats;
import io.github.drompincen.knowpipe.protocol.api.Caller;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.InvalidationReport;
import io.github.drompincen.knowpipe.protocol.api.ResearchResult;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.PermissionDeniedException;
import io.github.drompincen.knowpipe.runtime.support.MutableClock;
import io.github.drompincen.knowpipe.runtime.support.Requests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CacheStoreTest {

    @Mock private CacheBackingStore backingStore;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private PipelineProperties properties;
    private CacheStore cache;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getCache().setMaxEntries(3);
        cache = new CacheStore(backingStore, clock, properties);
    }

    private static CacheKey key(String query, String domain) {
        ClassifiedRequest r = Requests.request(query, domain, UrgencyLevel.MEDIUM);
        return Requests.key(r);
    }

    // ------------------------------------------------------------------
    // get / put
    // ------------------------------------------------------------------

    @Test
    void hitIncrementsHitCountAndStats() {
        CacheKey k = key("async rust executors", "rust");
        cache.put(k, "async rust executors", ResearchResult.of("use tokio", 0.9));

        cache.get(k);
        CacheEntry second = cache.get(k).orElseThrow();

        assertThat(second.hitCount()).isEqualTo(2);
        assertThat(second.result().content()).isEqualTo("use tokio");
        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isZero();
        assertThat(stats.hitRate()).isEqualTo(1.0);
    }

    @Test
    void missIsCounted() {
        assertThat(cache.get(key("nothing here", "java"))).isEmpty();
        assertThat(cache.stats().misses()).isEqualTo(1);
        assertThat(cache.stats().hitRate()).isZero();
    }

    @Test
    void putWritesThroughAndSurvivesBackingStoreFailure() {
        doThrow(new IllegalStateException("mongo down")).when(backingStore).save(any(), anyString());
        CacheKey k = key("gradle build cache", "java");

        cache.put(k, "gradle build cache", ResearchResult.of("enable it", 0.7));

        assertThat(cache.get(k)).isPresent();
        verify(backingStore).save(any(CacheEntry.class), anyString());
    }

    // ------------------------------------------------------------------
    // expiry and corruption
    // ------------------------------------------------------------------

    @Test
    void expiredEntryIsAMissAndRemoved() {
        CacheKey k = key("jvm flags", "java");
        cache.put(k, "jvm flags", ResearchResult.of("-Xmx", 0.5), Duration.ofMinutes(1));

        clock.advance(Duration.ofMinutes(2));

        assertThat(cache.get(k)).isEmpty();
        assertThat(cache.size()).isZero();
        verify(backingStore).delete(k.id());
    }

    @Test
    void sweepRemovesOnlyExpiredEntries() {
        cache.put(key("short lived", "java"), "short lived", ResearchResult.of("a", 0.5), Duration.ofMinutes(1));
        cache.put(key("long lived", "java"), "long lived", ResearchResult.of("b", 0.5), Duration.ofHours(1));

        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.sweepExpired()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        verify(backingStore).deleteExpired(clock.instant());
    }

    @Test
    void corruptEntryLoadedFromBackingStoreIsEvictedOnRead() {
        CacheKey k = key("corrupted entry", "java");
        CacheEntry stored = new CacheEntry(k, "corrupted entry", ResearchResult.of("content", 0.6),
                clock.instant(), Duration.ofHours(1), 0, 0.6, 100);
        when(backingStore.loadLive(any())).thenReturn(List.of(new CacheBackingStore.StoredEntry(stored, "deadbeef")));

        cache.warmUp();
        assertThat(cache.size()).isEqualTo(1);

        assertThat(cache.get(k)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void warmUpRestoresValidEntries() {
        CacheKey k = key("restored entry", "java");
        ResearchResult result = ResearchResult.of("content", 0.6);
        CacheEntry stored = new CacheEntry(k, "restored entry", result, clock.instant(), Duration.ofHours(1), 4, 0.6, 100);
        when(backingStore.loadLive(any()))
                .thenReturn(List.of(new CacheBackingStore.StoredEntry(stored, CacheStore.checksum(result))));

        cache.warmUp();

        assertThat(cache.get(k)).hasValueSatisfying(e -> assertThat(e.hitCount()).isEqualTo(5));
    }

    // ------------------------------------------------------------------
    // eviction
    // ------------------------------------------------------------------

    @Test
    void evictsLeastRecentlyUsedBeyondMaxEntries() {
        CacheKey a = key("alpha topic", "java");
        CacheKey b = key("beta topic", "java");
        CacheKey c = key("gamma topic", "java");
        CacheKey d = key("delta topic", "java");
        cache.put(a, "alpha topic", ResearchResult.of("a", 0.5));
        cache.put(b, "beta topic", ResearchResult.of("b", 0.5));
        cache.put(c, "gamma topic", ResearchResult.of("c", 0.5));

        cache.get(a);
        cache.put(d, "delta topic", ResearchResult.of("d", 0.5));

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get(b)).isEmpty();
        assertThat(cache.get(a)).isPresent();
        assertThat(cache.get(c)).isPresent();
        assertThat(cache.get(d)).isPresent();
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    void sizeBoundIsNeverExceeded() {
        properties.getCache().setMaxEntries(1000);
        properties.getCache().setMaxSizeBytes(4_000);
        cache = new CacheStore(backingStore, clock, properties);

        for (int i = 0; i < 50; i++) {
            String q = "topic number " + i;
            cache.put(key(q, "java"), q, ResearchResult.of("x".repeat(500), 0.5));
            assertThat(cache.stats().sizeBytes()).isLessThanOrEqualTo(4_000);
        }
        assertThat(cache.stats().evictions()).isPositive();
    }

    // ------------------------------------------------------------------
    // search and invalidation
    // ------------------------------------------------------------------

    @Test
    void searchBySliceReturnsNewestFirstWithoutCountingHits() {
        cache.put(key("tokio select", "rust"), "tokio select", ResearchResult.of("1", 0.5));
        clock.advance(Duration.ofSeconds(1));
        cache.put(key("serde derive", "rust"), "serde derive", ResearchResult.of("2", 0.5));
        cache.put(key("spring beans", "java"), "spring beans", ResearchResult.of("3", 0.5));

        List<CacheEntry> rust = cache.search(CacheFilter.domain("rust"));

        assertThat(rust).extracting(CacheEntry::query).containsExactly("serde derive", "tokio select");
        assertThat(cache.stats().hits()).isZero();
    }

    @Test
    void invalidationRequiresAdmin() {
        assertThatThrownBy(() -> cache.invalidate(Caller.user("bob"), CacheInvalidation.matching(CacheFilter.any()), false))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    void dryRunReportsWithoutRemoving() {
        cache.put(key("async rust", "rust"), "async rust", ResearchResult.of("1", 0.5));
        cache.put(key("async java", "java"), "async java", ResearchResult.of("2", 0.5));

        InvalidationReport report = cache.invalidate(Caller.admin("root"), CacheInvalidation.queryGlob("ASYNC*"), true);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.matchedCount()).isEqualTo(2);
        assertThat(report.bytesReclaimed()).isPositive();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void invalidateByDomainRemovesOnlyThatSlice() {
        CacheKey rust = key("async rust", "rust");
        CacheKey java = key("async java", "java");
        cache.put(rust, "async rust", ResearchResult.of("1", 0.5));
        cache.put(java, "async java", ResearchResult.of("2", 0.5));

        InvalidationReport report = cache.invalidate(Caller.admin("root"),
                CacheInvalidation.matching(CacheFilter.domain("rust")), false);

        assertThat(report.matchedKeys()).containsExactly(rust.id());
        assertThat(cache.get(rust)).isEmpty();
        assertThat(cache.get(java)).isPresent();
    }

    @Test
    void invalidateByExplicitKeys() {
        CacheKey k = key("tokio tasks", "rust");
        cache.put(k, "tokio tasks", ResearchResult.of("1", 0.5));

        InvalidationReport report = cache.invalidate(Caller.admin("root"), CacheInvalidation.keys(k), false);

        assertThat(report.matchedKeys()).containsExactly(k.id());
        assertThat(cache.size()).isZero();
    }

    @Test
    void hasLiveTopicIgnoresOtherDimensions() {
        cache.put(key("borrow checker", "rust"), "borrow checker", ResearchResult.of("1", 0.5));

        assertThat(cache.hasLiveTopic(CacheKeys.topicHash("checker borrow"))).isTrue();
        assertThat(cache.hasLiveTopic(CacheKeys.topicHash("garbage collector"))).isFalse();
    }
}
