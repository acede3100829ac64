package io.github.drompincen.knowpipe.runtime.pipeline;

import io.github.drompincen.knowpipe.protocol.api.Caller;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.ResearchResult;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.TaskState;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;
import io.github.drompincen.knowpipe.runtime.cache.CacheBackingStore;
import io.github.drompincen.knowpipe.runtime.cache.CacheStore;
import io.github.drompincen.knowpipe.runtime.classification.AudienceDetector;
import io.github.drompincen.knowpipe.runtime.classification.ClassificationRules;
import io.github.drompincen.knowpipe.runtime.classification.DomainDetector;
import io.github.drompincen.knowpipe.runtime.classification.RequestClassifier;
import io.github.drompincen.knowpipe.runtime.classification.ResearchTypeDetector;
import io.github.drompincen.knowpipe.runtime.classification.SignalComposer;
import io.github.drompincen.knowpipe.runtime.classification.UrgencyDetector;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.InvalidRequestException;
import io.github.drompincen.knowpipe.runtime.error.TaskNotFoundException;
import io.github.drompincen.knowpipe.runtime.gap.GapRegistry;
import io.github.drompincen.knowpipe.runtime.notify.NotificationPreferences;
import io.github.drompincen.knowpipe.runtime.notify.Notifier;
import io.github.drompincen.knowpipe.runtime.priority.PreferenceRegistry;
import io.github.drompincen.knowpipe.runtime.priority.Prioritizer;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchScheduler;
import io.github.drompincen.knowpipe.runtime.support.InMemoryDeliveryLog;
import io.github.drompincen.knowpipe.runtime.support.InMemoryTaskStore;
import io.github.drompincen.knowpipe.runtime.support.MutableClock;
import io.github.drompincen.knowpipe.runtime.support.RecordingChannel;
import io.github.drompincen.knowpipe.runtime.support.Requests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class KnowledgePipelineTest {

    @Mock private GapRegistry gapRegistry;
    @Mock private ProactiveLoop proactive;

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private final InMemoryTaskStore store = new InMemoryTaskStore();
    private final AtomicInteger executorCalls = new AtomicInteger();

    private PipelineProperties properties;
    private RequestClassifier classifier;
    private CacheStore cache;
    private Notifier notifier;
    private ResearchScheduler scheduler;
    private KnowledgePipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = Requests.fastProperties();
        properties.getClassifier().setAdvancedBudget(Duration.ofSeconds(2));
        properties.getClassifier().setContextBudget(Duration.ofSeconds(2));
        ClassificationRules rules = new ClassificationRules(properties);
        classifier = new RequestClassifier(new ResearchTypeDetector(rules, properties),
                List.of(new ResearchTypeDetector(rules, properties), new AudienceDetector(rules, properties),
                        new DomainDetector(rules, properties), new UrgencyDetector(rules, properties)),
                new SignalComposer(properties), properties);
        cache = new CacheStore(CacheBackingStore.NONE, clock, properties);
        notifier = new Notifier(new InMemoryDeliveryLog(), clock, properties);
        scheduler = new ResearchScheduler(store,
                (request, context) -> {
                    executorCalls.incrementAndGet();
                    return ResearchResult.of("Use a bounded retry with jittered backoff.", 0.9);
                },
                new Prioritizer(properties, new PreferenceRegistry(properties), clock),
                cache, notifier, gapRegistry, clock, properties, Runnable::run, r -> { });
        pipeline = new KnowledgePipeline(classifier, cache, scheduler, notifier, gapRegistry, proactive, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        notifier.shutdown();
        classifier.shutdown();
    }

    @Test
    void missIsResearchedOnceThenServedFromCache() {
        String query = "How do I implement async retries in this system?";

        Submission first = pipeline.submit(query, ContextHints.none(), Caller.user("alice"));
        assertThat(first.cacheHit()).isFalse();
        assertThat(first.request().researchType()).isEqualTo(ResearchType.IMPLEMENTATION);
        assertThat(pipeline.status(first.taskId()).state()).isEqualTo(TaskState.QUEUED);

        scheduler.dispatch();
        assertThat(pipeline.status(first.taskId()).state()).isEqualTo(TaskState.COMPLETED);

        Submission second = pipeline.submit(query, ContextHints.none(), Caller.user("bob"));
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.cacheKey()).isEqualTo(first.cacheKey());
        assertThat(second.cached()).get()
                .satisfies(e -> assertThat(e.result().content()).startsWith("Use a bounded retry"))
                .satisfies(e -> assertThat(e.hitCount()).isEqualTo(1));
        assertThat(executorCalls.get()).isEqualTo(1);
        assertThat(pipeline.cacheStats().hits()).isEqualTo(1);
    }

    @Test
    void concurrentIdenticalSubmissionsShareOneTask() {
        Submission a = pipeline.submit("explain tokio select cancellation", null, Caller.user("alice"));
        Submission b = pipeline.submit("explain tokio select cancellation", null, Caller.user("alice"));

        assertThat(b.taskId()).isEqualTo(a.taskId());
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void submitterHearsAboutTheirOwnTask() {
        RecordingChannel mine = new RecordingChannel("alice");
        pipeline.subscribe(mine, NotificationPreferences.forUser("alice"));

        Submission s = pipeline.submit("kafka consumer rebalance storms", null, Caller.user("alice"));
        pipeline.submit("unrelated question for bob", null, Caller.user("bob"));
        scheduler.dispatch();

        assertThat(notifier.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(mine.received()).extracting(NotificationEvent::kind)
                .containsExactly(NotificationKind.STARTED, NotificationKind.COMPLETED);
        assertThat(mine.received()).allSatisfy(e -> assertThat(e.taskId()).isEqualTo(s.taskId()));
        assertThat(pipeline.deliveries(s.taskId())).hasSize(2);
    }

    @Test
    void rejectsBlankAndOverlongQueries() {
        properties.setMaxQueryLength(20);
        pipeline = new KnowledgePipeline(classifier, cache, scheduler, notifier, gapRegistry, proactive, properties);

        assertThatThrownBy(() -> pipeline.submit("   ", null, null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> pipeline.submit(null, null, null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> pipeline.submit("x".repeat(21), null, null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("20");
        assertThat(store.size()).isZero();
    }

    @Test
    void unknownTaskStatusFails() {
        assertThatThrownBy(() -> pipeline.status(UUID.randomUUID())).isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    void cancelledSubmissionIsNeverResearched() {
        Submission s = pipeline.submit("cancel this", null, Caller.user("alice"));

        assertThat(pipeline.cancel(s.taskId()).state()).isEqualTo(TaskState.CANCELLED);
        scheduler.dispatch();

        assertThat(executorCalls.get()).isZero();
    }

    @Test
    void dismissingAGapCancelsItsScheduledResearch() {
        KnowledgeGap gap = Requests.gap("src/Widget.java", 6, GapType.MISSING, "undocumented public type Widget",
                clock.instant());
        UUID taskId = scheduler.enqueue(Requests.proactive(gap)).orElseThrow();
        when(gapRegistry.dismiss(gap.id())).thenReturn(Optional.of(taskId));

        pipeline.dismissGap(gap.id());
        scheduler.dispatch();

        assertThat(pipeline.status(taskId).state()).isEqualTo(TaskState.CANCELLED);
        assertThat(executorCalls.get()).isZero();
        assertThat(cache.get(Requests.proactive(gap).cacheKey())).isEmpty();
    }

    @Test
    void dismissingAGapWhoseTaskIsGoneStillSucceeds() {
        UUID gapId = UUID.randomUUID();
        when(gapRegistry.dismiss(gapId)).thenReturn(Optional.of(UUID.randomUUID()));

        pipeline.dismissGap(gapId);

        verify(gapRegistry).dismiss(gapId);
    }

    @Test
    void projectOperationsGoThroughTheProactiveLoop() {
        when(proactive.scanProject()).thenReturn(3);
        UUID gapId = UUID.randomUUID();

        assertThat(pipeline.scanProject()).isEqualTo(3);
        pipeline.onFileChanged(Path.of("src/A.java"));
        pipeline.dismissGap(gapId);

        verify(proactive).onFileChanged(Path.of("src/A.java"));
        verify(gapRegistry).dismiss(gapId);
    }
}
