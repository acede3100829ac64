package io.github.drompincen.knowpipe.runtime.pipeline;

import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.CacheStats;
import io.github.drompincen.knowpipe.protocol.api.Caller;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.DeliveryRecord;
import io.github.drompincen.knowpipe.protocol.api.InvalidationReport;
import io.github.drompincen.knowpipe.protocol.api.ScheduledTask;
import io.github.drompincen.knowpipe.runtime.cache.CacheFilter;
import io.github.drompincen.knowpipe.runtime.cache.CacheInvalidation;
import io.github.drompincen.knowpipe.runtime.cache.CacheKeys;
import io.github.drompincen.knowpipe.runtime.cache.CacheStore;
import io.github.drompincen.knowpipe.runtime.classification.RequestClassifier;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.InvalidRequestException;
import io.github.drompincen.knowpipe.runtime.error.TaskNotFoundException;
import io.github.drompincen.knowpipe.runtime.gap.GapRegistry;
import io.github.drompincen.knowpipe.runtime.notify.NotificationChannel;
import io.github.drompincen.knowpipe.runtime.notify.NotificationPreferences;
import io.github.drompincen.knowpipe.runtime.notify.Notifier;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchScheduler;
import io.github.drompincen.knowpipe.runtime.scheduler.TaskSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for callers. {@link #submit} answers from the cache when it can and otherwise
 * enqueues on-demand research; results arrive through notifications and later submits.
 */
@Service
public class KnowledgePipeline {

    private static final Logger log = LoggerFactory.getLogger(KnowledgePipeline.class);

    private final RequestClassifier classifier;
    private final CacheStore cache;
    private final ResearchScheduler scheduler;
    private final Notifier notifier;
    private final GapRegistry gapRegistry;
    private final ProactiveLoop proactive;
    private final int maxQueryLength;

    public KnowledgePipeline(RequestClassifier classifier,
                             CacheStore cache,
                             ResearchScheduler scheduler,
                             Notifier notifier,
                             GapRegistry gapRegistry,
                             ProactiveLoop proactive,
                             PipelineProperties properties) {
        this.classifier = classifier;
        this.cache = cache;
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.gapRegistry = gapRegistry;
        this.proactive = proactive;
        this.maxQueryLength = properties.getMaxQueryLength();
    }

    /**
     * Classifies {@code query}, then returns the cached entry or enqueues research.
     *
     * @throws InvalidRequestException for a blank or overlong query
     */
    public Submission submit(String query, ContextHints hints, Caller caller) {
        if (query == null || query.isBlank()) {
            throw new InvalidRequestException("query must not be blank");
        }
        if (query.length() > maxQueryLength) {
            throw new InvalidRequestException("query exceeds " + maxQueryLength + " characters");
        }
        ContextHints effective = hints == null ? ContextHints.none() : hints;
        ClassifiedRequest request = classifier.classify(query, effective);
        CacheKey key = CacheKeys.derive(request, effective);
        String requestedBy = caller == null ? null : caller.userId();
        TaskSubject subject = TaskSubject.onDemand(request, key, requestedBy);

        Optional<CacheEntry> hit = cache.get(key);
        if (hit.isPresent()) {
            log.debug("Cache hit for {} ({} hits)", key.id(), hit.get().hitCount());
            return new Submission(subject.taskId(0), request, key, hit.get());
        }
        // on-demand subjects are never dropped
        UUID taskId = scheduler.enqueue(subject).orElseThrow();
        log.info("Submitted {} research as task {} for {}", request.researchType(), taskId, requestedBy);
        return new Submission(taskId, request, key, null);
    }

    public ScheduledTask status(UUID taskId) {
        return scheduler.status(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public ScheduledTask cancel(UUID taskId) {
        return scheduler.cancel(taskId);
    }

    public List<CacheEntry> searchCache(CacheFilter filter) {
        return cache.search(filter);
    }

    public InvalidationReport invalidateCache(Caller caller, CacheInvalidation invalidation, boolean dryRun) {
        return cache.invalidate(caller, invalidation, dryRun);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public UUID subscribe(NotificationChannel channel, NotificationPreferences preferences) {
        return notifier.subscribe(channel, preferences);
    }

    public boolean unsubscribe(UUID subscriptionId) {
        return notifier.unsubscribe(subscriptionId);
    }

    public List<DeliveryRecord> deliveries(UUID taskId) {
        return notifier.deliveries(taskId);
    }

    public int scanProject() {
        return proactive.scanProject();
    }

    public int scanProject(Path root) {
        return proactive.scan(root);
    }

    public int onFileChanged(Path file) {
        return proactive.onFileChanged(file);
    }

    /** Dismisses the gap and cancels the research still scheduled for it. */
    public void dismissGap(UUID gapId) {
        gapRegistry.dismiss(gapId).ifPresent(taskId -> {
            try {
                scheduler.cancel(taskId);
            } catch (TaskNotFoundException e) {
                log.debug("Task {} of dismissed gap {} is already gone", taskId, gapId);
            }
        });
    }
}
