package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.config.DaemonThreads;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a raw query into a {@link ClassifiedRequest}. Detectors run on a bounded pool under a
 * time budget; a timeout or detector failure degrades to the basic keyword result with
 * confidence 0 instead of failing the caller.
 */
@Service
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    private final ResearchTypeDetector basic;
    private final Map<ClassificationDimension, SignalDetector<?>> detectors =
            new EnumMap<>(ClassificationDimension.class);
    private final SignalComposer composer;
    private final Duration advancedBudget;
    private final Duration contextBudget;
    private final String defaultDomain;
    private final ExecutorService pool;
    private final AtomicLong degraded = new AtomicLong();

    public RequestClassifier(ResearchTypeDetector basic,
                             List<SignalDetector<?>> detectors,
                             SignalComposer composer,
                             PipelineProperties properties) {
        this.basic = basic;
        for (SignalDetector<?> d : detectors) {
            this.detectors.putIfAbsent(d.dimension(), d);
        }
        this.composer = composer;
        PipelineProperties.Classifier cfg = properties.getClassifier();
        this.advancedBudget = cfg.getAdvancedBudget();
        this.contextBudget = cfg.getContextBudget();
        this.defaultDomain = cfg.getDefaultDomain();
        this.pool = Executors.newFixedThreadPool(Math.max(1, cfg.getPoolSize()), DaemonThreads.named("classifier"));
    }

    public ClassifiedRequest classify(String query, ContextHints hints) {
        String raw = query == null ? "" : query;
        ContextHints h = hints == null ? ContextHints.none() : hints;
        String normalized = QueryText.normalize(raw);
        return withinBudget(() -> advanced(raw, normalized, h), advancedBudget, "classify")
                .orElseGet(() -> degraded(raw, normalized, h));
    }

    /** Context axes only (audience, domain, urgency) under the shorter context budget. */
    public ContextHints detectContext(String query) {
        String normalized = QueryText.normalize(query);
        return withinBudget(() -> new ContextHints(
                        detect(ClassificationDimension.AUDIENCE, normalized, AudienceLevel.INTERMEDIATE, AudienceLevel.class).label(),
                        detect(ClassificationDimension.DOMAIN, normalized, defaultDomain, String.class).label(),
                        detect(ClassificationDimension.URGENCY, normalized, UrgencyLevel.MEDIUM, UrgencyLevel.class).label(),
                        null),
                contextBudget, "detectContext")
                .orElseGet(() -> new ContextHints(AudienceLevel.INTERMEDIATE, defaultDomain, UrgencyLevel.MEDIUM, null));
    }

    public long degradedCount() {
        return degraded.get();
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    private ClassifiedRequest advanced(String raw, String normalized, ContextHints hints) {
        return composer.compose(raw,
                detect(ClassificationDimension.RESEARCH_TYPE, normalized, ResearchType.IMPLEMENTATION, ResearchType.class),
                detect(ClassificationDimension.AUDIENCE, normalized, AudienceLevel.INTERMEDIATE, AudienceLevel.class),
                detect(ClassificationDimension.DOMAIN, normalized, defaultDomain, String.class),
                detect(ClassificationDimension.URGENCY, normalized, UrgencyLevel.MEDIUM, UrgencyLevel.class),
                hints);
    }

    @SuppressWarnings("unchecked")
    private <L> Signal<L> detect(ClassificationDimension dimension, String normalized, L fallback, Class<L> labelType) {
        SignalDetector<?> detector = detectors.get(dimension);
        if (detector == null) {
            return new Signal<>(dimension, fallback, 0.0, List.of());
        }
        Signal<?> signal = detector.detect(normalized);
        if (!labelType.isInstance(signal.label())) {
            throw new IllegalStateException("detector for " + dimension + " returned " + signal.label().getClass());
        }
        return (Signal<L>) signal;
    }

    private <T> Optional<T> withinBudget(Callable<T> work, Duration budget, String operation) {
        Future<T> future;
        try {
            future = pool.submit(work);
        } catch (RejectedExecutionException e) {
            markDegraded(operation, "classifier pool rejected the task");
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(future.get(budget.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            markDegraded(operation, "exceeded " + budget.toMillis() + "ms budget");
        } catch (ExecutionException e) {
            markDegraded(operation, "detector failed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            markDegraded(operation, "interrupted");
        }
        return Optional.empty();
    }

    private void markDegraded(String operation, String reason) {
        degraded.incrementAndGet();
        log.warn("[Classifier] {} degraded to basic result: {}", operation, reason);
    }

    private ClassifiedRequest degraded(String raw, String normalized, ContextHints hints) {
        ResearchType type = ResearchType.IMPLEMENTATION;
        List<String> evidence = List.of();
        try {
            Signal<ResearchType> signal = basic.detect(normalized);
            type = signal.label();
            evidence = signal.evidence();
        } catch (RuntimeException e) {
            log.warn("[Classifier] basic keyword path failed, using {}: {}", type, e.toString());
        }
        return new ClassifiedRequest(raw, type,
                hints.audience() != null ? hints.audience() : AudienceLevel.INTERMEDIATE,
                hints.domain() != null && !hints.domain().isBlank() ? hints.domain() : defaultDomain,
                hints.urgency() != null ? hints.urgency() : UrgencyLevel.MEDIUM,
                0.0, evidence);
    }
}
