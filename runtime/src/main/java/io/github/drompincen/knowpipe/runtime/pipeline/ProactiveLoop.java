package io.github.drompincen.knowpipe.runtime.pipeline;

import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.runtime.cache.CacheKeys;
import io.github.drompincen.knowpipe.runtime.classification.RequestClassifier;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.gap.FileWatcher;
import io.github.drompincen.knowpipe.runtime.gap.GapAnalyzer;
import io.github.drompincen.knowpipe.runtime.gap.GapRegistry;
import io.github.drompincen.knowpipe.runtime.gap.NioFileWatcher;
import io.github.drompincen.knowpipe.runtime.gap.ProjectFiles;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchScheduler;
import io.github.drompincen.knowpipe.runtime.scheduler.TaskSubject;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns detected gaps into proactive research: analyzer, registry, classifier, then scheduler.
 * Runs on a fixed delay and, when file watching is on, per changed file.
 */
@Service
public class ProactiveLoop {

    private static final Logger log = LoggerFactory.getLogger(ProactiveLoop.class);

    private final GapAnalyzer analyzer;
    private final GapRegistry registry;
    private final RequestClassifier classifier;
    private final ResearchScheduler scheduler;
    private final PipelineProperties.Proactive cfg;
    private final AtomicBoolean scanning = new AtomicBoolean();
    private FileWatcher watcher;

    public ProactiveLoop(GapAnalyzer analyzer,
                         GapRegistry registry,
                         RequestClassifier classifier,
                         ResearchScheduler scheduler,
                         PipelineProperties properties) {
        this.analyzer = analyzer;
        this.registry = registry;
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.cfg = properties.getProactive();
    }

    public Path projectRoot() {
        return Path.of(cfg.getProjectRoot()).toAbsolutePath().normalize();
    }

    @PostConstruct
    public void startWatching() {
        if (!cfg.isEnabled() || !cfg.isWatchEnabled()) return;
        FileWatcher w = new NioFileWatcher(analyzer.projectFiles());
        try {
            w.start(projectRoot(), this::onFileChanged);
            watcher = w;
        } catch (IOException e) {
            w.close();
            log.warn("[Proactive] File watching disabled, could not watch {}: {}", projectRoot(), e.getMessage());
        }
    }

    @PreDestroy
    public void stopWatching() {
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
    }

    @Scheduled(initialDelayString = "${knowpipe.proactive.initial-delay-ms:30000}",
            fixedDelayString = "${knowpipe.proactive.interval-ms:900000}")
    public void runCycle() {
        if (!cfg.isEnabled()) return;
        try {
            scanProject();
        } catch (RuntimeException e) {
            log.warn("[Proactive] Scan cycle failed: {}", e.toString());
        }
    }

    /**
     * Full scan of the configured project root.
     *
     * @return number of gaps handed to the scheduler
     */
    public int scanProject() {
        return scan(projectRoot());
    }

    public int scan(Path root) {
        if (!scanning.compareAndSet(false, true)) {
            log.debug("[Proactive] Scan already running, skipping");
            return 0;
        }
        try {
            log.info("[Proactive] Scanning {}", root);
            List<KnowledgeGap> open = registry.record(analyzer.scan(root));
            return schedule(open);
        } finally {
            scanning.set(false);
        }
    }

    /** Re-analyzes one file, closes gaps fixed at the source and schedules the rest. */
    public int onFileChanged(Path file) {
        Path root = projectRoot();
        Path target = root.resolve(file).normalize();
        try {
            List<KnowledgeGap> current = analyzer.onFileChanged(root, target);
            registry.reconcileFile(ProjectFiles.relative(root, target), current);
            return schedule(registry.record(current));
        } catch (RuntimeException e) {
            log.warn("[Proactive] Could not process change of {}: {}", target, e.toString());
            return 0;
        }
    }

    private int schedule(List<KnowledgeGap> open) {
        int scheduled = 0;
        for (KnowledgeGap gap : open) {
            ContextHints hints = ContextHints.forProject(gap.location());
            ClassifiedRequest request = classifier.classify(gap.researchQuery(), hints);
            CacheKey key = CacheKeys.derive(request, hints);
            Optional<UUID> taskId = scheduler.enqueue(TaskSubject.proactive(gap, request, key, cfg.getRequestedBy()));
            if (taskId.isEmpty()) {
                log.warn("[Proactive] Scheduler backlog full, {} of {} gaps deferred to the next cycle",
                        open.size() - scheduled, open.size());
                break;
            }
            registry.markScheduled(gap.id(), taskId.get());
            scheduled++;
        }
        if (scheduled > 0) {
            log.info("[Proactive] Scheduled research for {} gaps", scheduled);
        }
        return scheduled;
    }
}
