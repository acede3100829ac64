package io.github.drompincen.knowpipe.runtime.scheduler;

import io.github.drompincen.knowpipe.protocol.api.ResearchResult;
import io.github.drompincen.knowpipe.protocol.api.ScheduledTask;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;
import io.github.drompincen.knowpipe.protocol.api.TaskState;
import io.github.drompincen.knowpipe.protocol.event.NotificationEvent;
import io.github.drompincen.knowpipe.protocol.event.NotificationKind;
import io.github.drompincen.knowpipe.runtime.cache.CacheStore;
import io.github.drompincen.knowpipe.runtime.config.DaemonThreads;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.error.TaskNotFoundException;
import io.github.drompincen.knowpipe.runtime.gap.GapRegistry;
import io.github.drompincen.knowpipe.runtime.notify.Notifier;
import io.github.drompincen.knowpipe.runtime.priority.Prioritizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority-ordered research task scheduler.
 *
 * <p>Tasks move QUEUED, RUNNING, then COMPLETED or FAILED. Retryable failures pass through
 * RETRYING with exponential backoff until the attempt budget is spent. At most
 * {@code maxConcurrency} tasks run at once on the worker pool; each executor call is bounded by
 * the executor timeout. Every transition is persisted, and {@link #recover()} puts tasks left
 * RUNNING by a crash back in line.
 */
@Service
public class ResearchScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResearchScheduler.class);
    private static final Duration FINISHED_RETENTION = Duration.ofHours(1);

    private final TaskStore store;
    private final ResearchExecutor executor;
    private final Prioritizer prioritizer;
    private final CacheStore cache;
    private final Notifier notifier;
    private final GapRegistry gapRegistry;
    private final Clock clock;
    private final PipelineProperties.Scheduler cfg;

    private final Map<UUID, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Map<String, UUID> inFlightByFingerprint = new ConcurrentHashMap<>();
    private final Set<UUID> running = ConcurrentHashMap.newKeySet();
    private final ReentrantLock lock = new ReentrantLock();

    private final Executor workers;
    private final Executor dispatcher;
    private final ExecutorService callGuard = Executors.newCachedThreadPool(DaemonThreads.named("research-call"));
    private final List<ExecutorService> owned = new ArrayList<>();

    @Autowired
    public ResearchScheduler(TaskStore store,
                             ResearchExecutor executor,
                             Prioritizer prioritizer,
                             CacheStore cache,
                             Notifier notifier,
                             GapRegistry gapRegistry,
                             Clock clock,
                             PipelineProperties properties) {
        this(store, executor, prioritizer, cache, notifier, gapRegistry, clock, properties, null, null);
    }

    /**
     * @param workers    runs tasks; {@code null} for a fixed pool of {@code maxConcurrency} threads
     * @param dispatcher runs the dispatch kick after enqueue and completion; {@code null} for a
     *                   single background thread
     */
    public ResearchScheduler(TaskStore store,
                             ResearchExecutor executor,
                             Prioritizer prioritizer,
                             CacheStore cache,
                             Notifier notifier,
                             GapRegistry gapRegistry,
                             Clock clock,
                             PipelineProperties properties,
                             Executor workers,
                             Executor dispatcher) {
        this.store = store;
        this.executor = executor;
        this.prioritizer = prioritizer;
        this.cache = cache;
        this.notifier = notifier;
        this.gapRegistry = gapRegistry;
        this.clock = clock;
        this.cfg = properties.getScheduler();
        if (workers == null) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, cfg.getMaxConcurrency()),
                    DaemonThreads.named("research-worker"));
            owned.add(pool);
            workers = pool;
        }
        if (dispatcher == null) {
            ExecutorService single = Executors.newSingleThreadExecutor(DaemonThreads.named("research-dispatch"));
            owned.add(single);
            dispatcher = single;
        }
        this.workers = workers;
        this.dispatcher = dispatcher;
    }

    // ---------------------------------------------------------------- public API

    /**
     * Idempotent: while a task for the same subject is in flight its id is returned. Proactive
     * subjects are dropped (empty result) once the backlog reaches {@code maxQueueDepth};
     * on-demand subjects are always accepted.
     */
    public Optional<UUID> enqueue(TaskSubject subject) {
        String fingerprint = subject.fingerprint();
        TaskRecord record;
        lock.lock();
        try {
            UUID existing = inFlightByFingerprint.get(fingerprint);
            if (existing != null) {
                TaskRecord r = tasks.get(existing);
                if (r != null && r.state().isInFlight()) {
                    log.debug("Subject {} already in flight as task {}", fingerprint, existing);
                    return Optional.of(existing);
                }
                inFlightByFingerprint.remove(fingerprint, existing);
            }
            if (subject.origin() == TaskOrigin.PROACTIVE && backlog() >= cfg.getMaxQueueDepth()) {
                log.warn("Backlog at {} tasks, dropping proactive subject {}", backlog(), fingerprint);
                return Optional.empty();
            }
            record = new TaskRecord(allocateId(subject), subject, cfg.getMaxAttempts(), clock.instant());
            tasks.put(record.id(), record);
            inFlightByFingerprint.put(fingerprint, record.id());
            persist(record);
        } finally {
            lock.unlock();
        }
        log.info("Enqueued {} task {} ({} / {})", subject.origin(), record.id(),
                subject.request().researchType(), subject.request().domain());
        kick();
        return Optional.of(record.id());
    }

    /**
     * QUEUED and RETRYING tasks are cancelled at once. A RUNNING task is flagged; it ends
     * CANCELLED when its executor returns and its result is discarded.
     */
    public ScheduledTask cancel(UUID taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            return store.find(taskId).map(TaskRecord::snapshot).orElseThrow(() -> new TaskNotFoundException(taskId));
        }
        lock.lock();
        try {
            TaskState state = record.state();
            if (state == TaskState.QUEUED || state == TaskState.RETRYING) {
                record.transition(TaskState.CANCELLED, clock.instant());
                release(record);
                persist(record);
                log.info("Task {} cancelled while {}", taskId, state);
                notifier.forgetTask(taskId);
            } else if (state == TaskState.RUNNING) {
                record.requestCancel();
                log.info("Task {} flagged for cancellation while running", taskId);
            }
        } finally {
            lock.unlock();
        }
        return record.snapshot();
    }

    public Optional<ScheduledTask> status(UUID taskId) {
        TaskRecord record = tasks.get(taskId);
        if (record != null) return Optional.of(record.snapshot());
        try {
            return store.find(taskId).map(TaskRecord::snapshot);
        } catch (RuntimeException e) {
            log.warn("Task store lookup failed for {}: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    public int runningCount() {
        return running.size();
    }

    /** QUEUED plus RETRYING tasks. */
    public int backlog() {
        int n = 0;
        for (TaskRecord r : tasks.values()) {
            TaskState s = r.state();
            if (s == TaskState.QUEUED || s == TaskState.RETRYING) n++;
        }
        return n;
    }

    /**
     * Starts the highest-priority dispatchable tasks while capacity remains.
     *
     * @return number of tasks started
     */
    @Scheduled(fixedDelayString = "${knowpipe.scheduler.poll-interval-ms:2000}")
    public int dispatch() {
        List<TaskRecord> toStart = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            Map<UUID, TaskRecord> ready = new HashMap<>();
            List<ScheduledTask> snapshots = new ArrayList<>();
            for (TaskRecord r : tasks.values()) {
                if (!running.contains(r.id()) && r.isDispatchable(now)) {
                    ready.put(r.id(), r);
                    snapshots.add(r.snapshot());
                }
            }
            int capacity = cfg.getMaxConcurrency() - running.size();
            for (ScheduledTask next : prioritizer.order(snapshots)) {
                if (capacity <= 0) break;
                TaskRecord r = ready.get(next.id());
                r.transition(TaskState.RUNNING, now);
                running.add(r.id());
                persist(r);
                toStart.add(r);
                capacity--;
            }
        } finally {
            lock.unlock();
        }
        for (TaskRecord r : toStart) {
            try {
                workers.execute(() -> run(r));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected task {}: {}", r.id(), e.getMessage());
                handleFailure(r, "worker pool rejected the task", true);
                running.remove(r.id());
            }
        }
        return toStart.size();
    }

    /**
     * Reloads unfinished tasks. RUNNING leftovers of a previous process go back to RETRYING, or
     * to FAILED when their attempts are spent.
     *
     * @return number of tasks restored
     */
    @PostConstruct
    public int recover() {
        List<TaskRecord> unfinished;
        try {
            unfinished = store.findInFlight();
        } catch (RuntimeException e) {
            log.warn("Task recovery skipped, store unavailable: {}", e.getMessage());
            return 0;
        }
        int restored = 0;
        lock.lock();
        try {
            Instant now = clock.instant();
            for (TaskRecord r : unfinished) {
                if (tasks.containsKey(r.id())) continue;
                if (r.state() == TaskState.RUNNING) {
                    if (r.attempts() >= r.maxAttempts()) {
                        r.transition(TaskState.FAILED, now);
                        r.setLastError("interrupted by restart after " + r.attempts() + " attempts");
                        persist(r);
                        log.error("Task {} failed: attempts exhausted before restart", r.id());
                        notifier.publish(event(r, NotificationKind.FAILED, Map.of(NotificationEvent.ERROR, r.lastError())));
                        continue;
                    }
                    r.scheduleRetry(now, now);
                    persist(r);
                    log.warn("Task {} was running at shutdown, rescheduled (attempt {} of {})",
                            r.id(), r.attempts() + 1, r.maxAttempts());
                }
                tasks.put(r.id(), r);
                inFlightByFingerprint.put(r.fingerprint(), r.id());
                restored++;
            }
        } finally {
            lock.unlock();
        }
        if (restored > 0) {
            log.info("Recovered {} unfinished tasks", restored);
            kick();
        }
        return restored;
    }

    /** Drops long-finished tasks from memory; {@link #status} still finds them in the store. */
    @Scheduled(fixedDelayString = "${knowpipe.scheduler.purge-interval-ms:600000}")
    public int purgeFinished() {
        Instant cutoff = clock.instant().minus(FINISHED_RETENTION);
        int purged = 0;
        for (TaskRecord r : tasks.values()) {
            if (!r.state().isInFlight() && r.updatedAt().isBefore(cutoff) && tasks.remove(r.id(), r)) {
                purged++;
            }
        }
        return purged;
    }

    @PreDestroy
    public void shutdown() {
        owned.forEach(ExecutorService::shutdownNow);
        callGuard.shutdownNow();
    }

    // ---------------------------------------------------------------- execution

    private void run(TaskRecord r) {
        if (gapDismissed(r)) {
            log.info("Gap {} of task {} was dismissed, not researching it", r.gap().id(), r.id());
            finishCancelled(r);
            return;
        }
        try {
            notifier.publish(event(r, NotificationKind.STARTED, Map.of(NotificationEvent.ATTEMPT, r.attempts())));
            ResearchResult result = callExecutor(r);
            if (r.isCancelRequested()) {
                finishCancelled(r);
                return;
            }
            complete(r, result);
        } catch (ResearchExecutionException e) {
            handleFailure(r, e.getMessage(), e.retryable());
        } catch (TimeoutException e) {
            handleFailure(r, "executor timed out after " + cfg.getExecutorTimeout(), true);
        } catch (RuntimeException e) {
            log.warn("Executor for task {} threw {}", r.id(), e.toString());
            handleFailure(r, e.toString(), true);
        } finally {
            running.remove(r.id());
            kick();
        }
    }

    private ResearchResult callExecutor(TaskRecord r) throws ResearchExecutionException, TimeoutException {
        Context context = new Context(r);
        Future<ResearchResult> call = callGuard.submit(() -> executor.execute(r.request(), context));
        try {
            return call.get(cfg.getExecutorTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw ResearchExecutionException.transientFailure("interrupted while waiting for executor", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResearchExecutionException ree) throw ree;
            if (cause instanceof RuntimeException re) throw re;
            throw ResearchExecutionException.transientFailure(String.valueOf(cause), cause);
        }
    }

    private void complete(TaskRecord r, ResearchResult result) {
        if (result == null) {
            handleFailure(r, "executor returned no result", true);
            return;
        }
        cache.put(r.cacheKey(), r.request().rawQuery(), result);
        lock.lock();
        try {
            r.transition(TaskState.COMPLETED, clock.instant());
            release(r);
            persist(r);
        } finally {
            lock.unlock();
        }
        if (r.gap() != null) {
            try {
                gapRegistry.resolve(r.gap().id());
            } catch (RuntimeException e) {
                log.warn("Could not mark gap {} resolved: {}", r.gap().id(), e.getMessage());
            }
        }
        log.info("Task {} completed on attempt {}", r.id(), r.attempts());
        notifier.publish(event(r, NotificationKind.COMPLETED, Map.of(NotificationEvent.CACHE_KEY, r.cacheKey().id())));
    }

    private boolean gapDismissed(TaskRecord r) {
        if (r.gap() == null) return false;
        try {
            return gapRegistry.isDismissed(r.gap().id());
        } catch (RuntimeException e) {
            log.warn("Could not check gap {} of task {}: {}", r.gap().id(), r.id(), e.getMessage());
            return false;
        }
    }

    private void finishCancelled(TaskRecord r) {
        lock.lock();
        try {
            r.transition(TaskState.CANCELLED, clock.instant());
            release(r);
            persist(r);
        } finally {
            lock.unlock();
        }
        log.info("Task {} cancelled, result discarded", r.id());
        notifier.forgetTask(r.id());
    }

    private void handleFailure(TaskRecord r, String error, boolean retryable) {
        if (r.isCancelRequested()) {
            finishCancelled(r);
            return;
        }
        boolean terminal;
        lock.lock();
        try {
            Instant now = clock.instant();
            r.setLastError(error);
            r.transition(TaskState.FAILED, now);
            terminal = !retryable || r.attempts() >= r.maxAttempts();
            if (terminal) {
                release(r);
            } else {
                r.scheduleRetry(now.plus(backoff(r.attempts())), now);
            }
            persist(r);
        } finally {
            lock.unlock();
        }
        if (terminal) {
            log.error("Task {} failed after {} attempt(s): {}", r.id(), r.attempts(), error);
            notifier.publish(event(r, NotificationKind.FAILED, Map.of(NotificationEvent.ERROR, error == null ? "unknown" : error)));
        } else {
            log.warn("Task {} attempt {} failed, retrying at {}: {}", r.id(), r.attempts(), r.nextAttemptAt(), error);
        }
    }

    Duration backoff(int attempt) {
        Duration base = cfg.getRetryBackoff();
        Duration cap = cfg.getMaxRetryBackoff();
        int shift = Math.min(Math.max(0, attempt - 1), 20);
        Duration d = base.multipliedBy(1L << shift);
        return d.compareTo(cap) > 0 ? cap : d;
    }

    // ---------------------------------------------------------------- helpers

    private UUID allocateId(TaskSubject subject) {
        for (int generation = 0; ; generation++) {
            UUID id = subject.taskId(generation);
            if (!tasks.containsKey(id) && !storedElsewhere(id)) return id;
        }
    }

    private boolean storedElsewhere(UUID id) {
        try {
            return store.find(id).isPresent();
        } catch (RuntimeException e) {
            return false;
        }
    }

    private void release(TaskRecord r) {
        inFlightByFingerprint.remove(r.fingerprint(), r.id());
    }

    private void persist(TaskRecord r) {
        try {
            store.save(r);
        } catch (RuntimeException e) {
            log.warn("Could not persist task {} ({}): {}", r.id(), r.state(), e.getMessage());
        }
    }

    private void kick() {
        try {
            dispatcher.execute(this::dispatchQuietly);
        } catch (RejectedExecutionException e) {
            log.debug("Dispatch kick rejected: {}", e.getMessage());
        }
    }

    private void dispatchQuietly() {
        try {
            dispatch();
        } catch (RuntimeException e) {
            log.warn("Dispatch failed: {}", e.toString());
        }
    }

    private NotificationEvent event(TaskRecord r, NotificationKind kind, Map<String, Object> extra) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(NotificationEvent.ORIGIN, r.origin().name());
        payload.put(NotificationEvent.RESEARCH_TYPE, r.request().researchType().name());
        payload.put(NotificationEvent.DOMAIN, r.request().domain());
        payload.put(NotificationEvent.QUERY, r.request().rawQuery());
        if (r.requestedBy() != null) payload.put(NotificationEvent.REQUESTED_BY, r.requestedBy());
        payload.putAll(extra);
        return new NotificationEvent(r.id(), kind, payload, clock.instant());
    }

    private final class Context implements ResearchContext {
        private final TaskRecord record;
        private final int attempt;

        Context(TaskRecord record) {
            this.record = record;
            this.attempt = record.attempts();
        }

        @Override
        public UUID taskId() {
            return record.id();
        }

        @Override
        public int attempt() {
            return attempt;
        }

        @Override
        public boolean isCancelled() {
            return record.isCancelRequested();
        }

        @Override
        public void reportProgress(double percent, String message) {
            Map<String, Object> extra = new HashMap<>();
            extra.put(NotificationEvent.PERCENT, Math.max(0.0, Math.min(100.0, percent)));
            if (message != null) extra.put(NotificationEvent.MESSAGE, message);
            notifier.publish(event(record, NotificationKind.PROGRESS, extra));
        }
    }
}
