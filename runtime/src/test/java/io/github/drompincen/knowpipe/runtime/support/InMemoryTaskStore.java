package io.github.drompincen.knowpipe.runtime.support;

import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ScheduledTask;
import io.github.drompincen.knowpipe.runtime.scheduler.TaskRecord;
import io.github.drompincen.knowpipe.runtime.scheduler.TaskStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps snapshots, not live records, so a "restarted" scheduler sees what was last persisted.
 */
public class InMemoryTaskStore implements TaskStore {

    private final Map<UUID, ScheduledTask> saved = new ConcurrentHashMap<>();
    private final Map<UUID, String> fingerprints = new ConcurrentHashMap<>();
    private final Map<UUID, CacheKey> keys = new ConcurrentHashMap<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public void save(TaskRecord task) {
        saved.put(task.id(), task.snapshot());
        fingerprints.put(task.id(), task.fingerprint());
        keys.put(task.id(), task.cacheKey());
        saves.incrementAndGet();
    }

    @Override
    public Optional<TaskRecord> find(UUID taskId) {
        return Optional.ofNullable(saved.get(taskId)).map(this::rebuild);
    }

    @Override
    public List<TaskRecord> findInFlight() {
        return saved.values().stream()
                .filter(t -> t.state().isInFlight())
                .sorted(Comparator.comparing(ScheduledTask::enqueuedAt))
                .map(this::rebuild)
                .toList();
    }

    public Optional<ScheduledTask> snapshot(UUID taskId) {
        return Optional.ofNullable(saved.get(taskId));
    }

    public int saveCount() {
        return saves.get();
    }

    public int size() {
        return saved.size();
    }

    private TaskRecord rebuild(ScheduledTask t) {
        return new TaskRecord(t.id(), fingerprints.get(t.id()), t.origin(), t.request(),
                keys.get(t.id()), t.gap(), t.requestedBy(), t.maxAttempts(), t.enqueuedAt(),
                t.state(), t.attempts(), t.updatedAt(), t.nextAttemptAt(), t.lastError());
    }
}
