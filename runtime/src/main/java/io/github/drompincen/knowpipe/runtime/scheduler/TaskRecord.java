package io.github.drompincen.knowpipe.runtime.scheduler;

import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.ScheduledTask;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;
import io.github.drompincen.knowpipe.protocol.api.TaskState;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutable scheduler-side task. All state changes go through {@link #transition}, which rejects
 * moves the state machine does not allow.
 */
public class TaskRecord {

    private final UUID id;
    private final String fingerprint;
    private final TaskOrigin origin;
    private final ClassifiedRequest request;
    private final CacheKey cacheKey;
    private final KnowledgeGap gap;
    private final String requestedBy;
    private final int maxAttempts;
    private final Instant enqueuedAt;

    private TaskState state;
    private int attempts;
    private Instant updatedAt;
    private Instant nextAttemptAt;
    private String lastError;
    private volatile boolean cancelRequested;

    public TaskRecord(UUID id, TaskSubject subject, int maxAttempts, Instant enqueuedAt) {
        this(id, subject.fingerprint(), subject.origin(), subject.request(), subject.cacheKey(), subject.gap(),
                subject.requestedBy(), maxAttempts, enqueuedAt, TaskState.QUEUED, 0, enqueuedAt, null, null);
    }

    public TaskRecord(UUID id, String fingerprint, TaskOrigin origin, ClassifiedRequest request, CacheKey cacheKey,
                      KnowledgeGap gap, String requestedBy, int maxAttempts, Instant enqueuedAt,
                      TaskState state, int attempts, Instant updatedAt, Instant nextAttemptAt, String lastError) {
        this.id = id;
        this.fingerprint = fingerprint;
        this.origin = origin;
        this.request = request;
        this.cacheKey = cacheKey;
        this.gap = gap;
        this.requestedBy = requestedBy;
        this.maxAttempts = maxAttempts;
        this.enqueuedAt = enqueuedAt;
        this.state = state;
        this.attempts = attempts;
        this.updatedAt = updatedAt;
        this.nextAttemptAt = nextAttemptAt;
        this.lastError = lastError;
    }

    public synchronized void transition(TaskState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + ": illegal transition " + state + " -> " + next);
        }
        if (next == TaskState.RUNNING) {
            attempts++;
            nextAttemptAt = null;
        }
        state = next;
        updatedAt = now;
    }

    public synchronized void scheduleRetry(Instant at, Instant now) {
        transition(TaskState.RETRYING, now);
        nextAttemptAt = at;
    }

    public synchronized boolean isDispatchable(Instant now) {
        return state == TaskState.QUEUED
                || (state == TaskState.RETRYING && (nextAttemptAt == null || !now.isBefore(nextAttemptAt)));
    }

    public synchronized ScheduledTask snapshot() {
        return new ScheduledTask(id, origin, request, gap, state, attempts, maxAttempts, enqueuedAt, updatedAt,
                nextAttemptAt, cacheKey.id(), lastError, requestedBy);
    }

    public UUID id() { return id; }
    public String fingerprint() { return fingerprint; }
    public TaskOrigin origin() { return origin; }
    public ClassifiedRequest request() { return request; }
    public CacheKey cacheKey() { return cacheKey; }
    public KnowledgeGap gap() { return gap; }
    public String requestedBy() { return requestedBy; }
    public int maxAttempts() { return maxAttempts; }
    public Instant enqueuedAt() { return enqueuedAt; }
    public synchronized TaskState state() { return state; }
    public synchronized int attempts() { return attempts; }
    public synchronized Instant updatedAt() { return updatedAt; }
    public synchronized Instant nextAttemptAt() { return nextAttemptAt; }
    public synchronized String lastError() { return lastError; }
    public synchronized void setLastError(String lastError) { this.lastError = lastError; }
    public boolean isCancelRequested() { return cancelRequested; }
    public void requestCancel() { this.cancelRequested = true; }
}
