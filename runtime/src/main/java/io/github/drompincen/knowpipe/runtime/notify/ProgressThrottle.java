package io.github.drompincen.knowpipe.runtime.notify;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Per-task minimum interval between accepted progress events. */
public class ProgressThrottle {

    private final long minIntervalMs;
    private final Map<UUID, Long> lastAccepted = new ConcurrentHashMap<>();

    public ProgressThrottle(Duration minInterval) {
        this.minIntervalMs = Math.max(0, minInterval.toMillis());
    }

    public boolean tryAcquire(UUID taskId, Instant now) {
        long nowMs = now.toEpochMilli();
        boolean[] accepted = new boolean[1];
        lastAccepted.compute(taskId, (id, last) -> {
            if (last == null || nowMs - last >= minIntervalMs) {
                accepted[0] = true;
                return nowMs;
            }
            return last;
        });
        return accepted[0];
    }

    public void forget(UUID taskId) {
        lastAccepted.remove(taskId);
    }

    public int trackedTasks() {
        return lastAccepted.size();
    }
}
