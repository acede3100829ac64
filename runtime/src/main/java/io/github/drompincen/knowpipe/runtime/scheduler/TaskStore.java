package io.github.drompincen.knowpipe.runtime.scheduler;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Durable task state, owned by the scheduler. */
public interface TaskStore {

    void save(TaskRecord task);

    Optional<TaskRecord> find(UUID taskId);

    /** Tasks left QUEUED, RUNNING or RETRYING, oldest first. */
    List<TaskRecord> findInFlight();
}
