package io.github.drompincen.knowpipe.runtime.scheduler;

import java.util.UUID;

/** Handle an executor gets for the task it is working on. */
public interface ResearchContext {

    UUID taskId();

    /** 1-based attempt number. */
    int attempt();

    /** Set when the task was cancelled while running; the executor should stop early. */
    boolean isCancelled();

    /** Progress in [0, 100]. Throttled per task before it reaches subscribers. */
    void reportProgress(double percent, String message);
}
