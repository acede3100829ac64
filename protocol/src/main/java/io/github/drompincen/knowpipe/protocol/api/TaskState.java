package io.github.drompincen.knowpipe.protocol.api;

import java.util.EnumSet;
import java.util.Set;

public enum TaskState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    RETRYING,
    CANCELLED;

    public boolean isInFlight() {
        return this == QUEUED || this == RUNNING || this == RETRYING;
    }

    public boolean canTransitionTo(TaskState next) {
        return allowedNext().contains(next);
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, RETRYING, CANCELLED);
            case FAILED -> EnumSet.of(RETRYING);
            case RETRYING -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
