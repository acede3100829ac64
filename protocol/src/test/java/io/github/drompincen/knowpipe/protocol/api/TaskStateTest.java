package io.github.drompincen.knowpipe.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStateTest {

    @Test
    void inFlightStates() {
        assertThat(TaskState.QUEUED.isInFlight()).isTrue();
        assertThat(TaskState.RUNNING.isInFlight()).isTrue();
        assertThat(TaskState.RETRYING.isInFlight()).isTrue();
        assertThat(TaskState.COMPLETED.isInFlight()).isFalse();
        assertThat(TaskState.FAILED.isInFlight()).isFalse();
        assertThat(TaskState.CANCELLED.isInFlight()).isFalse();
    }

    @Test
    void lifecycleTransitions() {
        assertThat(TaskState.QUEUED.canTransitionTo(TaskState.RUNNING)).isTrue();
        assertThat(TaskState.RUNNING.canTransitionTo(TaskState.FAILED)).isTrue();
        assertThat(TaskState.FAILED.canTransitionTo(TaskState.RETRYING)).isTrue();
        assertThat(TaskState.RETRYING.canTransitionTo(TaskState.RUNNING)).isTrue();

        assertThat(TaskState.QUEUED.canTransitionTo(TaskState.COMPLETED)).isFalse();
        assertThat(TaskState.FAILED.canTransitionTo(TaskState.RUNNING)).isFalse();
        for (TaskState next : TaskState.values()) {
            assertThat(TaskState.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(TaskState.CANCELLED.canTransitionTo(next)).isFalse();
        }
    }
}
