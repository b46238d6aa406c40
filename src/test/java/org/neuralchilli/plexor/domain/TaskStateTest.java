package org.neuralchilli.plexor.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStateTest {

    @Test
    void shouldAllowNoTransitionsFromTerminalStates() {
        for (TaskState state : TaskState.values()) {
            if (state.isTerminal()) {
                assertThat(state.allowedTargets()).as(state.name()).isEmpty();
            }
        }
    }

    @Test
    void shouldOnlyMovePendingToQueuedSkippedOrCancelled() {
        assertThat(TaskState.PENDING.allowedTargets())
                .containsExactlyInAnyOrder(TaskState.QUEUED, TaskState.SKIPPED, TaskState.CANCELLED);
        assertThat(TaskState.PENDING.canTransitionTo(TaskState.RUNNING)).isFalse();
        assertThat(TaskState.PENDING.canTransitionTo(TaskState.SUCCESS)).isFalse();
    }

    @Test
    void shouldMoveRetryingBackThroughQueued() {
        assertThat(TaskState.RETRYING.canTransitionTo(TaskState.QUEUED)).isTrue();
        assertThat(TaskState.RETRYING.canTransitionTo(TaskState.RUNNING)).isFalse();
        assertThat(TaskState.RETRYING.canTransitionTo(TaskState.CANCELLED)).isTrue();
    }

    @Test
    void shouldLetQueuedFinishWithoutStartReport() {
        assertThat(TaskState.QUEUED.canTransitionTo(TaskState.SUCCESS)).isTrue();
        assertThat(TaskState.QUEUED.canTransitionTo(TaskState.FAILED)).isTrue();
        assertThat(TaskState.QUEUED.canTransitionTo(TaskState.SKIPPED)).isFalse();
    }

    @Test
    void shouldClassifyStates() {
        assertThat(TaskState.QUEUED.isInFlight()).isTrue();
        assertThat(TaskState.RUNNING.isInFlight()).isTrue();
        assertThat(TaskState.RETRYING.isInFlight()).isFalse();

        assertThat(TaskState.PENDING.isDispatchable()).isTrue();
        assertThat(TaskState.RETRYING.isDispatchable()).isTrue();
        assertThat(TaskState.QUEUED.isDispatchable()).isFalse();

        assertThat(TaskState.SKIPPED.isTerminal()).isTrue();
        assertThat(TaskState.RETRYING.isTerminal()).isFalse();
    }
}
