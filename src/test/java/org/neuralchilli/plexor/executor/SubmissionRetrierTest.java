package org.neuralchilli.plexor.executor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.exception.ConfigurationException;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionRetrierTest {

    private final List<Long> waits = new CopyOnWriteArrayList<>();
    private final SubmissionRetrier retrier = new SubmissionRetrier(3, 10, 100, 2.0);
    private final TaskRun run = new TaskRun(
            new TaskAttemptId(UUID.randomUUID(), "load", 1), "default", "echo", List.of("hi"), null, null, 60);

    @BeforeEach
    void recordWaits() {
        retrier.retry().getEventPublisher().onRetry(event -> waits.add(event.getWaitInterval().toMillis()));
    }

    @Test
    void shouldSubmitFirstTime() throws Exception {
        FakeExecutorAdapter adapter = new FakeExecutorAdapter("celery");

        AssignmentHandle handle = retrier.submit(adapter, run);

        assertThat(handle.attemptId()).isEqualTo(run.attemptId());
        assertThat(adapter.submitted()).containsExactly(run);
        assertThat(waits).isEmpty();
    }

    @Test
    void shouldRetryTransientFailuresWithBackoff() throws Exception {
        FakeExecutorAdapter adapter = new FakeExecutorAdapter("celery")
                .failNextSubmission(SubmissionException.transientFailure("queue full"))
                .failNextSubmission(SubmissionException.transientFailure("queue full"));

        retrier.submit(adapter, run);

        assertThat(adapter.submitted()).hasSize(1);
        assertThat(waits).containsExactly(10L, 20L);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        FakeExecutorAdapter adapter = new FakeExecutorAdapter("celery");
        for (int i = 0; i < 3; i++) {
            adapter.failNextSubmission(SubmissionException.transientFailure("broker down"));
        }

        assertThatThrownBy(() -> retrier.submit(adapter, run))
                .isInstanceOf(SubmissionException.class)
                .hasMessageContaining("after 3 attempts")
                .satisfies(e -> assertThat(((SubmissionException) e).retryable()).isFalse());
        assertThat(adapter.submitted()).isEmpty();
        assertThat(waits).hasSize(2);
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        FakeExecutorAdapter adapter = new FakeExecutorAdapter("k8s")
                .failNextSubmission(SubmissionException.permanent("no image"));

        assertThatThrownBy(() -> retrier.submit(adapter, run))
                .isInstanceOf(SubmissionException.class)
                .hasMessage("no image");
        assertThat(waits).isEmpty();
    }

    @Test
    void shouldRejectInvalidSettingsOnConstruction() {
        assertThatThrownBy(() -> new SubmissionRetrier(0, 10, 100, 2.0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max-attempts");
        assertThatThrownBy(() -> new SubmissionRetrier(3, 500, 100, 2.0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max-backoff-ms");
        assertThatThrownBy(() -> new SubmissionRetrier(3, 10, 100, 0.5))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("backoff-multiplier");
    }
}
