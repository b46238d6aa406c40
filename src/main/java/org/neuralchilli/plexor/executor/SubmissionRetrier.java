package org.neuralchilli.plexor.executor;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submits task runs, retrying transient rejections with exponential backoff.
 * <p>
 * Settings are checked when the bean is created, so a bad
 * {@code plexor.submission.*} value stops the application from booting.
 */
@Startup
@ApplicationScoped
public class SubmissionRetrier {

    private static final Logger log = LoggerFactory.getLogger(SubmissionRetrier.class);

    private final int maxAttempts;
    private final Retry retry;

    @Inject
    public SubmissionRetrier(
            @ConfigProperty(name = "plexor.submission.max-attempts", defaultValue = "3") int maxAttempts,
            @ConfigProperty(name = "plexor.submission.initial-backoff-ms", defaultValue = "200") long initialBackoffMs,
            @ConfigProperty(name = "plexor.submission.max-backoff-ms", defaultValue = "5000") long maxBackoffMs,
            @ConfigProperty(name = "plexor.submission.backoff-multiplier", defaultValue = "2.0") double multiplier
    ) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("plexor.submission.max-attempts must be >= 1, got " + maxAttempts);
        }
        if (initialBackoffMs < 1) {
            throw new ConfigurationException(
                    "plexor.submission.initial-backoff-ms must be >= 1, got " + initialBackoffMs);
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new ConfigurationException("plexor.submission.max-backoff-ms (" + maxBackoffMs
                    + ") must be >= plexor.submission.initial-backoff-ms (" + initialBackoffMs + ")");
        }
        if (multiplier < 1.0) {
            throw new ConfigurationException(
                    "plexor.submission.backoff-multiplier must be >= 1.0, got " + multiplier);
        }
        this.maxAttempts = maxAttempts;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, multiplier, maxBackoffMs))
                .retryOnException(e -> e instanceof SubmissionException s && s.retryable())
                .build();
        this.retry = Retry.of("plexor-submission", config);
        this.retry.getEventPublisher().onRetry(event -> log.debug("Submission failed (attempt {}), retrying in {}ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    /**
     * Submit a run, retrying retryable failures.
     *
     * @throws SubmissionException if the failure is permanent or every attempt failed
     */
    public AssignmentHandle submit(ExecutorAdapter adapter, TaskRun run) throws SubmissionException {
        AtomicInteger attempts = new AtomicInteger();
        try {
            return retry.executeCheckedSupplier(() -> {
                attempts.incrementAndGet();
                return adapter.submit(run);
            });
        } catch (SubmissionException e) {
            if (!e.retryable()) {
                log.warn("Executor {} rejected {}: {}", adapter.name(), run.attemptId(), e.getMessage());
                throw e;
            }
            log.warn("Giving up on {} after {} submission attempts to {}: {}",
                    run.attemptId(), attempts.get(), adapter.name(), e.getMessage());
            throw SubmissionException.permanent("Submission to " + adapter.name() + " failed after "
                    + attempts.get() + " attempts: " + e.getMessage(), e);
        } catch (Throwable e) {
            if (e instanceof Error error) {
                throw error;
            }
            log.error("Executor {} failed unexpectedly on {}", adapter.name(), run.attemptId(), e);
            throw SubmissionException.permanent("Executor " + adapter.name() + " error: " + e.getMessage(), e);
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * The underlying retry, for its event stream and metrics
     */
    public Retry retry() {
        return retry;
    }
}
