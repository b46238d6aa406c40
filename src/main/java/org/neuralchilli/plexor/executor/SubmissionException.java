package org.neuralchilli.plexor.executor;

/**
 * Raised by an executor that could not accept a task run.
 * Retryable failures (queue full, quota exhausted, I/O) may succeed later;
 * the rest will never succeed for this run.
 */
public class SubmissionException extends Exception {

    private final boolean retryable;

    public SubmissionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public SubmissionException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static SubmissionException transientFailure(String message) {
        return new SubmissionException(message, true);
    }

    public static SubmissionException transientFailure(String message, Throwable cause) {
        return new SubmissionException(message, cause, true);
    }

    public static SubmissionException permanent(String message) {
        return new SubmissionException(message, false);
    }

    public static SubmissionException permanent(String message, Throwable cause) {
        return new SubmissionException(message, cause, false);
    }

    public boolean retryable() {
        return retryable;
    }
}
