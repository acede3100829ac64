package io.github.drompincen.knowpipe.runtime.scheduler;

/**
 * Failure reported by a {@link ResearchExecutor}. Retryable failures are rescheduled with backoff
 * until the attempt budget is spent; fatal ones end the task at once.
 */
public class ResearchExecutionException extends Exception {

    private final boolean retryable;

    public ResearchExecutionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ResearchExecutionException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static ResearchExecutionException transientFailure(String message, Throwable cause) {
        return new ResearchExecutionException(message, true, cause);
    }

    public static ResearchExecutionException fatal(String message) {
        return new ResearchExecutionException(message, false);
    }

    public boolean retryable() {
        return retryable;
    }
}
