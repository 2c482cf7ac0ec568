package villagecompute.inspections.exceptions;

/**
 * Exception thrown when a job's context is cancelled, either because its timeout elapsed or because the worker pool is
 * shutting down.
 *
 * <p>
 * Cancellation is transient: the job is retried on the normal backoff schedule.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }

    public JobCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
