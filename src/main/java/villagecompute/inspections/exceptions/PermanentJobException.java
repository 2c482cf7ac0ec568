package villagecompute.inspections.exceptions;

/**
 * Exception signalling that a job can never succeed, no matter how often it is retried.
 *
 * <p>
 * Thrown by job handlers for malformed payloads, missing entities and violated preconditions. The worker pool inspects
 * the full cause chain, so a permanent error wrapped by an outer exception still fails the job immediately.
 */
public class PermanentJobException extends RuntimeException {

    public PermanentJobException(String message) {
        super(message);
    }

    public PermanentJobException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true when {@code error} or any of its causes is a {@link PermanentJobException}.
     */
    public static boolean isPermanent(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PermanentJobException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
