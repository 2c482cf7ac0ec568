package villagecompute.inspections.exceptions;

/**
 * Exception thrown when a domain precondition fails (e.g., an inspection status that does not allow the requested
 * transition, an unsupported report format).
 *
 * <p>
 * Extends RuntimeException per project standards. Job handlers translate it into a {@link PermanentJobException}.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
