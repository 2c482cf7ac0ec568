package villagecompute.inspections.exceptions;

/**
 * Exception thrown when a requested resource is not found (e.g., inspection, image, report).
 *
 * <p>
 * Extends RuntimeException per project standards. Job handlers treat it as a permanent failure.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
