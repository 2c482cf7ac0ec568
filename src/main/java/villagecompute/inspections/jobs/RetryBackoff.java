package villagecompute.inspections.jobs;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff for requeued jobs.
 *
 * <p>
 * {@code delay = 2^(attempts - 1) * baseDelay}, multiplied by a random jitter in [0.75, 1.25) so that jobs failing
 * together do not retry together, and capped at {@code maxDelay}.
 */
public class RetryBackoff {

    private static final int MAX_EXPONENT = 20;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier jitter;

    public RetryBackoff(Duration baseDelay, Duration maxDelay) {
        this(baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble(0.75, 1.25));
    }

    RetryBackoff(Duration baseDelay, Duration maxDelay, DoubleSupplier jitter) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
    }

    /**
     * Returns the delay before the next attempt of a job that has been leased {@code attempts} times.
     */
    public Duration delayFor(int attempts) {
        int exponent = Math.min(Math.max(attempts, 1) - 1, MAX_EXPONENT);
        double millis = baseDelay.toMillis() * Math.pow(2, exponent) * jitter.getAsDouble();
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(capped, 0L));
    }
}
