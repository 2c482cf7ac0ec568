package villagecompute.inspections.services;

import java.time.Duration;

import villagecompute.inspections.jobs.JobPriority;

/**
 * Immutable options for {@link DelayedJobService#enqueue}.
 *
 * <p>
 * Unset values fall back to the defaults: {@link JobPriority#NORMAL}, the configured max attempts (3) and no delay.
 *
 * <pre>
 * delayedJobService.enqueueAnalyzeInspection(inspectionId, userId,
 *         EnqueueOptions.defaults().withPriority(JobPriority.HIGH).withMaxAttempts(5));
 * </pre>
 */
public final class EnqueueOptions {

    private static final EnqueueOptions DEFAULTS = new EnqueueOptions(null, null, Duration.ZERO);

    private final Integer priority;
    private final Integer maxAttempts;
    private final Duration delay;

    private EnqueueOptions(Integer priority, Integer maxAttempts, Duration delay) {
        this.priority = priority;
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    public static EnqueueOptions defaults() {
        return DEFAULTS;
    }

    public EnqueueOptions withPriority(JobPriority priority) {
        return withPriority(priority.getValue());
    }

    public EnqueueOptions withPriority(int priority) {
        return new EnqueueOptions(priority, maxAttempts, delay);
    }

    /**
     * @throws IllegalArgumentException
     *             if {@code maxAttempts} is below 1
     */
    public EnqueueOptions withMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        return new EnqueueOptions(priority, maxAttempts, delay);
    }

    /**
     * @throws IllegalArgumentException
     *             if {@code delay} is negative
     */
    public EnqueueOptions withDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative, got " + delay);
        }
        return new EnqueueOptions(priority, maxAttempts, delay);
    }

    public int priorityOr(int defaultPriority) {
        return priority != null ? priority : defaultPriority;
    }

    public int maxAttemptsOr(int defaultMaxAttempts) {
        return maxAttempts != null ? maxAttempts : defaultMaxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }
}
