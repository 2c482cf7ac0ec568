package villagecompute.inspections.jobs;

/**
 * Named priority levels for queued jobs.
 *
 * <p>Workers lease the highest {@link #getValue() value} first among jobs whose {@code scheduled_at} has passed, then
 * the earliest scheduled. Arbitrary integers are accepted by the enqueuer; these constants cover the common cases.
 *
 * @see JobType#getDefaultPriority()
 */
public enum JobPriority {

    /**
     * Background work that can wait behind everything else.
     */
    LOW(0, "Background work"),

    /**
     * Default for user-initiated work such as report generation.
     */
    NORMAL(10, "Standard priority"),

    /**
     * Work a user is actively waiting on, e.g. AI analysis right after upload.
     */
    HIGH(20, "User is waiting on the result");

    private final int value;
    private final String description;

    JobPriority(int value, String description) {
        this.value = value;
        this.description = description;
    }

    /**
     * Returns the stored priority (higher values are leased first).
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns a human-readable description of the priority level.
     */
    public String getDescription() {
        return description;
    }
}
