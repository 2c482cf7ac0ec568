package villagecompute.inspections.jobs;

/**
 * Job lifecycle statuses, persisted lowercase in {@code jobs.status}.
 */
public enum JobStatus {
    /**
     * Created or requeued, awaiting a worker.
     */
    PENDING("pending"),

    /**
     * Leased by exactly one worker.
     */
    RUNNING("running"),

    /**
     * Handler returned successfully.
     */
    COMPLETED("completed"),

    /**
     * Permanent error or retries exhausted.
     */
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
