package villagecompute.inspections.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Enumeration of all async job types with their persisted keys and default priorities.
 *
 * <p>
 * The {@link #getKey() key} is what is stored in {@code jobs.job_type} and used for dispatch. Rows whose key has no
 * registered handler fail permanently when leased.
 *
 * @see JobPriority for priority levels
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Runs AI vision analysis over every pending image of an inspection, then moves it to review.
     * <p>
     * <b>Handler:</b> AnalyzeInspectionJobHandler
     */
    ANALYZE_INSPECTION("analyze_inspection", JobPriority.NORMAL, "AI image analysis"),

    /**
     * Renders an inspection report (PDF or DOCX), stores it and emails the recipients.
     * <p>
     * <b>Handler:</b> GenerateReportJobHandler
     */
    GENERATE_REPORT("generate_report", JobPriority.NORMAL, "Report generation");

    private final String key;
    private final JobPriority defaultPriority;
    private final String description;

    JobType(String key, JobPriority defaultPriority, String description) {
        this.key = key;
        this.defaultPriority = defaultPriority;
        this.description = description;
    }

    public String getKey() {
        return key;
    }

    public JobPriority getDefaultPriority() {
        return defaultPriority;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Looks up a job type by its persisted key.
     *
     * @param key
     *            value of {@code jobs.job_type}
     * @return matching type, or empty for unknown keys
     */
    public static Optional<JobType> fromKey(String key) {
        return Arrays.stream(values()).filter(type -> type.key.equals(key)).findFirst();
    }
}
