package villagecompute.inspections.services;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.inspections.jobs.AnalyzeInspectionPayload;
import villagecompute.inspections.jobs.GenerateReportPayload;
import villagecompute.inspections.jobs.Job;
import villagecompute.inspections.jobs.JobPriority;
import villagecompute.inspections.jobs.JobType;
import villagecompute.inspections.report.ReportFormat;

/**
 * Entry point for enqueuing background jobs and querying their state.
 *
 * <p>
 * Payloads are serialized to JSON with the application {@link ObjectMapper}; a payload that cannot be serialized is
 * rejected with {@link IllegalArgumentException} before anything is written. The job row is created {@code pending}
 * with zero attempts and {@code scheduled_at = now + delay}. There is no de-duplication: enqueuing the same payload
 * twice creates two jobs, which is why handlers are idempotent.
 *
 * <p>
 * <b>Retry Strategy:</b> Failed jobs retry up to {@code max_attempts} (default 3) with exponential backoff, see
 * {@link villagecompute.inspections.jobs.RetryBackoff}.
 *
 * @see villagecompute.inspections.jobs.WorkerPool for execution
 * @see JobType for job types
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    @Inject
    JobStore jobStore;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "inspections.jobs.default-max-attempts",
            defaultValue = "3")
    int defaultMaxAttempts;

    Clock clock = Clock.systemUTC();

    /**
     * Enqueues a job of a known type, using the type's default priority unless the options override it.
     */
    public Job enqueue(JobType jobType, Object payload, EnqueueOptions options) {
        return enqueue(jobType.getKey(), payload, options, jobType.getDefaultPriority().getValue());
    }

    /**
     * Enqueues a job for any dispatch key.
     *
     * @param jobType
     *            dispatch key; unregistered keys fail permanently when leased
     * @param payload
     *            object serialized to JSON
     * @param options
     *            priority, max attempts and delay
     * @return the persisted job
     * @throws IllegalArgumentException
     *             if the payload cannot be serialized
     */
    public Job enqueue(String jobType, Object payload, EnqueueOptions options) {
        return enqueue(jobType, payload, options, JobPriority.NORMAL.getValue());
    }

    private Job enqueue(String jobType, Object payload, EnqueueOptions options, int defaultPriority) {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType is required");
        }
        EnqueueOptions effective = options != null ? options : EnqueueOptions.defaults();

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payload for job type " + jobType, e);
        }

        int priority = effective.priorityOr(defaultPriority);
        int maxAttempts = effective.maxAttemptsOr(defaultMaxAttempts);
        Instant scheduledAt = clock.instant().plus(effective.getDelay());

        Job job = jobStore.enqueue(jobType, body, priority, maxAttempts, scheduledAt);
        LOG.infof("Enqueued job %s (type: %s, priority: %d, maxAttempts: %d, scheduledAt: %s)", job.id(), jobType,
                priority, maxAttempts, scheduledAt);
        return job;
    }

    /**
     * Enqueues AI analysis of every pending image of an inspection.
     */
    public Job enqueueAnalyzeInspection(UUID inspectionId, UUID userId, EnqueueOptions options) {
        return enqueue(JobType.ANALYZE_INSPECTION, new AnalyzeInspectionPayload(inspectionId, userId), options);
    }

    /**
     * Enqueues report generation.
     *
     * @param recipientEmail
     *            optional; when set the finished report is emailed there as well
     */
    public Job enqueueGenerateReport(UUID inspectionId, UUID userId, ReportFormat format, String recipientEmail,
            EnqueueOptions options) {
        return enqueue(JobType.GENERATE_REPORT,
                new GenerateReportPayload(inspectionId, userId, format.getValue(), recipientEmail), options);
    }

    /**
     * Looks up a job's current state (status, attempts, last error).
     */
    public Optional<Job> findJob(UUID jobId) {
        return jobStore.findById(jobId);
    }
}
