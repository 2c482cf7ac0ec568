package villagecompute.inspections.observability;

import java.time.Duration;
import java.util.List;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.inspections.jobs.JobStatus;
import villagecompute.inspections.services.JobStore;

/**
 * Micrometer instrumentation for the job engine and its handlers.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code inspections_jobs_total{type,outcome}} - completed, retried, failed_permanent, failed_exhausted,
 * lease_lost</li>
 * <li>{@code inspections_job_duration{type,outcome}} - handler wall time</li>
 * <li>{@code inspections_jobs_depth{status}} - rows per status (gauge, queried on scrape)</li>
 * <li>{@code inspections_jobs_recovered_total} - stale jobs reset to pending</li>
 * <li>{@code inspections_images_analyzed_total{result}} - per-image analysis outcomes</li>
 * <li>{@code inspections_violations_detected_total} - violations persisted from AI findings</li>
 * <li>{@code inspections_reports_generated_total{format}} - reports uploaded</li>
 * <li>{@code inspections_ai_tokens_total{model,direction}} and {@code inspections_ai_cost_cents_total{model}}</li>
 * </ul>
 */
@ApplicationScoped
public class JobMetrics {

    private static final Logger LOG = Logger.getLogger(JobMetrics.class);

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_RETRIED = "retried";
    public static final String OUTCOME_FAILED_PERMANENT = "failed_permanent";
    public static final String OUTCOME_FAILED_EXHAUSTED = "failed_exhausted";
    public static final String OUTCOME_LEASE_LOST = "lease_lost";

    private final MeterRegistry registry;

    @Inject
    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(String jobType, String outcome, Duration duration) {
        Counter.builder("inspections_jobs_total").description("Job executions by outcome")
                .tags("type", jobType, "outcome", outcome).register(registry).increment();
        Timer.builder("inspections_job_duration").description("Job handler execution time")
                .tags("type", jobType, "outcome", outcome).register(registry).record(duration);
    }

    public void recordRecovered(int count) {
        Counter.builder("inspections_jobs_recovered_total").description("Stale running jobs reset to pending")
                .register(registry).increment(count);
    }

    public void recordImageAnalyzed(String result) {
        Counter.builder("inspections_images_analyzed_total").description("Inspection images analyzed by result")
                .tag("result", result).register(registry).increment();
    }

    public void recordViolationsDetected(int count) {
        Counter.builder("inspections_violations_detected_total").description("Violations persisted from AI findings")
                .register(registry).increment(count);
    }

    public void recordReportGenerated(String format) {
        Counter.builder("inspections_reports_generated_total").description("Reports generated and uploaded")
                .tag("format", format).register(registry).increment();
    }

    public void recordAiUsage(String model, long inputTokens, long outputTokens, long costCents) {
        Counter.builder("inspections_ai_tokens_total").tags("model", model, "direction", "input").register(registry)
                .increment(inputTokens);
        Counter.builder("inspections_ai_tokens_total").tags("model", model, "direction", "output").register(registry)
                .increment(outputTokens);
        Counter.builder("inspections_ai_cost_cents_total").tag("model", model).register(registry).increment(costCents);
    }

    /**
     * Registers one depth gauge per job status, backed by {@link JobStore#countByStatus(JobStatus)}.
     */
    public void registerQueueDepthGauges(JobStore jobStore) {
        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("inspections_jobs_depth", jobStore, store -> countSafely(store, status))
                    .description("Number of jobs in status " + status.getValue())
                    .tags(List.of(Tag.of("status", status.getValue()))).register(registry);
        }
        LOG.debug("Registered gauges: inspections_jobs_depth{status}");
    }

    private double countSafely(JobStore jobStore, JobStatus status) {
        try {
            return jobStore.countByStatus(status);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to count %s jobs, reporting 0", status.getValue());
            return 0.0;
        }
    }
}
