package villagecompute.inspections.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Central configuration and utilities for structured logging with observability context.
 *
 * <p>
 * This class defines standard MDC field names and provides helper methods for enriching logs with contextual metadata.
 * The console log format in {@code application.yaml} prints these fields on every line.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier for distributed tracing</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code worker_id} - Worker loop number (1-based) within the pool</li>
 * <li>{@code job_id} - Job UUID (only for async job execution)</li>
 * <li>{@code job_type} - Job type key, e.g. {@code analyze_inspection}</li>
 * <li>{@code attempt} - Attempt number of the current job execution</li>
 * <li>{@code inspection_id} - Inspection the current unit of work belongs to</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the worker pool:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(job.id());
 * LoggingConfig.setJobType(job.jobType());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Fan-out threads do not
 * inherit the worker's fields and must set their own.
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (hexadecimal string, 32 characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (hexadecimal string, 16 characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_WORKER_ID = "worker_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_JOB_TYPE = "job_type";

    public static final String MDC_ATTEMPT = "attempt";

    public static final String MDC_INSPECTION_ID = "inspection_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span.
     *
     * <p>
     * If no active span exists, the fields are set to empty strings to maintain consistent log structure.
     */
    public static void enrichWithTraceContext() {
        Span currentSpan = Span.current();
        SpanContext spanContext = currentSpan.getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setWorkerId(int workerId) {
        MDC.put(MDC_WORKER_ID, Integer.toString(workerId));
    }

    /**
     * Sets the job ID for async job execution logs.
     *
     * @param jobId
     *            job UUID
     */
    public static void setJobId(UUID jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setJobType(String jobType) {
        if (jobType != null) {
            MDC.put(MDC_JOB_TYPE, jobType);
        }
    }

    public static void setAttempt(int attempt) {
        MDC.put(MDC_ATTEMPT, Integer.toString(attempt));
    }

    public static void setInspectionId(UUID inspectionId) {
        if (inspectionId != null) {
            MDC.put(MDC_INSPECTION_ID, inspectionId.toString());
        }
    }

    /**
     * Clears the per-job fields, keeping the worker id of the current thread.
     */
    public static void clearJobContext() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_ATTEMPT);
        MDC.remove(MDC_INSPECTION_ID);
    }

    /**
     * Clears all observability-related MDC fields. Must be called when a thread finishes its work to prevent context
     * leakage across thread reuse.
     */
    public static void clearMDC() {
        clearJobContext();
        MDC.remove(MDC_WORKER_ID);
    }
}
