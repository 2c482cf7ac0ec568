package villagecompute.inspections.services;

import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.inspections.data.models.AiUsageRecord;
import villagecompute.inspections.integration.ai.UsageInfo;
import villagecompute.inspections.observability.JobMetrics;

/**
 * Service for tracking AI API usage and estimating its cost.
 *
 * <p>
 * <b>Cost Estimation</b> (Claude 3.5 Sonnet): $3 per 1M input tokens, $15 per 1M output tokens. Each component is
 * rounded down to whole cents separately.
 */
@ApplicationScoped
public class AiUsageTrackingService {

    private static final Logger LOG = Logger.getLogger(AiUsageTrackingService.class);

    public static final String REQUEST_TYPE_ANALYZE_IMAGE = "analyze_image";

    static final long INPUT_CENTS_PER_MILLION = 300;
    static final long OUTPUT_CENTS_PER_MILLION = 1500;

    @Inject
    JobMetrics metrics;

    /**
     * Estimated cost in cents of one call.
     */
    public static int estimateCostCents(int inputTokens, int outputTokens) {
        long inputCost = inputTokens * INPUT_CENTS_PER_MILLION / 1_000_000L;
        long outputCost = outputTokens * OUTPUT_CENTS_PER_MILLION / 1_000_000L;
        return (int) (inputCost + outputCost);
    }

    /**
     * Persists a usage row and updates the token and cost counters.
     *
     * @param userId
     *            inspector the call was made for
     * @param inspectionId
     *            inspection being analyzed, may be null
     * @param usage
     *            usage reported by the provider
     * @param requestType
     *            kind of call, e.g. {@link #REQUEST_TYPE_ANALYZE_IMAGE}
     */
    public void recordUsage(UUID userId, UUID inspectionId, UsageInfo usage, String requestType) {
        AiUsageRecord.record(userId, inspectionId, usage.model(), usage.inputTokens(), usage.outputTokens(),
                usage.costCents(), requestType);
        metrics.recordAiUsage(usage.model(), usage.inputTokens(), usage.outputTokens(), usage.costCents());
        LOG.debugf("Tracked AI usage for inspection %s: %d in, %d out, %d cents", inspectionId, usage.inputTokens(),
                usage.outputTokens(), usage.costCents());
    }
}
