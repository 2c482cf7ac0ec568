package villagecompute.inspections.integration.ai;

import java.time.Duration;

/**
 * Token usage and estimated cost of one successful provider call.
 */
public record UsageInfo(String model, int inputTokens, int outputTokens, int costCents, Duration duration) {
}
