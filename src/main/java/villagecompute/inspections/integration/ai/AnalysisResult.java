package villagecompute.inspections.integration.ai;

import java.util.List;

/**
 * Parsed outcome of analyzing one image.
 */
public record AnalysisResult(List<PotentialViolation> violations, String generalObservations,
        String imageQualityNotes, UsageInfo usage) {

    public AnalysisResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public AnalysisResult withUsage(UsageInfo usageInfo) {
        return new AnalysisResult(violations, generalObservations, imageQualityNotes, usageInfo);
    }
}
