package villagecompute.inspections.report;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import io.quarkus.qute.TemplateData;
import villagecompute.inspections.integration.ai.Severity;

/**
 * Everything a report template needs, aggregated before rendering.
 */
@TemplateData
public record ReportData(String inspectorName, String inspectorCompany, String inspectorLicense,
        String inspectorEmail, String inspectorPhone, String inspectorAddress, UUID inspectionId,
        String inspectionTitle, LocalDate inspectionDate, String weatherConditions, String temperature,
        String inspectorNotes, String siteName, String siteAddress, String clientName, String clientEmail,
        String clientPhone, List<ReportViolation> violations, Instant generatedAt) {

    public ReportData {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public int totalViolations() {
        return violations.size();
    }

    /**
     * Number of violations with the given severity value, e.g. {@code critical}.
     */
    public int countOf(String severity) {
        Severity wanted = Severity.fromValue(severity);
        int count = 0;
        for (ReportViolation violation : violations) {
            if (violation.severity() == wanted) {
                count++;
            }
        }
        return count;
    }

    /**
     * One confirmed violation, numbered in report order.
     */
    @TemplateData
    public record ReportViolation(int number, String description, Severity severity, String inspectorNotes,
            String thumbnailUrl, List<ReportRegulation> regulations) {

        public ReportViolation {
            regulations = regulations == null ? List.of() : List.copyOf(regulations);
        }

        public String severityLabel() {
            return severity.getValue();
        }
    }

    @TemplateData
    public record ReportRegulation(String standardNumber, String title, String category, String fullText,
            boolean primary, double relevanceScore) {
    }
}
