package villagecompute.inspections.report;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import io.quarkus.qute.Location;
import io.quarkus.qute.Template;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Renders report data to a self-contained HTML document, the input of every output format.
 */
@ApplicationScoped
public class ReportRenderer {

    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("MMMM d, yyyy HH:mm 'UTC'")
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter INSPECTION_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy");

    @Inject
    @Location("reports/inspection-report.html")
    Template inspectionReport;

    public String render(ReportData data) {
        String inspectionDate = data.inspectionDate() != null ? INSPECTION_DATE.format(data.inspectionDate()) : "";
        return inspectionReport.data("report", data).data("inspectionDate", inspectionDate)
                .data("generatedAt", GENERATED_AT.format(data.generatedAt())).render();
    }
}
