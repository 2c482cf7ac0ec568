package villagecompute.inspections.report;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.inspections.jobs.JobContext;

/**
 * Produces a report document in the requested format: HTML rendering followed by external conversion.
 */
@ApplicationScoped
public class DocumentGenerator {

    private static final Logger LOG = Logger.getLogger(DocumentGenerator.class);

    @Inject
    ReportRenderer renderer;

    @Inject
    DocumentConverter converter;

    public byte[] generate(ReportData data, ReportFormat format, JobContext context) {
        String html = renderer.render(data);
        context.throwIfCancelled();
        byte[] document = converter.convert(html, format, context);
        LOG.infof("Generated %s report for inspection %s (%d bytes, %d violations)", format.getValue(),
                data.inspectionId(), document.length, data.totalViolations());
        return document;
    }
}
