package villagecompute.inspections.services;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.inspections.api.types.StoredObjectType;
import villagecompute.inspections.data.models.Client;
import villagecompute.inspections.data.models.Inspection;
import villagecompute.inspections.data.models.InspectionImage;
import villagecompute.inspections.data.models.Regulation;
import villagecompute.inspections.data.models.Report;
import villagecompute.inspections.data.models.User;
import villagecompute.inspections.data.models.Violation;
import villagecompute.inspections.data.models.ViolationRegulation;
import villagecompute.inspections.exceptions.ResourceNotFoundException;
import villagecompute.inspections.integration.ai.Severity;
import villagecompute.inspections.report.ReportData;
import villagecompute.inspections.report.ReportData.ReportRegulation;
import villagecompute.inspections.report.ReportData.ReportViolation;
import villagecompute.inspections.report.ReportFormat;

/**
 * Aggregates report content and records generated reports.
 *
 * <p>
 * Only {@code confirmed} violations appear in a report. Missing optional pieces (client, regulations of a violation,
 * thumbnail URLs) are logged and left out rather than failing the report.
 */
@ApplicationScoped
public class ReportService {

    private static final Logger LOG = Logger.getLogger(ReportService.class);

    @Inject
    StorageGateway storageGateway;

    @ConfigProperty(
            name = "inspections.reports.thumbnail-url-ttl",
            defaultValue = "1h")
    Duration thumbnailUrlTtl;

    /**
     * @throws ResourceNotFoundException
     *             if the user or the inspection does not exist
     */
    @Transactional
    public ReportData aggregateReportData(UUID inspectionId, UUID userId) {
        User user = User.<User> findByIdOptional(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        Inspection inspection = Inspection.findOwned(inspectionId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Inspection not found: " + inspectionId));

        Client client = null;
        if (inspection.clientId != null) {
            client = Client.<Client> findByIdOptional(inspection.clientId).orElse(null);
            if (client == null) {
                LOG.warnf("Client %s of inspection %s not found, report has no client section", inspection.clientId,
                        inspectionId);
            }
        }

        List<Violation> violations = Violation.findConfirmedByInspection(inspectionId);
        List<ReportViolation> reportViolations = new ArrayList<>(violations.size());
        for (int i = 0; i < violations.size(); i++) {
            Violation violation = violations.get(i);
            reportViolations.add(new ReportViolation(i + 1, violation.description,
                    Severity.fromValue(violation.severity), violation.inspectorNotes, thumbnailUrl(violation),
                    regulations(violation)));
        }

        String inspectorEmail = notBlank(user.businessEmail) ? user.businessEmail : user.email;

        return new ReportData(user.displayName(), user.businessName, user.businessLicense, inspectorEmail,
                user.businessPhone, user.businessAddress, inspection.id, inspection.title, inspection.inspectionDate,
                inspection.weatherConditions, inspection.temperature, inspection.inspectorNotes, inspection.title,
                inspection.fullAddress(), client != null ? client.name : null, client != null ? client.email : null,
                client != null ? client.phone : null, reportViolations, Instant.now());
    }

    /**
     * Records a generated report.
     *
     * @return the report id
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public UUID createReport(UUID reportId, UUID inspectionId, UUID userId, ReportFormat format, String storageKey,
            int violationCount) {
        Report report = new Report();
        report.id = reportId;
        report.inspectionId = inspectionId;
        report.userId = userId;
        if (format == ReportFormat.PDF) {
            report.pdfStorageKey = storageKey;
        } else {
            report.docxStorageKey = storageKey;
        }
        report.violationCount = violationCount;
        report.generatedAt = Instant.now();
        report.persist();
        return report.id;
    }

    private List<ReportRegulation> regulations(Violation violation) {
        try {
            List<ReportRegulation> result = new ArrayList<>();
            for (ViolationRegulation link : ViolationRegulation.findByViolation(violation.id)) {
                Regulation regulation = Regulation.findById(link.regulationId);
                if (regulation == null) {
                    continue;
                }
                result.add(new ReportRegulation(regulation.standardNumber, regulation.title, regulation.category,
                        regulation.fullText, link.isPrimary,
                        link.relevanceScore != null ? link.relevanceScore.doubleValue() : 0.0));
            }
            return result;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to load regulations for violation %s", violation.id);
            return List.of();
        }
    }

    private String thumbnailUrl(Violation violation) {
        if (violation.imageId == null) {
            return null;
        }
        InspectionImage image = InspectionImage.findById(violation.imageId);
        if (image == null || !notBlank(image.thumbnailKey)) {
            return null;
        }
        try {
            return storageGateway.signedUrl(StoredObjectType.THUMBNAIL, image.thumbnailKey, thumbnailUrlTtl);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to generate thumbnail URL for image %s", image.id);
            return null;
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
