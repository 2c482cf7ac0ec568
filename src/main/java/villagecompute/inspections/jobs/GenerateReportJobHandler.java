/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.jobs;

import java.io.IOException;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.inspections.api.types.StoredObjectType;
import villagecompute.inspections.data.models.Inspection;
import villagecompute.inspections.data.models.InspectionStatus;
import villagecompute.inspections.exceptions.PermanentJobException;
import villagecompute.inspections.exceptions.ResourceNotFoundException;
import villagecompute.inspections.observability.JobMetrics;
import villagecompute.inspections.observability.LoggingConfig;
import villagecompute.inspections.report.DocumentGenerator;
import villagecompute.inspections.report.ReportData;
import villagecompute.inspections.report.ReportFormat;
import villagecompute.inspections.services.EmailNotificationService;
import villagecompute.inspections.services.InspectionService;
import villagecompute.inspections.services.ReportService;
import villagecompute.inspections.services.StorageGateway;

/**
 * Job handler for generating an inspection report.
 *
 * <p>
 * <b>Workflow:</b>
 * <ol>
 * <li>Validate the format ({@code pdf} or {@code docx})</li>
 * <li>Load the inspection and check it is in {@code review} or {@code completed}</li>
 * <li>Aggregate inspector, client, confirmed violations and their regulations</li>
 * <li>Render the document and upload it to {@code inspections/{id}/reports/{reportId}.{ext}}</li>
 * <li>Create the report record</li>
 * <li>Email the inspector, and the recipient when one was given</li>
 * </ol>
 *
 * <p>
 * <b>Failure Handling:</b> an invalid format, a missing inspection or a disallowed status is permanent. Rendering,
 * conversion and upload failures are transient. Email failures are logged only; the report exists either way.
 */
@ApplicationScoped
public class GenerateReportJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(GenerateReportJobHandler.class);

    @Inject
    ObjectMapper objectMapper;

    @Inject
    ReportService reportService;

    @Inject
    InspectionService inspectionService;

    @Inject
    DocumentGenerator documentGenerator;

    @Inject
    StorageGateway storageGateway;

    @Inject
    EmailNotificationService emailNotificationService;

    @Inject
    JobMetrics metrics;

    @ConfigProperty(
            name = "inspections.reports.base-url")
    String baseUrl;

    @Override
    public JobType handlesType() {
        return JobType.GENERATE_REPORT;
    }

    @Override
    public void execute(JobContext context, byte[] payload) throws Exception {
        GenerateReportPayload request = parse(payload);
        ReportFormat format = ReportFormat.fromValue(request.format()).orElseThrow(() -> new PermanentJobException(
                "invalid format: " + request.format() + " (must be 'pdf' or 'docx')"));
        UUID inspectionId = request.inspectionId();
        LoggingConfig.setInspectionId(inspectionId);
        LOG.infof("Generating %s report for inspection %s", format.getValue(), inspectionId);

        Inspection inspection = inspectionService.findOwned(inspectionId, request.userId())
                .orElseThrow(() -> new PermanentJobException("inspection not found: " + inspectionId));
        if (inspection.status != InspectionStatus.REVIEW && inspection.status != InspectionStatus.COMPLETED) {
            throw new PermanentJobException(
                    "inspection must be in 'review' or 'completed' status to generate report, got: "
                            + inspection.status.getValue());
        }

        ReportData data;
        try {
            data = reportService.aggregateReportData(inspectionId, request.userId());
        } catch (ResourceNotFoundException e) {
            throw new PermanentJobException("aggregate report data: " + e.getMessage(), e);
        }

        byte[] document = documentGenerator.generate(data, format, context);
        context.throwIfCancelled();

        UUID reportId = UUID.randomUUID();
        String storageKey = StorageGateway.reportKey(inspectionId, reportId, format);
        storageGateway.upload(StoredObjectType.REPORT, storageKey, document, format.getContentType());

        reportService.createReport(reportId, inspectionId, request.userId(), format, storageKey,
                data.totalViolations());
        metrics.recordReportGenerated(format.getValue());

        String reportUrl = String.format("%s/reports/%s/download?format=%s", baseUrl, reportId, format.getValue());
        if (data.inspectorEmail() != null && !data.inspectorEmail().isBlank()) {
            emailNotificationService.sendReportReady(data.inspectorEmail(), data.inspectorName(), reportUrl);
        }
        if (request.recipientEmail() != null && !request.recipientEmail().isBlank()) {
            emailNotificationService.sendReportToClient(request.recipientEmail(), data.inspectorName(),
                    data.inspectorCompany(), data.siteName(), reportUrl);
        }

        LOG.infof("Report %s generated: key=%s, size=%d bytes, violations=%d", reportId, storageKey, document.length,
                data.totalViolations());
    }

    private GenerateReportPayload parse(byte[] payload) {
        GenerateReportPayload request;
        try {
            request = objectMapper.readValue(payload, GenerateReportPayload.class);
        } catch (IOException e) {
            throw new PermanentJobException("invalid payload: " + e.getMessage(), e);
        }
        if (request == null || request.inspectionId() == null || request.userId() == null) {
            throw new PermanentJobException("invalid payload: inspection_id and user_id are required");
        }
        return request;
    }
}
