/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.inspections.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.inspections.api.types.StoredObjectType;
import villagecompute.inspections.data.models.Inspection;
import villagecompute.inspections.data.models.InspectionStatus;
import villagecompute.inspections.exceptions.JobCancelledException;
import villagecompute.inspections.exceptions.PermanentJobException;
import villagecompute.inspections.integration.ai.Severity;
import villagecompute.inspections.observability.JobMetrics;
import villagecompute.inspections.report.DocumentGenerator;
import villagecompute.inspections.report.ReportData;
import villagecompute.inspections.report.ReportData.ReportViolation;
import villagecompute.inspections.report.ReportFormat;
import villagecompute.inspections.services.EmailNotificationService;
import villagecompute.inspections.services.InspectionService;
import villagecompute.inspections.services.ReportService;
import villagecompute.inspections.services.StorageGateway;

/**
 * Unit tests for {@link GenerateReportJobHandler}.
 */
class GenerateReportJobHandlerTest {

    private static final byte[] PDF = "%PDF-1.7 report".getBytes(StandardCharsets.UTF_8);

    @Mock
    ReportService reportService;

    @Mock
    InspectionService inspectionService;

    @Mock
    DocumentGenerator documentGenerator;

    @Mock
    StorageGateway storageGateway;

    @Mock
    EmailNotificationService emailNotificationService;

    private GenerateReportJobHandler handler;
    private SimpleMeterRegistry meterRegistry;
    private Inspection inspection;

    private final UUID inspectionId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        meterRegistry = new SimpleMeterRegistry();

        handler = new GenerateReportJobHandler();
        handler.objectMapper = new ObjectMapper();
        handler.reportService = reportService;
        handler.inspectionService = inspectionService;
        handler.documentGenerator = documentGenerator;
        handler.storageGateway = storageGateway;
        handler.emailNotificationService = emailNotificationService;
        handler.metrics = new JobMetrics(meterRegistry);
        handler.baseUrl = "https://inspections.example.com";

        inspection = new Inspection();
        inspection.id = inspectionId;
        inspection.userId = userId;
        inspection.status = InspectionStatus.REVIEW;
        when(inspectionService.findOwned(inspectionId, userId)).thenReturn(Optional.of(inspection));
        when(reportService.aggregateReportData(inspectionId, userId)).thenReturn(reportData("inspector@example.com"));
        when(documentGenerator.generate(any(), any(), any())).thenReturn(PDF);
        when(reportService.createReport(any(), any(), any(), any(), anyString(), anyInt()))
                .thenAnswer(inv -> inv.getArgument(0));
    }

    private ReportData reportData(String inspectorEmail) {
        List<ReportViolation> violations = List.of(
                new ReportViolation(1, "Missing guardrail on level 3", Severity.SERIOUS, null, null, List.of()),
                new ReportViolation(2, "Extension cord damaged", Severity.OTHER, null, null, List.of()));
        return new ReportData("Dana Reyes", "Reyes Safety LLC", "CSP-1234", inspectorEmail, null, null, inspectionId,
                "Riverside Tower", LocalDate.of(2025, 3, 1), "Clear", "18C", null, "Riverside Tower",
                "100 River Rd", "Acme Builders", null, null, violations, Instant.now());
    }

    private byte[] payload(String format, String recipientEmail) {
        StringBuilder json = new StringBuilder("{\"inspection_id\":\"").append(inspectionId)
                .append("\",\"user_id\":\"").append(userId).append("\",\"format\":\"").append(format).append('"');
        if (recipientEmail != null) {
            json.append(",\"recipient_email\":\"").append(recipientEmail).append('"');
        }
        return json.append('}').toString().getBytes(StandardCharsets.UTF_8);
    }

    private static JobContext context() {
        return new JobContext(UUID.randomUUID(), JobType.GENERATE_REPORT.getKey(), 1, 3, Duration.ofMinutes(1));
    }

    @Test
    void testHandlesType() {
        assertEquals(JobType.GENERATE_REPORT, handler.handlesType());
    }

    @Test
    void testSuccess_uploadsRecordsAndNotifies() throws Exception {
        handler.execute(context(), payload("pdf", "client@example.com"));

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(storageGateway).upload(eq(StoredObjectType.REPORT), key.capture(), eq(PDF), eq("application/pdf"));
        assertTrue(key.getValue().startsWith("inspections/" + inspectionId + "/reports/"));
        assertTrue(key.getValue().endsWith(".pdf"));

        ArgumentCaptor<UUID> reportId = ArgumentCaptor.forClass(UUID.class);
        verify(reportService).createReport(reportId.capture(), eq(inspectionId), eq(userId), eq(ReportFormat.PDF),
                eq(key.getValue()), eq(2));
        assertEquals(StorageGateway.reportKey(inspectionId, reportId.getValue(), ReportFormat.PDF), key.getValue());

        String url = "https://inspections.example.com/reports/" + reportId.getValue() + "/download?format=pdf";
        verify(emailNotificationService).sendReportReady("inspector@example.com", "Dana Reyes", url);
        verify(emailNotificationService).sendReportToClient("client@example.com", "Dana Reyes", "Reyes Safety LLC",
                "Riverside Tower", url);
        assertEquals(1.0,
                meterRegistry.get("inspections_reports_generated_total").tag("format", "pdf").counter().count());
    }

    @Test
    void testDocx_usesDocxKeyAndContentType() throws Exception {
        handler.execute(context(), payload("DOCX", null));

        verify(documentGenerator).generate(any(), eq(ReportFormat.DOCX), any());
        verify(storageGateway).upload(eq(StoredObjectType.REPORT), endsWith(".docx"),
                eq(PDF), eq(ReportFormat.DOCX.getContentType()));
    }

    @Test
    void testCompletedInspection_isAllowed() throws Exception {
        inspection.status = InspectionStatus.COMPLETED;

        handler.execute(context(), payload("pdf", null));

        verify(reportService).createReport(any(), eq(inspectionId), eq(userId), eq(ReportFormat.PDF), anyString(),
                eq(2));
    }

    @Test
    void testDraftInspection_isPermanent() {
        inspection.status = InspectionStatus.DRAFT;

        PermanentJobException error = assertThrows(PermanentJobException.class,
                () -> handler.execute(context(), payload("pdf", null)));

        assertTrue(error.getMessage().contains("got: draft"));
        verifyNoInteractions(documentGenerator, storageGateway, emailNotificationService);
        verify(reportService, never()).createReport(any(), any(), any(), any(), anyString(), anyInt());
    }

    @Test
    void testInvalidFormat_isPermanent() {
        PermanentJobException error = assertThrows(PermanentJobException.class,
                () -> handler.execute(context(), payload("html", null)));

        assertEquals("invalid format: html (must be 'pdf' or 'docx')", error.getMessage());
        verifyNoInteractions(inspectionService, documentGenerator, storageGateway);
    }

    @Test
    void testMissingInspection_isPermanent() {
        when(inspectionService.findOwned(inspectionId, userId)).thenReturn(Optional.empty());

        PermanentJobException error = assertThrows(PermanentJobException.class,
                () -> handler.execute(context(), payload("pdf", null)));

        assertEquals("inspection not found: " + inspectionId, error.getMessage());
    }

    @Test
    void testEmailFailure_doesNotFailJob() throws Exception {
        when(emailNotificationService.sendReportReady(anyString(), anyString(), anyString())).thenReturn(false);
        when(emailNotificationService.sendReportToClient(anyString(), anyString(), anyString(), anyString(),
                anyString())).thenReturn(false);

        handler.execute(context(), payload("pdf", "client@example.com"));

        verify(reportService).createReport(any(), eq(inspectionId), eq(userId), eq(ReportFormat.PDF), anyString(),
                eq(2));
    }

    @Test
    void testNoInspectorEmail_skipsInspectorNotification() throws Exception {
        when(reportService.aggregateReportData(inspectionId, userId)).thenReturn(reportData(null));

        handler.execute(context(), payload("pdf", null));

        verifyNoInteractions(emailNotificationService);
    }

    @Test
    void testUploadFailure_isTransient() {
        doThrow(new StorageGateway.StorageException("upload failed", null)).when(storageGateway)
                .upload(any(), anyString(), any(), anyString());

        StorageGateway.StorageException error = assertThrows(StorageGateway.StorageException.class,
                () -> handler.execute(context(), payload("pdf", null)));

        assertFalse(PermanentJobException.isPermanent(error));
        verify(reportService, never()).createReport(any(), any(), any(), any(), anyString(), anyInt());
    }

    @Test
    void testCancelledAfterRendering_doesNotUpload() {
        JobContext context = context();
        when(documentGenerator.generate(any(), any(), any())).thenAnswer(inv -> {
            context.cancel("worker pool shutting down");
            return PDF;
        });

        assertThrows(JobCancelledException.class, () -> handler.execute(context, payload("pdf", null)));
        verifyNoInteractions(storageGateway);
    }
}
