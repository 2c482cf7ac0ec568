package villagecompute.inspections.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import io.quarkus.qute.Template;
import io.quarkus.qute.TemplateInstance;

/**
 * Unit tests for EmailNotificationService.
 *
 * <p>
 * Templates are mocked; these tests cover addressing, subjects and the best-effort error handling.
 */
class EmailNotificationServiceTest {

    private EmailNotificationService service;
    private Mailer mailer;
    private TemplateInstance readyInstance;
    private TemplateInstance clientInstance;

    @BeforeEach
    void setUp() {
        mailer = mock(Mailer.class);
        Template reportReady = mock(Template.class);
        Template reportToClient = mock(Template.class);
        readyInstance = mock(TemplateInstance.class, Answers.RETURNS_SELF);
        clientInstance = mock(TemplateInstance.class, Answers.RETURNS_SELF);
        when(reportReady.data(anyString(), any())).thenReturn(readyInstance);
        when(reportToClient.data(anyString(), any())).thenReturn(clientInstance);
        when(readyInstance.render()).thenReturn("<p>ready</p>");
        when(clientInstance.render()).thenReturn("<p>client</p>");

        service = new EmailNotificationService();
        service.mailer = mailer;
        service.fromEmail = "reports@inspections.example.com";
        service.reportReady = reportReady;
        service.reportToClient = reportToClient;
    }

    @Test
    void testSendReportReady() {
        assertTrue(service.sendReportReady("inspector@example.com", "Dana Reyes", "https://x/reports/1/download"));

        ArgumentCaptor<Mail> mail = ArgumentCaptor.forClass(Mail.class);
        verify(mailer).send(mail.capture());
        assertEquals("inspector@example.com", mail.getValue().getTo().get(0));
        assertEquals("Your inspection report is ready", mail.getValue().getSubject());
        assertEquals("reports@inspections.example.com", mail.getValue().getFrom());
        assertEquals("<p>ready</p>", mail.getValue().getHtml());
        verify(readyInstance).data("reportUrl", "https://x/reports/1/download");
    }

    @Test
    void testSendReportToClient_subjectUsesCompany() {
        assertTrue(service.sendReportToClient("client@example.com", "Dana Reyes", "Reyes Safety LLC",
                "Riverside Tower", "https://x/reports/1/download"));

        ArgumentCaptor<Mail> mail = ArgumentCaptor.forClass(Mail.class);
        verify(mailer).send(mail.capture());
        assertEquals("Safety inspection report for Riverside Tower from Reyes Safety LLC",
                mail.getValue().getSubject());
    }

    @Test
    void testSendReportToClient_subjectFallsBackToInspector() {
        service.sendReportToClient("client@example.com", "Dana Reyes", " ", "Riverside Tower", "https://x");

        ArgumentCaptor<Mail> mail = ArgumentCaptor.forClass(Mail.class);
        verify(mailer).send(mail.capture());
        assertEquals("Safety inspection report for Riverside Tower from Dana Reyes", mail.getValue().getSubject());
    }

    @Test
    void testMailerFailure_returnsFalse() {
        doThrow(new IllegalStateException("SMTP unavailable")).when(mailer).send(any(Mail[].class));

        assertFalse(service.sendReportReady("inspector@example.com", "Dana Reyes", "https://x"));
        assertFalse(service.sendReportToClient("client@example.com", "Dana Reyes", null, "Site", "https://x"));
    }
}
