package villagecompute.inspections.services;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import io.quarkus.qute.Location;
import io.quarkus.qute.Template;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Report notification emails.
 *
 * <p>
 * All methods follow the same pattern:
 * <ol>
 * <li>Render Qute template with data binding</li>
 * <li>Send email via Mailer with notification headers</li>
 * <li>Log success/failure (errors don't throw exceptions)</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b> Email failures are logged but don't throw exceptions. A report that was generated and stored
 * is not regenerated because an email could not be sent.
 */
@ApplicationScoped
public class EmailNotificationService {

    private static final Logger LOG = Logger.getLogger(EmailNotificationService.class);

    @Inject
    Mailer mailer;

    @ConfigProperty(name = "quarkus.mailer.from")
    String fromEmail;

    @Inject
    @Location("email-templates/reportReady.html")
    Template reportReady;

    @Inject
    @Location("email-templates/reportToClient.html")
    Template reportToClient;

    /**
     * Tells the inspector their report can be downloaded.
     *
     * @return true if the email was handed to the mailer
     */
    public boolean sendReportReady(String email, String inspectorName, String reportUrl) {
        try {
            String htmlBody = reportReady.data("name", inspectorName).data("reportUrl", reportUrl).render();

            mailer.send(Mail.withHtml(email, "Your inspection report is ready", htmlBody).setFrom(fromEmail)
                    .addHeader("X-Notification-Type", "report_ready"));

            LOG.infof("Sent report ready email: email=%s", email);
            return true;

        } catch (Exception e) {
            LOG.errorf(e, "Failed to send report ready email: email=%s", email);
            return false;
        }
    }

    /**
     * Sends the report link to the inspector's client.
     *
     * @return true if the email was handed to the mailer
     */
    public boolean sendReportToClient(String email, String inspectorName, String inspectorCompany, String siteName,
            String reportUrl) {
        try {
            String from = inspectorCompany != null && !inspectorCompany.isBlank() ? inspectorCompany : inspectorName;
            String subject = String.format("Safety inspection report for %s from %s", siteName, from);

            String htmlBody = reportToClient.data("inspectorName", inspectorName)
                    .data("inspectorCompany", inspectorCompany).data("siteName", siteName)
                    .data("reportUrl", reportUrl).render();

            mailer.send(Mail.withHtml(email, subject, htmlBody).setFrom(fromEmail)
                    .addHeader("X-Notification-Type", "report_to_client"));

            LOG.infof("Sent report to client: email=%s, site=%s", email, siteName);
            return true;

        } catch (Exception e) {
            LOG.errorf(e, "Failed to send report to client: email=%s", email);
            return false;
        }
    }
}
