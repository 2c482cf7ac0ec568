package villagecompute.inspections.jobs;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code generate_report} job.
 *
 * @param inspectionId
 *            inspection to report on
 * @param userId
 *            owner of the inspection
 * @param format
 *            {@code pdf} or {@code docx}
 * @param recipientEmail
 *            optional address that receives the finished report
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerateReportPayload(@JsonProperty("inspection_id") UUID inspectionId,
        @JsonProperty("user_id") UUID userId, @JsonProperty("format") String format,
        @JsonProperty("recipient_email") String recipientEmail) {
}
