package villagecompute.inspections.jobs;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of an {@code analyze_inspection} job.
 *
 * @param inspectionId
 *            inspection whose pending images are analyzed
 * @param userId
 *            owner of the inspection
 */
public record AnalyzeInspectionPayload(@JsonProperty("inspection_id") UUID inspectionId,
        @JsonProperty("user_id") UUID userId) {
}
