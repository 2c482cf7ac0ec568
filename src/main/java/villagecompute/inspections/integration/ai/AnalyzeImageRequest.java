package villagecompute.inspections.integration.ai;

import java.util.UUID;

/**
 * Input of {@link ImageAnalysisProvider#analyzeImage}.
 *
 * @param imageData
 *            raw image bytes
 * @param contentType
 *            MIME type, e.g. {@code image/jpeg}
 * @param context
 *            optional inspector notes appended to the prompt
 * @param imageId
 *            image being analyzed, for logs
 * @param inspectionId
 *            owning inspection, for usage tracking
 * @param userId
 *            inspector, for usage tracking
 */
public record AnalyzeImageRequest(byte[] imageData, String contentType, String context, UUID imageId,
        UUID inspectionId, UUID userId) {
}
