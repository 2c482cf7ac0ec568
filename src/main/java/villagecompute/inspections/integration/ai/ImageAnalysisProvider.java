package villagecompute.inspections.integration.ai;

import villagecompute.inspections.jobs.JobContext;

/**
 * Vision model that finds potential safety violations in a construction site photo.
 */
public interface ImageAnalysisProvider {

    /**
     * Analyzes one image, retrying transient failures internally.
     *
     * @param request
     *            image and tracking ids
     * @param context
     *            job context; cancellation aborts retry waits
     * @return findings with usage populated
     * @throws AiProviderException
     *             when the call fails for good
     * @throws villagecompute.inspections.exceptions.JobCancelledException
     *             when the context is cancelled before a result is available
     */
    AnalysisResult analyzeImage(AnalyzeImageRequest request, JobContext context);
}
