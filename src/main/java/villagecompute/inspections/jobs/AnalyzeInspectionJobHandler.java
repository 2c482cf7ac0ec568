/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.jobs;

import java.io.IOException;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.context.Context;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.inspections.api.types.StoredObject;
import villagecompute.inspections.api.types.StoredObjectType;
import villagecompute.inspections.data.models.ImageAnalysisStatus;
import villagecompute.inspections.data.models.InspectionImage;
import villagecompute.inspections.exceptions.JobCancelledException;
import villagecompute.inspections.exceptions.PermanentJobException;
import villagecompute.inspections.exceptions.ResourceNotFoundException;
import villagecompute.inspections.exceptions.ValidationException;
import villagecompute.inspections.integration.ai.AnalysisResult;
import villagecompute.inspections.integration.ai.AnalyzeImageRequest;
import villagecompute.inspections.integration.ai.ImageAnalysisProvider;
import villagecompute.inspections.integration.ai.PotentialViolation;
import villagecompute.inspections.observability.JobMetrics;
import villagecompute.inspections.observability.LoggingConfig;
import villagecompute.inspections.services.InspectionService;
import villagecompute.inspections.services.StorageGateway;
import villagecompute.inspections.services.ViolationService;

/**
 * Job handler for AI analysis of an inspection's photos.
 *
 * <p>
 * <b>Workflow:</b>
 * <ol>
 * <li>Move the inspection to {@code analyzing} (allowed from draft, analyzing or review)</li>
 * <li>Load every image still {@code pending}</li>
 * <li>Analyze the images with at most {@code inspections.analysis.max-concurrent-images} in flight</li>
 * <li>Per image: mark analyzing, download, call the vision model, store each finding as a pending violation, link
 * regulations, mark completed or failed</li>
 * <li>Move the inspection to {@code review}</li>
 * </ol>
 *
 * <p>
 * <b>Failure Handling:</b> a failed image is recorded on the image and never fails the job; the job succeeds even
 * when every image failed. A missing inspection or a disallowed status is permanent. If the job is cancelled, images
 * not yet finished go back to {@code pending} and the job is retried.
 *
 * <p>
 * <b>Metrics Emitted:</b>
 * <ul>
 * <li>inspections_images_analyzed_total (counter, tagged with result=success|error)</li>
 * <li>inspections_violations_detected_total (counter)</li>
 * </ul>
 */
@ApplicationScoped
public class AnalyzeInspectionJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(AnalyzeInspectionJobHandler.class);

    static final String RESULT_SUCCESS = "success";
    static final String RESULT_ERROR = "error";

    @Inject
    ObjectMapper objectMapper;

    @Inject
    InspectionService inspectionService;

    @Inject
    ViolationService violationService;

    @Inject
    StorageGateway storageGateway;

    @Inject
    ImageAnalysisProvider analysisProvider;

    @Inject
    JobMetrics metrics;

    @ConfigProperty(
            name = "inspections.analysis.max-concurrent-images",
            defaultValue = "3")
    int maxConcurrentImages;

    @Override
    public JobType handlesType() {
        return JobType.ANALYZE_INSPECTION;
    }

    @Override
    public void execute(JobContext context, byte[] payload) throws Exception {
        AnalyzeInspectionPayload request = parse(payload);
        UUID inspectionId = request.inspectionId();
        LoggingConfig.setInspectionId(inspectionId);
        LOG.infof("Analyzing inspection %s for user %s", inspectionId, request.userId());

        try {
            inspectionService.startAnalysis(inspectionId, request.userId());
        } catch (ResourceNotFoundException | ValidationException e) {
            throw new PermanentJobException("start analysis: " + e.getMessage(), e);
        }

        List<InspectionImage> images = inspectionService.listPendingImages(inspectionId);
        LOG.infof("Found %d pending image(s)", images.size());

        Tally tally = analyzeAll(images, request, context);

        if (context.isCancelled()) {
            throw new JobCancelledException("Inspection analysis cancelled after " + tally.finished()
                    + " of " + images.size() + " image(s): " + context.cancellationReason());
        }

        inspectionService.completeAnalysis(inspectionId, request.userId());
        LOG.infof("Inspection analysis completed: total=%d, success=%d, failed=%d", images.size(),
                tally.success.get(), tally.failed.get());
    }

    private AnalyzeInspectionPayload parse(byte[] payload) {
        AnalyzeInspectionPayload request;
        try {
            request = objectMapper.readValue(payload, AnalyzeInspectionPayload.class);
        } catch (IOException e) {
            throw new PermanentJobException("invalid payload: " + e.getMessage(), e);
        }
        if (request == null || request.inspectionId() == null || request.userId() == null) {
            throw new PermanentJobException("invalid payload: inspection_id and user_id are required");
        }
        return request;
    }

    /**
     * Drains the image queue with a fixed set of slots and waits for every slot to finish.
     */
    private Tally analyzeAll(List<InspectionImage> images, AnalyzeInspectionPayload request, JobContext context)
            throws InterruptedException {
        Tally tally = new Tally();
        if (images.isEmpty()) {
            return tally;
        }

        Queue<InspectionImage> queue = new ConcurrentLinkedQueue<>(images);
        int slots = Math.max(1, Math.min(maxConcurrentImages, images.size()));
        CountDownLatch done = new CountDownLatch(slots);
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(slots, runnable -> {
            Thread thread = new Thread(runnable, "image-analysis-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            for (int slot = 0; slot < slots; slot++) {
                executor.execute(Context.current().wrap(() -> {
                    LoggingConfig.setJobId(context.getJobId());
                    LoggingConfig.setJobType(context.getJobType());
                    LoggingConfig.setInspectionId(request.inspectionId());
                    try {
                        InspectionImage image;
                        while (!context.isCancelled() && (image = queue.poll()) != null) {
                            processImage(image, request, context, tally);
                        }
                    } finally {
                        LoggingConfig.clearMDC();
                        done.countDown();
                    }
                }));
            }
            done.await();
        } finally {
            executor.shutdown();
        }
        return tally;
    }

    private void processImage(InspectionImage image, AnalyzeInspectionPayload request, JobContext context,
            Tally tally) {
        try {
            inspectionService.updateImageAnalysisStatus(image.id, ImageAnalysisStatus.ANALYZING);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to mark image %s as analyzing", image.id);
            tally.failed.incrementAndGet();
            return;
        }

        try {
            analyzeImage(image, request, context);
        } catch (JobCancelledException e) {
            LOG.warnf("Analysis of image %s cancelled, returning it to pending", image.id);
            markQuietly(image.id, ImageAnalysisStatus.PENDING);
            return;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Image analysis failed for image %s", image.id);
            tally.failed.incrementAndGet();
            metrics.recordImageAnalyzed(RESULT_ERROR);
            markQuietly(image.id, ImageAnalysisStatus.FAILED);
            return;
        }

        markQuietly(image.id, ImageAnalysisStatus.COMPLETED);
        tally.success.incrementAndGet();
        metrics.recordImageAnalyzed(RESULT_SUCCESS);
    }

    private void analyzeImage(InspectionImage image, AnalyzeInspectionPayload request, JobContext context) {
        StoredObject stored = storageGateway.download(StoredObjectType.IMAGE, image.storageKey);
        String contentType = stored.contentTypeOr(image.contentType);
        LOG.debugf("Downloaded image %s (%d bytes, %s)", image.id, stored.data().length, contentType);

        AnalysisResult result = analysisProvider.analyzeImage(new AnalyzeImageRequest(stored.data(), contentType, null,
                image.id, request.inspectionId(), request.userId()), context);

        List<PotentialViolation> findings = result.violations();
        for (int i = 0; i < findings.size(); i++) {
            PotentialViolation finding = findings.get(i);
            UUID violationId;
            try {
                violationId = violationService.createFromFinding(request.inspectionId(), image.id, finding, i + 1);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to store finding %d of image %s", i + 1, image.id);
                continue;
            }
            metrics.recordViolationsDetected(1);

            try {
                violationService.linkRegulations(violationId, finding);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to link regulations to violation %s", violationId);
            }
        }
        LOG.infof("Image %s analyzed: %d finding(s)", image.id, findings.size());
    }

    private void markQuietly(UUID imageId, ImageAnalysisStatus status) {
        try {
            inspectionService.updateImageAnalysisStatus(imageId, status);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to mark image %s as %s", imageId, status.getValue());
        }
    }

    private static final class Tally {
        final AtomicInteger success = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        int finished() {
            return success.get() + failed.get();
        }
    }
}
