package villagecompute.inspections.services;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.inspections.data.models.ImageAnalysisStatus;
import villagecompute.inspections.data.models.Inspection;
import villagecompute.inspections.data.models.InspectionImage;
import villagecompute.inspections.data.models.InspectionStatus;
import villagecompute.inspections.exceptions.ResourceNotFoundException;
import villagecompute.inspections.exceptions.ValidationException;

/**
 * Inspection and image state changes made by the analysis job.
 *
 * <p>
 * Every method runs in its own transaction so it can be called from the analysis fan-out threads.
 */
@ApplicationScoped
public class InspectionService {

    private static final Logger LOG = Logger.getLogger(InspectionService.class);

    @Transactional
    public Optional<Inspection> findOwned(UUID inspectionId, UUID userId) {
        return Inspection.findOwned(inspectionId, userId);
    }

    /**
     * Moves an inspection into {@code analyzing}. Already analyzing is a no-op so a retried job can resume.
     *
     * @throws ResourceNotFoundException
     *             if the inspection does not exist or belongs to another user
     * @throws ValidationException
     *             if the inspection is completed
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public InspectionStatus startAnalysis(UUID inspectionId, UUID userId) {
        Inspection inspection = load(inspectionId, userId);
        if (inspection.status != InspectionStatus.ANALYZING) {
            inspection.transitionTo(InspectionStatus.ANALYZING);
            LOG.infof("Inspection %s moved to analyzing", inspectionId);
        }
        return inspection.status;
    }

    /**
     * Moves an inspection from {@code analyzing} to {@code review}. Already in review is a no-op.
     *
     * @throws ResourceNotFoundException
     *             if the inspection does not exist or belongs to another user
     * @throws ValidationException
     *             if the inspection is in any other status
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public InspectionStatus completeAnalysis(UUID inspectionId, UUID userId) {
        Inspection inspection = load(inspectionId, userId);
        if (inspection.status != InspectionStatus.REVIEW) {
            inspection.transitionTo(InspectionStatus.REVIEW);
            LOG.infof("Inspection %s moved to review", inspectionId);
        }
        return inspection.status;
    }

    /**
     * Images of the inspection still waiting for analysis, oldest first.
     */
    @Transactional
    public List<InspectionImage> listPendingImages(UUID inspectionId) {
        return InspectionImage.findPendingByInspection(inspectionId);
    }

    /**
     * Sets an image's analysis status; terminal statuses also stamp the completion time.
     *
     * @throws ResourceNotFoundException
     *             if the image does not exist
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void updateImageAnalysisStatus(UUID imageId, ImageAnalysisStatus status) {
        Instant completedAt = status == ImageAnalysisStatus.COMPLETED || status == ImageAnalysisStatus.FAILED
                ? Instant.now()
                : null;
        int updated = InspectionImage.updateAnalysisStatus(imageId, status, completedAt);
        if (updated == 0) {
            throw new ResourceNotFoundException("Image not found: " + imageId);
        }
    }

    private Inspection load(UUID inspectionId, UUID userId) {
        return Inspection.findOwned(inspectionId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Inspection not found: " + inspectionId));
    }
}
