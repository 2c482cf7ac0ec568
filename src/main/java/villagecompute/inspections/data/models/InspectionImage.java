package villagecompute.inspections.data.models;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Uploaded inspection photo and its AI analysis state.
 */
@Entity
@Table(
        name = "images")
public class InspectionImage extends PanacheEntityBase {

    @Id
    public UUID id;

    @Column(
            name = "inspection_id",
            nullable = false)
    public UUID inspectionId;

    @Column(
            name = "storage_key",
            nullable = false,
            length = 500)
    public String storageKey;

    @Column(
            name = "thumbnail_key",
            length = 500)
    public String thumbnailKey;

    @Column(
            name = "original_filename")
    public String originalFilename;

    @Column(
            name = "content_type",
            nullable = false)
    public String contentType;

    @Column(
            name = "size_bytes",
            nullable = false)
    public long sizeBytes;

    @Column(
            name = "analysis_status",
            nullable = false,
            length = 20)
    @Enumerated(EnumType.STRING)
    public ImageAnalysisStatus analysisStatus;

    @Column(
            name = "analysis_completed_at")
    public Instant analysisCompletedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static List<InspectionImage> findPendingByInspection(UUID inspectionId) {
        return list("inspectionId = ?1 AND analysisStatus = ?2 ORDER BY createdAt", inspectionId,
                ImageAnalysisStatus.PENDING);
    }

    public static int updateAnalysisStatus(UUID imageId, ImageAnalysisStatus status, Instant completedAt) {
        return update("analysisStatus = ?1, analysisCompletedAt = ?2 WHERE id = ?3", status, completedAt, imageId);
    }
}
