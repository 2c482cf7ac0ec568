package villagecompute.inspections.data.models;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Potential safety violation found on an inspection image, awaiting or past inspector review.
 */
@Entity
@Table(
        name = "violations")
public class Violation extends PanacheEntityBase {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_CONFIRMED = "confirmed";
    public static final String STATUS_REJECTED = "rejected";

    @Id
    public UUID id;

    @Column(
            name = "inspection_id",
            nullable = false)
    public UUID inspectionId;

    @Column(
            name = "image_id")
    public UUID imageId;

    @Column(
            nullable = false,
            columnDefinition = "text")
    public String description;

    @Column(
            name = "ai_description",
            columnDefinition = "text")
    public String aiDescription;

    @Column(
            length = 20)
    public String confidence;

    @Column(
            name = "bounding_box",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public String boundingBox;

    @Column(
            nullable = false,
            length = 20)
    public String status;

    @Column(
            length = 20)
    public String severity;

    @Column(
            name = "inspector_notes",
            columnDefinition = "text")
    public String inspectorNotes;

    @Column(
            name = "sort_order")
    public int sortOrder;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static List<Violation> findConfirmedByInspection(UUID inspectionId) {
        return list("inspectionId = ?1 AND status = ?2 ORDER BY sortOrder, createdAt", inspectionId,
                STATUS_CONFIRMED);
    }
}
