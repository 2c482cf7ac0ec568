package villagecompute.inspections.data.models;

import java.time.Instant;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Generated inspection report; one of the two storage keys is set depending on the format.
 */
@Entity
@Table(
        name = "reports")
public class Report extends PanacheEntityBase {

    @Id
    public UUID id;

    @Column(
            name = "inspection_id",
            nullable = false)
    public UUID inspectionId;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "pdf_storage_key",
            length = 500)
    public String pdfStorageKey;

    @Column(
            name = "docx_storage_key",
            length = 500)
    public String docxStorageKey;

    @Column(
            name = "violation_count",
            nullable = false)
    public int violationCount;

    @Column(
            name = "generated_at",
            nullable = false)
    public Instant generatedAt;
}
