package villagecompute.inspections.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Link between a violation and a supporting regulation.
 */
@Entity
@Table(
        name = "violation_regulations",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"violation_id", "regulation_id"}))
public class ViolationRegulation extends PanacheEntityBase {

    @Id
    public UUID id;

    @Column(
            name = "violation_id",
            nullable = false)
    public UUID violationId;

    @Column(
            name = "regulation_id",
            nullable = false)
    public UUID regulationId;

    @Column(
            name = "relevance_score",
            precision = 7,
            scale = 6)
    public BigDecimal relevanceScore;

    @Column(
            name = "ai_explanation",
            columnDefinition = "text")
    public String aiExplanation;

    @Column(
            name = "is_primary",
            nullable = false)
    public boolean isPrimary;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static boolean exists(UUID violationId, UUID regulationId) {
        return count("violationId = ?1 AND regulationId = ?2", violationId, regulationId) > 0;
    }

    public static List<ViolationRegulation> findByViolation(UUID violationId) {
        return list("violationId = ?1 ORDER BY isPrimary DESC, relevanceScore DESC", violationId);
    }
}
