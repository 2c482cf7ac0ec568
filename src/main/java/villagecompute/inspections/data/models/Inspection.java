package villagecompute.inspections.data.models;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.jboss.logging.Logger;
import villagecompute.inspections.exceptions.ValidationException;

/**
 * Construction site inspection owned by one inspector.
 *
 * <p>
 * Status changes go through {@link #transitionTo(InspectionStatus)}, which enforces {@link InspectionStatus}'s
 * transition rules.
 */
@Entity
@Table(
        name = "inspections")
public class Inspection extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(Inspection.class);

    @Id
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "client_id")
    public UUID clientId;

    @Column(
            nullable = false)
    public String title;

    @Column(
            nullable = false,
            length = 20)
    @Enumerated(EnumType.STRING)
    public InspectionStatus status;

    @Column(
            name = "inspection_date",
            nullable = false)
    public LocalDate inspectionDate;

    @Column(
            name = "address_line1")
    public String addressLine1;

    @Column(
            name = "address_line2")
    public String addressLine2;

    public String city;

    public String state;

    @Column(
            name = "postal_code")
    public String postalCode;

    @Column(
            name = "weather_conditions")
    public String weatherConditions;

    public String temperature;

    @Column(
            name = "inspector_notes",
            columnDefinition = "text")
    public String inspectorNotes;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds an inspection only if it belongs to {@code userId}.
     */
    public static Optional<Inspection> findOwned(UUID inspectionId, UUID userId) {
        return find("id = ?1 AND userId = ?2", inspectionId, userId).firstResultOptional();
    }

    /**
     * @throws ValidationException
     *             if the transition is not allowed from the current status
     */
    public void transitionTo(InspectionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new ValidationException(
                    "cannot transition inspection from " + status.getValue() + " to " + target.getValue());
        }
        LOG.debugf("Inspection %s: %s -> %s", id, status.getValue(), target.getValue());
        this.status = target;
        this.updatedAt = Instant.now();
    }

    public String fullAddress() {
        StringJoiner joiner = new StringJoiner(", ");
        for (String part : new String[]{addressLine1, addressLine2, city}) {
            if (part != null && !part.isBlank()) {
                joiner.add(part);
            }
        }
        String region = ((state != null ? state : "") + " " + (postalCode != null ? postalCode : "")).trim();
        if (!region.isEmpty()) {
            joiner.add(region);
        }
        return joiner.toString();
    }
}
