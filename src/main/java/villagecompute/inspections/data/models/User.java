package villagecompute.inspections.data.models;

import java.time.Instant;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Inspector account with the business profile printed on reports.
 */
@Entity
@Table(
        name = "users")
public class User extends PanacheEntityBase {

    @Id
    public UUID id;

    @Column(
            nullable = false,
            unique = true)
    public String email;

    @Column(
            nullable = false)
    public String name;

    @Column(
            name = "business_name")
    public String businessName;

    @Column(
            name = "business_email")
    public String businessEmail;

    @Column(
            name = "business_phone")
    public String businessPhone;

    @Column(
            name = "business_license")
    public String businessLicense;

    @Column(
            name = "business_address")
    public String businessAddress;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Name shown as the report author: the business name when set, otherwise the inspector's own name.
     */
    public String displayName() {
        return businessName != null && !businessName.isBlank() ? businessName : name;
    }
}
