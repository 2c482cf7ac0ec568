package villagecompute.inspections.data.models;

import java.time.Instant;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Customer an inspection is performed for.
 */
@Entity
@Table(
        name = "clients")
public class Client extends PanacheEntityBase {

    @Id
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false)
    public String name;

    public String email;

    public String phone;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;
}
