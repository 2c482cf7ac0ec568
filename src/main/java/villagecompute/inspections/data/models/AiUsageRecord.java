package villagecompute.inspections.data.models;

import java.time.Instant;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.jboss.logging.Logger;

/**
 * One row per successful AI provider call, for per-user cost accounting.
 */
@Entity
@Table(
        name = "ai_usage")
public class AiUsageRecord extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(AiUsageRecord.class);

    @Id
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "inspection_id")
    public UUID inspectionId;

    @Column(
            nullable = false,
            length = 50)
    public String model;

    @Column(
            name = "input_tokens",
            nullable = false)
    public int inputTokens;

    @Column(
            name = "output_tokens",
            nullable = false)
    public int outputTokens;

    @Column(
            name = "cost_cents",
            nullable = false)
    public int costCents;

    @Column(
            name = "request_type",
            nullable = false,
            length = 50)
    public String requestType;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Persists a usage row in its own transaction so it survives a failure of the surrounding work.
     */
    public static void record(UUID userId, UUID inspectionId, String model, int inputTokens, int outputTokens,
            int costCents, String requestType) {
        QuarkusTransaction.requiringNew().run(() -> {
            AiUsageRecord usage = new AiUsageRecord();
            usage.id = UUID.randomUUID();
            usage.userId = userId;
            usage.inspectionId = inspectionId;
            usage.model = model;
            usage.inputTokens = inputTokens;
            usage.outputTokens = outputTokens;
            usage.costCents = costCents;
            usage.requestType = requestType;
            usage.createdAt = Instant.now();
            usage.persist();

            LOG.debugf("Recorded AI usage: user=%s, model=%s, inputTokens=%d, outputTokens=%d, costCents=%d", userId,
                    model, inputTokens, outputTokens, costCents);
        });
    }
}
