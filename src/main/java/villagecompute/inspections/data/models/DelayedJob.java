package villagecompute.inspections.data.models;

import java.nio.charset.StandardCharsets;
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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jboss.logging.Logger;
import villagecompute.inspections.jobs.Job;
import villagecompute.inspections.jobs.JobStatus;

/**
 * Panache entity for the database-backed job queue.
 *
 * <p>
 * Workers lease rows with {@code SELECT ... FOR UPDATE SKIP LOCKED} (see {@link #QUERY_LEASE_NEXT}), so any number of
 * worker loops and processes can share the table without double execution. The partial index {@code idx_jobs_pending}
 * ({@code V001__initial_schema.sql}) serves that query.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Assigned at enqueue time</li>
 * <li>{@code job_type} (TEXT) - Handler dispatch key, e.g. {@code analyze_inspection}</li>
 * <li>{@code payload} (JSONB) - Job parameters, parsed only by the handler</li>
 * <li>{@code status} (TEXT) - PENDING, RUNNING, COMPLETED, FAILED (enum names, as the native queries expect)</li>
 * <li>{@code priority} (INT) - Higher values are leased first</li>
 * <li>{@code attempts} (INT) - Incremented on every lease</li>
 * <li>{@code max_attempts} (INT) - Ceiling for transient failures</li>
 * <li>{@code scheduled_at} (TIMESTAMPTZ) - Earliest lease time (delay and retry backoff)</li>
 * <li>{@code started_at} (TIMESTAMPTZ) - Time of the most recent lease, used for stale detection</li>
 * <li>{@code completed_at} (TIMESTAMPTZ) - Time the job reached a terminal status</li>
 * <li>{@code error_message} (TEXT) - Message from the most recent failure</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ) - Audit timestamps</li>
 * </ul>
 *
 * @see villagecompute.inspections.services.PanacheJobStore
 */
@Entity
@Table(
        name = "jobs")
public class DelayedJob extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(DelayedJob.class);

    /**
     * Native lease query. Rows locked by another transaction are skipped instead of waited on.
     */
    public static final String QUERY_LEASE_NEXT = "SELECT * FROM jobs WHERE status = 'PENDING' AND scheduled_at <= :now "
            + "ORDER BY priority DESC, scheduled_at ASC LIMIT 1 FOR UPDATE SKIP LOCKED";

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "job_type",
            nullable = false,
            length = 50)
    public String jobType;

    @Column(
            name = "payload",
            nullable = false,
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public String payload;

    @Column(
            name = "status",
            nullable = false,
            length = 20)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "error_message",
            columnDefinition = "text")
    public String errorMessage;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Creates and persists a new pending job.
     *
     * @param jobType
     *            dispatch key
     * @param payload
     *            serialized JSON parameters
     * @param priority
     *            lease priority (higher first)
     * @param maxAttempts
     *            attempt ceiling
     * @param scheduledAt
     *            earliest execution time
     * @return persisted DelayedJob entity
     */
    public static DelayedJob create(String jobType, byte[] payload, int priority, int maxAttempts,
            Instant scheduledAt) {
        Instant now = Instant.now();
        DelayedJob job = new DelayedJob();
        job.id = UUID.randomUUID();
        job.jobType = jobType;
        job.payload = new String(payload, StandardCharsets.UTF_8);
        job.status = JobStatus.PENDING;
        job.priority = priority;
        job.attempts = 0;
        job.maxAttempts = maxAttempts;
        job.scheduledAt = scheduledAt;
        job.createdAt = now;
        job.updatedAt = now;

        job.persist();
        LOG.infof("Created job %s (type: %s, priority: %d, scheduled: %s)", job.id, jobType, priority, scheduledAt);
        return job;
    }

    /**
     * Locks the next eligible job row for the current transaction.
     *
     * @param now
     *            eligibility cutoff for {@code scheduled_at}
     * @return the locked row, or an empty list when nothing is eligible
     */
    @SuppressWarnings("unchecked")
    public static List<DelayedJob> lockNextEligible(Instant now) {
        return getEntityManager().createNativeQuery(QUERY_LEASE_NEXT, DelayedJob.class).setParameter("now", now)
                .getResultList();
    }

    /**
     * Resets running jobs started before {@code startedBefore}; attempts are left untouched.
     */
    public static int resetStale(Instant startedBefore, Instant now) {
        return update("status = ?1, updatedAt = ?2 WHERE status = ?3 AND startedAt < ?4", JobStatus.PENDING, now,
                JobStatus.RUNNING, startedBefore);
    }

    public static long countByStatus(JobStatus status) {
        return count("status", status);
    }

    /**
     * Claims this job for execution.
     */
    public void lease(Instant now) {
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
        this.attempts++;
        this.updatedAt = now;
        LOG.debugf("Leased job %s (attempt %d/%d)", this.id, this.attempts, this.maxAttempts);
    }

    /**
     * Completes the job if it is still running on lease {@code attempt}.
     *
     * @return number of rows updated, 0 when the lease was lost
     */
    public static int completeLease(UUID id, int attempt, Instant now) {
        return update("status = ?1, completedAt = ?2, updatedAt = ?2 WHERE id = ?3 AND status = ?4 AND attempts = ?5",
                JobStatus.COMPLETED, now, id, JobStatus.RUNNING, attempt);
    }

    /**
     * Fails the job if it is still running on lease {@code attempt}.
     *
     * @return number of rows updated, 0 when the lease was lost
     */
    public static int failLease(UUID id, int attempt, String errorMessage, Instant now) {
        return update(
                "status = ?1, completedAt = ?2, errorMessage = ?3, updatedAt = ?2 "
                        + "WHERE id = ?4 AND status = ?5 AND attempts = ?6",
                JobStatus.FAILED, now, errorMessage, id, JobStatus.RUNNING, attempt);
    }

    /**
     * Returns the job to PENDING, eligible again at {@code nextRunAt}, if it is still running on lease
     * {@code attempt}.
     *
     * @return number of rows updated, 0 when the lease was lost
     */
    public static int retryLease(UUID id, int attempt, Instant nextRunAt, String errorMessage, Instant now) {
        return update(
                "status = ?1, scheduledAt = ?2, errorMessage = ?3, updatedAt = ?4 "
                        + "WHERE id = ?5 AND status = ?6 AND attempts = ?7",
                JobStatus.PENDING, nextRunAt, errorMessage, now, id, JobStatus.RUNNING, attempt);
    }

    public Job toJob() {
        return new Job(id, jobType, payload.getBytes(StandardCharsets.UTF_8), status, priority, attempts, maxAttempts,
                scheduledAt, startedAt, completedAt, errorMessage, createdAt);
    }
}
