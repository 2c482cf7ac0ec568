package villagecompute.inspections.services;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import villagecompute.inspections.jobs.Job;
import villagecompute.inspections.jobs.JobStatus;

/**
 * Persistence boundary for the job queue.
 *
 * <p>
 * Every method is a short, single-purpose transaction. {@link #leaseNext(Instant)} is the only way a job moves from
 * {@code pending} to {@code running}, and implementations must guarantee that concurrent callers never lease the same
 * row.
 *
 * @see PanacheJobStore
 */
public interface JobStore {

    /**
     * Persists a new {@code pending} job with zero attempts.
     */
    Job enqueue(String jobType, byte[] payload, int priority, int maxAttempts, Instant scheduledAt);

    /**
     * Atomically claims the eligible pending job with the highest priority and earliest {@code scheduledAt}, marking it
     * {@code running}, stamping {@code startedAt} and incrementing {@code attempts}.
     *
     * @param now
     *            eligibility cutoff for {@code scheduledAt} and the lease timestamp
     * @return the leased job as it is after the lease, or empty when nothing is eligible
     */
    Optional<Job> leaseNext(Instant now);

    /**
     * Marks the lease {@code attempt} of a job {@code completed}.
     *
     * <p>
     * This and the other resolve methods only write while the row is still {@code running} on the same attempt. A job
     * reclaimed by stale recovery (and possibly leased again) is left untouched.
     *
     * @return false if the lease was no longer held and nothing was written
     */
    boolean markCompleted(UUID jobId, int attempt, Instant now);

    boolean markFailed(UUID jobId, int attempt, String errorMessage, Instant now);

    /**
     * Returns a running job to {@code pending}, eligible again at {@code nextRunAt}.
     */
    boolean scheduleRetry(UUID jobId, int attempt, Instant nextRunAt, String errorMessage, Instant now);

    /**
     * Resets every {@code running} job started before {@code startedBefore} to {@code pending}, preserving attempts.
     *
     * @return number of jobs reset
     */
    int recoverStale(Instant startedBefore, Instant now);

    Optional<Job> findById(UUID jobId);

    long countByStatus(JobStatus status);
}
