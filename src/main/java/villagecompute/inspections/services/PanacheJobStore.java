package villagecompute.inspections.services;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.inspections.data.models.DelayedJob;
import villagecompute.inspections.jobs.Job;
import villagecompute.inspections.jobs.JobStatus;

/**
 * PostgreSQL-backed {@link JobStore} built on the {@link DelayedJob} entity.
 *
 * <p>
 * {@link #enqueue} joins the caller's transaction when there is one, so a job can be enqueued atomically with the
 * domain change that triggers it. Every other method runs in its own short transaction.
 */
@ApplicationScoped
public class PanacheJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobStore.class);

    @Override
    @Transactional
    public Job enqueue(String jobType, byte[] payload, int priority, int maxAttempts, Instant scheduledAt) {
        return DelayedJob.create(jobType, payload, priority, maxAttempts, scheduledAt).toJob();
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<Job> leaseNext(Instant now) {
        List<DelayedJob> rows = DelayedJob.lockNextEligible(now);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        DelayedJob job = rows.get(0);
        job.lease(now);
        return Optional.of(job.toJob());
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean markCompleted(UUID jobId, int attempt, Instant now) {
        return applied("complete", jobId, attempt, DelayedJob.completeLease(jobId, attempt, now));
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean markFailed(UUID jobId, int attempt, String errorMessage, Instant now) {
        return applied("fail", jobId, attempt, DelayedJob.failLease(jobId, attempt, errorMessage, now));
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean scheduleRetry(UUID jobId, int attempt, Instant nextRunAt, String errorMessage, Instant now) {
        return applied("retry", jobId, attempt,
                DelayedJob.retryLease(jobId, attempt, nextRunAt, errorMessage, now));
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public int recoverStale(Instant startedBefore, Instant now) {
        int recovered = DelayedJob.resetStale(startedBefore, now);
        LOG.debugf("Stale job sweep reset %d row(s) started before %s", recovered, startedBefore);
        return recovered;
    }

    @Override
    @Transactional
    public Optional<Job> findById(UUID jobId) {
        return DelayedJob.<DelayedJob> findByIdOptional(jobId).map(DelayedJob::toJob);
    }

    @Override
    @Transactional
    public long countByStatus(JobStatus status) {
        return DelayedJob.countByStatus(status);
    }

    private static boolean applied(String operation, UUID jobId, int attempt, int updated) {
        if (updated == 0) {
            LOG.debugf("Skipped %s of job %s: attempt %d no longer holds the lease", operation, jobId, attempt);
        }
        return updated > 0;
    }
}
