package villagecompute.inspections.testing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import villagecompute.inspections.jobs.Job;
import villagecompute.inspections.jobs.JobStatus;
import villagecompute.inspections.services.JobStore;

/**
 * {@link JobStore} backed by a map, for worker pool tests without a database.
 *
 * <p>
 * Every method is synchronized, which gives {@link #leaseNext(Instant)} the same exclusivity the row lock gives the
 * Panache store. {@link #leaseCount()} counts successful leases so tests can assert no job was leased twice.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<UUID, Job> jobs = new LinkedHashMap<>();
    private final AtomicInteger leases = new AtomicInteger();

    @Override
    public synchronized Job enqueue(String jobType, byte[] payload, int priority, int maxAttempts,
            Instant scheduledAt) {
        Job job = new Job(UUID.randomUUID(), jobType, payload, JobStatus.PENDING, priority, 0, maxAttempts,
                scheduledAt, null, null, null, scheduledAt);
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public synchronized Optional<Job> leaseNext(Instant now) {
        Optional<Job> next = jobs.values().stream()
                .filter(job -> job.status() == JobStatus.PENDING && !job.scheduledAt().isAfter(now))
                .min(Comparator.comparingInt(Job::priority).reversed().thenComparing(Job::scheduledAt));
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Job job = next.get();
        Job leased = new Job(job.id(), job.jobType(), job.payload(), JobStatus.RUNNING, job.priority(),
                job.attempts() + 1, job.maxAttempts(), job.scheduledAt(), now, null, job.errorMessage(),
                job.createdAt());
        jobs.put(leased.id(), leased);
        leases.incrementAndGet();
        return Optional.of(leased);
    }

    @Override
    public synchronized boolean markCompleted(UUID jobId, int attempt, Instant now) {
        Job job = require(jobId);
        if (!holdsLease(job, attempt)) {
            return false;
        }
        jobs.put(jobId, new Job(jobId, job.jobType(), job.payload(), JobStatus.COMPLETED, job.priority(),
                job.attempts(), job.maxAttempts(), job.scheduledAt(), job.startedAt(), now, null, job.createdAt()));
        return true;
    }

    @Override
    public synchronized boolean markFailed(UUID jobId, int attempt, String errorMessage, Instant now) {
        Job job = require(jobId);
        if (!holdsLease(job, attempt)) {
            return false;
        }
        jobs.put(jobId, new Job(jobId, job.jobType(), job.payload(), JobStatus.FAILED, job.priority(),
                job.attempts(), job.maxAttempts(), job.scheduledAt(), job.startedAt(), now, errorMessage,
                job.createdAt()));
        return true;
    }

    @Override
    public synchronized boolean scheduleRetry(UUID jobId, int attempt, Instant nextRunAt, String errorMessage,
            Instant now) {
        Job job = require(jobId);
        if (!holdsLease(job, attempt)) {
            return false;
        }
        jobs.put(jobId, new Job(jobId, job.jobType(), job.payload(), JobStatus.PENDING, job.priority(),
                job.attempts(), job.maxAttempts(), nextRunAt, null, null, errorMessage, job.createdAt()));
        return true;
    }

    @Override
    public synchronized int recoverStale(Instant startedBefore, Instant now) {
        int recovered = 0;
        for (Job job : new ArrayList<>(jobs.values())) {
            if (job.status() == JobStatus.RUNNING && job.startedAt() != null
                    && job.startedAt().isBefore(startedBefore)) {
                jobs.put(job.id(), new Job(job.id(), job.jobType(), job.payload(), JobStatus.PENDING, job.priority(),
                        job.attempts(), job.maxAttempts(), now, null, null, job.errorMessage(), job.createdAt()));
                recovered++;
            }
        }
        return recovered;
    }

    @Override
    public synchronized Optional<Job> findById(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized long countByStatus(JobStatus status) {
        return jobs.values().stream().filter(job -> job.status() == status).count();
    }

    /**
     * Replaces a job row as-is, e.g. to simulate a job orphaned by a crashed worker.
     */
    public synchronized void put(Job job) {
        jobs.put(job.id(), job);
    }

    public synchronized List<Job> all() {
        return new ArrayList<>(jobs.values());
    }

    public int leaseCount() {
        return leases.get();
    }

    private static boolean holdsLease(Job job, int attempt) {
        return job.status() == JobStatus.RUNNING && job.attempts() == attempt;
    }

    private Job require(UUID jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalStateException("Unknown job " + jobId);
        }
        return job;
    }
}
