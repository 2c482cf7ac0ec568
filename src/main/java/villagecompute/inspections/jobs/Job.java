package villagecompute.inspections.jobs;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a job row.
 *
 * @param id
 *            job identifier, assigned at creation
 * @param jobType
 *            dispatch key (see {@link JobType#getKey()})
 * @param payload
 *            serialized JSON parameters, opaque to the engine
 * @param status
 *            lifecycle status
 * @param priority
 *            higher values are leased first
 * @param attempts
 *            number of leases so far
 * @param maxAttempts
 *            attempt ceiling for transient failures
 * @param scheduledAt
 *            earliest time the job may be leased
 * @param startedAt
 *            time of the most recent lease
 * @param completedAt
 *            time the job reached a terminal status
 * @param errorMessage
 *            message of the most recent failure
 * @param createdAt
 *            row creation time
 */
public record Job(UUID id, String jobType, byte[] payload, JobStatus status, int priority, int attempts,
        int maxAttempts, Instant scheduledAt, Instant startedAt, Instant completedAt, String errorMessage,
        Instant createdAt) {

    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }
}
