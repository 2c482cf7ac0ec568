package villagecompute.inspections.jobs;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import villagecompute.inspections.exceptions.JobCancelledException;

/**
 * Execution context handed to a {@link JobHandler} for one attempt of one job.
 *
 * <p>
 * Carries the job identity and a deadline derived from the worker's job timeout. A context becomes cancelled when the
 * deadline passes or when {@link #cancel(String)} is called (worker pool shutdown). Cancellation is cooperative:
 * handlers check {@link #isCancelled()} between units of work and wait through {@link #sleep(Duration)}, which returns
 * early with a {@link JobCancelledException} once the context is cancelled.
 *
 * <p>
 * Contexts are safe to share with the threads a handler fans out to.
 */
public class JobContext {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final UUID jobId;
    private final String jobType;
    private final int attempt;
    private final int maxAttempts;
    private final long deadlineNanos;
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private volatile String cancelReason;

    /**
     * Creates a context for a leased job.
     *
     * @param jobId
     *            leased job id
     * @param jobType
     *            dispatch key
     * @param attempt
     *            1-based attempt number
     * @param maxAttempts
     *            attempt ceiling
     * @param timeout
     *            time budget from now, or {@code null} for no deadline
     */
    public JobContext(UUID jobId, String jobType, int attempt, int maxAttempts, Duration timeout) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.deadlineNanos = timeout == null ? NO_DEADLINE : System.nanoTime() + timeout.toNanos();
    }

    /**
     * Context without a job row or deadline, for calls made outside the worker pool.
     */
    public static JobContext detached() {
        return new JobContext(null, null, 1, 1, null);
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getJobType() {
        return jobType;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Cancels this context. The first reason wins.
     */
    public void cancel(String reason) {
        if (cancelReason == null) {
            cancelReason = reason;
        }
        cancelSignal.countDown();
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0 || isDeadlineExceeded();
    }

    public boolean isDeadlineExceeded() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Time left before the deadline, or {@code null} when the context has none.
     */
    public Duration remaining() {
        if (deadlineNanos == NO_DEADLINE) {
            return null;
        }
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    public String cancellationReason() {
        if (cancelReason != null) {
            return cancelReason;
        }
        return isDeadlineExceeded() ? "job timeout exceeded" : null;
    }

    /**
     * @throws JobCancelledException
     *             if the context is cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new JobCancelledException("Job cancelled: " + cancellationReason());
        }
    }

    /**
     * Waits for {@code duration} unless the context is cancelled first.
     *
     * @param duration
     *            how long to wait
     * @throws JobCancelledException
     *             if the context is or becomes cancelled before the wait ends
     */
    public void sleep(Duration duration) {
        throwIfCancelled();
        long requested = Math.max(0L, duration.toNanos());
        long wait = requested;
        if (deadlineNanos != NO_DEADLINE) {
            wait = Math.min(requested, Math.max(0L, deadlineNanos - System.nanoTime()));
        }
        try {
            if (cancelSignal.await(wait, TimeUnit.NANOSECONDS)) {
                throw new JobCancelledException("Job cancelled: " + cancellationReason());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Job interrupted while waiting", e);
        }
        if (wait < requested) {
            throwIfCancelled();
        }
    }
}
