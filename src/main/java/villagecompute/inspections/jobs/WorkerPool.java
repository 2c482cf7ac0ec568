package villagecompute.inspections.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.jboss.logging.Logger;
import villagecompute.inspections.config.WorkerConfig;
import villagecompute.inspections.exceptions.JobCancelledException;
import villagecompute.inspections.exceptions.PermanentJobException;
import villagecompute.inspections.observability.JobMetrics;
import villagecompute.inspections.observability.LoggingConfig;
import villagecompute.inspections.services.JobStore;

/**
 * Fixed set of independent polling loops that lease, execute and resolve jobs.
 *
 * <p>
 * <b>Per iteration:</b>
 * <ol>
 * <li><b>Lease</b> - {@link JobStore#leaseNext(Instant)} claims at most one eligible job in its own transaction</li>
 * <li><b>Execute</b> - the registered {@link JobHandler} runs outside any transaction with a {@link JobContext} whose
 * deadline is {@code now + jobTimeout}</li>
 * <li><b>Resolve</b> - success completes the job; a {@link PermanentJobException} fails it; any other error requeues it
 * with {@link RetryBackoff} until {@code maxAttempts} is reached, then fails it. An {@link Error} raised by a handler is
 * treated as a transient failure, so neither the job nor the loop is lost.</li>
 * </ol>
 *
 * <p>
 * Resolve writes are conditional on the lease: if stale recovery reclaimed the job while it ran, the outcome is
 * dropped and logged, and the current lease holder decides the job's fate.
 *
 * <p>
 * Each loop then waits one poll interval, or less if {@link #stop()} is called. A failure to record an outcome is
 * logged and leaves the job {@code running}; stale-job recovery returns it to the queue later.
 *
 * <p>
 * <b>Shutdown:</b> {@link #stop()} lets every loop finish its current iteration and waits up to the shutdown timeout.
 * Loops still busy after that are abandoned (their contexts are cancelled, the threads are not interrupted).
 */
public class WorkerPool {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    private final JobStore jobStore;
    private final JobHandlerRegistry registry;
    private final WorkerConfig config;
    private final RetryBackoff backoff;
    private final JobMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean();
    private final Map<Integer, WorkerState> states = new ConcurrentHashMap<>();
    private final Set<JobContext> activeContexts = ConcurrentHashMap.newKeySet();
    private ExecutorService workers;

    public WorkerPool(JobStore jobStore, JobHandlerRegistry registry, WorkerConfig config, JobMetrics metrics,
            Tracer tracer, Clock clock) {
        this(jobStore, registry, config, new RetryBackoff(config.getRetryBaseDelay(), config.getRetryMaxDelay()),
                metrics, tracer, clock);
    }

    WorkerPool(JobStore jobStore, JobHandlerRegistry registry, WorkerConfig config, RetryBackoff backoff,
            JobMetrics metrics, Tracer tracer, Clock clock) {
        this.jobStore = jobStore;
        this.registry = registry;
        this.config = config;
        this.backoff = backoff;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Recovers stale jobs, then launches {@code concurrency} polling loops.
     *
     * @throws IllegalStateException
     *             if the pool was already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker pool already started");
        }

        try {
            recoverStaleJobs();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to recover stale jobs");
        }

        int concurrency = config.getConcurrency();
        workers = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
        for (int i = 1; i <= concurrency; i++) {
            int workerId = i;
            states.put(workerId, WorkerState.IDLE);
            workers.execute(() -> runLoop(workerId));
        }
        workers.shutdown();

        LOG.infof("Worker pool started: concurrency=%d, pollInterval=%s, jobTimeout=%s, handlers=%s", concurrency,
                config.getPollInterval(), config.getJobTimeout(), registry.registeredTypes());
    }

    /**
     * Signals every loop to exit after its current iteration and waits up to the shutdown timeout.
     *
     * @return true if every loop exited in time
     */
    public boolean stop() {
        if (!started.get() || workers == null) {
            return true;
        }
        LOG.info("Stopping worker pool...");
        stopSignal.countDown();

        boolean terminated;
        try {
            terminated = workers.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminated = false;
        }

        if (terminated) {
            LOG.info("Worker pool stopped gracefully");
        } else {
            for (JobContext context : activeContexts) {
                context.cancel("worker pool shutting down");
            }
            LOG.warnf("Worker pool shutdown timeout (%s) exceeded, abandoning %d in-flight job(s)",
                    config.getShutdownTimeout(), activeContexts.size());
        }
        return terminated;
    }

    /**
     * Resets running jobs older than the stale threshold to pending.
     *
     * @return number of jobs recovered
     */
    public int recoverStaleJobs() {
        Instant now = clock.instant();
        int recovered = jobStore.recoverStale(now.minus(config.getStaleJobThreshold()), now);
        if (recovered > 0) {
            metrics.recordRecovered(recovered);
            LOG.warnf("Recovered %d stale job(s) running longer than %s", recovered, config.getStaleJobThreshold());
        }
        return recovered;
    }

    public boolean isStopping() {
        return stopSignal.getCount() == 0;
    }

    public WorkerState state(int workerId) {
        return states.getOrDefault(workerId, WorkerState.STOPPED);
    }

    public Map<Integer, WorkerState> states() {
        return Map.copyOf(states);
    }

    private void runLoop(int workerId) {
        LoggingConfig.setWorkerId(workerId);
        LOG.debugf("Worker %d started", workerId);
        try {
            while (!isStopping()) {
                try {
                    processNextJob(workerId);
                } catch (Throwable e) {
                    LOG.errorf(e, "Worker %d failed to process job", workerId);
                    states.put(workerId, WorkerState.IDLE);
                }
                if (awaitStop(config.getPollInterval())) {
                    break;
                }
            }
        } finally {
            states.put(workerId, WorkerState.STOPPED);
            LOG.debugf("Worker %d stopped", workerId);
            LoggingConfig.clearMDC();
        }
    }

    private boolean awaitStop(Duration wait) {
        try {
            return stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Runs one lease-execute-resolve iteration.
     *
     * @return true if a job was leased
     */
    boolean processNextJob(int workerId) {
        states.put(workerId, WorkerState.LEASING);
        Optional<Job> leased = jobStore.leaseNext(clock.instant());
        if (leased.isEmpty()) {
            states.put(workerId, WorkerState.IDLE);
            return false;
        }
        Job job = leased.get();

        states.put(workerId, WorkerState.EXECUTING);
        long startNanos = System.nanoTime();
        Exception error = execute(job);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        states.put(workerId, WorkerState.RESOLVING);
        resolve(job, error, elapsed);
        states.put(workerId, WorkerState.IDLE);
        return true;
    }

    private Exception execute(Job job) {
        JobContext context = new JobContext(job.id(), job.jobType(), job.attempts(), job.maxAttempts(),
                config.getJobTimeout());
        activeContexts.add(context);

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id().toString())
                .setAttribute("job.type", job.jobType()).setAttribute("job.attempt", job.attempts()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id());
            LoggingConfig.setJobType(job.jobType());
            LoggingConfig.setAttempt(job.attempts());
            LOG.infof("Processing job (attempt %d/%d)", job.attempts(), job.maxAttempts());

            Optional<JobHandler> handler = registry.find(job.jobType());
            if (handler.isEmpty()) {
                throw new PermanentJobException("no handler registered for job type: " + job.jobType());
            }
            handler.get().execute(context, job.payload());

            span.setStatus(StatusCode.OK);
            return null;

        } catch (Throwable t) {
            Exception error = t instanceof Exception ? (Exception) t : new HandlerErrorException(t);
            if (!PermanentJobException.isPermanent(error) && !(error instanceof JobCancelledException)
                    && context.isCancelled()) {
                error = new JobCancelledException("Job cancelled: " + context.cancellationReason(), error);
            }
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, describe(error));
            return error;

        } finally {
            activeContexts.remove(context);
            span.end();
        }
    }

    private void resolve(Job job, Exception error, Duration elapsed) {
        Instant now = clock.instant();
        try {
            if (error == null) {
                if (jobStore.markCompleted(job.id(), job.attempts(), now)) {
                    metrics.recordOutcome(job.jobType(), JobMetrics.OUTCOME_COMPLETED, elapsed);
                    LOG.infof("Job completed in %dms", elapsed.toMillis());
                } else {
                    leaseLost(job, JobMetrics.OUTCOME_COMPLETED, elapsed);
                }

            } else if (PermanentJobException.isPermanent(error)) {
                if (jobStore.markFailed(job.id(), job.attempts(), describe(error), now)) {
                    metrics.recordOutcome(job.jobType(), JobMetrics.OUTCOME_FAILED_PERMANENT, elapsed);
                    LOG.warnf(error, "Job failed with permanent error, will not retry: %s", describe(error));
                } else {
                    leaseLost(job, JobMetrics.OUTCOME_FAILED_PERMANENT, elapsed);
                }

            } else if (job.hasAttemptsRemaining()) {
                Duration delay = backoff.delayFor(job.attempts());
                if (jobStore.scheduleRetry(job.id(), job.attempts(), now.plus(delay), describe(error), now)) {
                    metrics.recordOutcome(job.jobType(), JobMetrics.OUTCOME_RETRIED, elapsed);
                    LOG.warnf(error, "Job failed (attempt %d/%d), retrying in %ds: %s", job.attempts(),
                            job.maxAttempts(), delay.toSeconds(), describe(error));
                } else {
                    leaseLost(job, JobMetrics.OUTCOME_RETRIED, elapsed);
                }

            } else {
                if (jobStore.markFailed(job.id(), job.attempts(), describe(error), now)) {
                    metrics.recordOutcome(job.jobType(), JobMetrics.OUTCOME_FAILED_EXHAUSTED, elapsed);
                    LOG.errorf(error, "Job failed after %d attempts: %s", job.attempts(), describe(error));
                } else {
                    leaseLost(job, JobMetrics.OUTCOME_FAILED_EXHAUSTED, elapsed);
                }
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record outcome for job %s, it stays running until stale recovery", job.id());
        } finally {
            LoggingConfig.clearJobContext();
        }
    }

    private void leaseLost(Job job, String outcome, Duration elapsed) {
        metrics.recordOutcome(job.jobType(), JobMetrics.OUTCOME_LEASE_LOST, elapsed);
        LOG.warnf("Job %s attempt %d was reclaimed by stale recovery while running, dropping its %s outcome",
                job.id(), job.attempts(), outcome);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }

    /**
     * Carries an {@link Error} thrown by a handler through the transient-failure path.
     */
    static final class HandlerErrorException extends RuntimeException {

        HandlerErrorException(Throwable cause) {
            super(cause.getMessage() == null ? cause.getClass().getSimpleName()
                    : cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
