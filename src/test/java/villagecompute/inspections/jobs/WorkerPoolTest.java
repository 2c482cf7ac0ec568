/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.inspections.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.inspections.config.WorkerConfig;
import villagecompute.inspections.exceptions.PermanentJobException;
import villagecompute.inspections.observability.JobMetrics;
import villagecompute.inspections.testing.InMemoryJobStore;

/**
 * Unit tests for {@link WorkerPool} against an in-memory job store.
 */
class WorkerPoolTest {

    private static final String TYPE = JobType.ANALYZE_INSPECTION.getKey();

    private InMemoryJobStore jobStore;
    private SimpleMeterRegistry meterRegistry;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
    }

    private WorkerPool newPool(JobHandler handler, WorkerConfig config) {
        List<JobHandler> handlers = handler == null ? List.of() : List.of(handler);
        return new WorkerPool(jobStore, new JobHandlerRegistry(handlers), config,
                new RetryBackoff(Duration.ZERO, Duration.ZERO, () -> 1.0), new JobMetrics(meterRegistry),
                TracerProvider.noop().get("test"), Clock.systemUTC());
    }

    private static WorkerConfig testConfig() {
        return WorkerConfig.of(2, Duration.ofMillis(20), Duration.ofSeconds(10), Duration.ofSeconds(5),
                Duration.ofMinutes(10));
    }

    private Job enqueue(int maxAttempts) {
        return jobStore.enqueue(TYPE, "{}".getBytes(StandardCharsets.UTF_8), JobPriority.NORMAL.getValue(),
                maxAttempts, Instant.now());
    }

    private Job reload(Job job) {
        return jobStore.findById(job.id()).orElseThrow();
    }

    @Test
    void testSuccessfulJob_isCompleted() {
        pool = newPool(new ScriptedHandler(context -> {
        }), testConfig());
        Job job = enqueue(3);

        assertTrue(pool.processNextJob(1));

        Job done = reload(job);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(1, done.attempts());
        assertNull(done.errorMessage());
        assertEquals(1.0, meterRegistry.get("inspections_jobs_total").tag("outcome", "completed").counter().count());
    }

    @Test
    void testEmptyQueue_returnsFalse() {
        pool = newPool(new ScriptedHandler(context -> {
        }), testConfig());

        assertFalse(pool.processNextJob(1));
        assertEquals(WorkerState.IDLE, pool.state(1));
    }

    @Test
    void testPermanentError_failsOnFirstAttempt() {
        pool = newPool(new ScriptedHandler(context -> {
            throw new PermanentJobException("invalid payload");
        }), testConfig());
        Job job = enqueue(5);

        pool.processNextJob(1);

        Job failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(1, failed.attempts());
        assertEquals("invalid payload", failed.errorMessage());
        assertFalse(pool.processNextJob(1));
    }

    @Test
    void testWrappedPermanentError_failsOnFirstAttempt() {
        pool = newPool(new ScriptedHandler(context -> {
            throw new IllegalStateException("wrapper", new PermanentJobException("inspection not found"));
        }), testConfig());
        Job job = enqueue(5);

        pool.processNextJob(1);

        assertEquals(JobStatus.FAILED, reload(job).status());
        assertEquals(1, reload(job).attempts());
    }

    @Test
    void testTransientError_retriesUntilMaxAttempts() {
        AtomicInteger executions = new AtomicInteger();
        pool = newPool(new ScriptedHandler(context -> {
            executions.incrementAndGet();
            throw new IllegalStateException("upstream unavailable");
        }), testConfig());
        Job job = enqueue(3);

        pool.processNextJob(1);
        assertEquals(JobStatus.PENDING, reload(job).status());
        assertEquals("upstream unavailable", reload(job).errorMessage());

        pool.processNextJob(1);
        assertEquals(JobStatus.PENDING, reload(job).status());

        pool.processNextJob(1);
        Job failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(3, failed.attempts());
        assertEquals(3, executions.get());
        assertFalse(pool.processNextJob(1));
        assertEquals(1.0,
                meterRegistry.get("inspections_jobs_total").tag("outcome", "failed_exhausted").counter().count());
        assertEquals(2.0, meterRegistry.get("inspections_jobs_total").tag("outcome", "retried").counter().count());
    }

    @Test
    void testTransientError_thenSuccess() {
        AtomicInteger executions = new AtomicInteger();
        pool = newPool(new ScriptedHandler(context -> {
            if (executions.incrementAndGet() == 1) {
                throw new IllegalStateException("rate limited");
            }
        }), testConfig());
        Job job = enqueue(3);

        pool.processNextJob(1);
        pool.processNextJob(1);

        assertEquals(JobStatus.COMPLETED, reload(job).status());
        assertEquals(2, reload(job).attempts());
    }

    @Test
    void testRetryIsScheduledWithBackoff() {
        pool = new WorkerPool(jobStore, new JobHandlerRegistry(List.of(new ScriptedHandler(context -> {
            throw new IllegalStateException("boom");
        }))), testConfig(), new RetryBackoff(Duration.ofMinutes(1), Duration.ofHours(1), () -> 1.0),
                new JobMetrics(meterRegistry), TracerProvider.noop().get("test"), Clock.systemUTC());
        Job job = enqueue(3);
        Instant before = Instant.now();

        pool.processNextJob(1);

        Job retried = reload(job);
        assertEquals(JobStatus.PENDING, retried.status());
        assertFalse(retried.scheduledAt().isBefore(before.plus(Duration.ofMinutes(1))));
        assertFalse(pool.processNextJob(1), "retry must not be eligible before its backoff elapses");
    }

    @Test
    void testHandlerError_isRetriedAsTransient() {
        AtomicInteger executions = new AtomicInteger();
        pool = newPool(new ScriptedHandler(context -> {
            if (executions.incrementAndGet() == 1) {
                throw new AssertionError("boom");
            }
        }), testConfig());
        Job job = enqueue(3);

        assertTrue(pool.processNextJob(1));

        Job retried = reload(job);
        assertEquals(JobStatus.PENDING, retried.status());
        assertEquals("AssertionError: boom", retried.errorMessage());
        assertEquals(WorkerState.IDLE, pool.state(1));

        pool.processNextJob(1);
        assertEquals(JobStatus.COMPLETED, reload(job).status());
        assertEquals(2, reload(job).attempts());
    }

    @Test
    void testHandlerError_onLastAttempt_failsJob() {
        pool = newPool(new ScriptedHandler(context -> {
            throw new StackOverflowError();
        }), testConfig());
        Job job = enqueue(1);

        pool.processNextJob(1);

        Job failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertTrue(failed.errorMessage().startsWith("StackOverflowError"));
    }

    @Test
    void testHandlerError_doesNotStopRunningWorker() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch completed = new CountDownLatch(2);
        WorkerConfig config = WorkerConfig.of(1, Duration.ofMillis(20), Duration.ofSeconds(10), Duration.ofSeconds(5),
                Duration.ofMinutes(10));
        pool = newPool(new ScriptedHandler(context -> {
            if (executions.incrementAndGet() == 1) {
                throw new AssertionError("boom");
            }
            completed.countDown();
        }), config);
        Job first = enqueue(3);

        pool.start();
        Job second = enqueue(3);

        assertTrue(completed.await(10, TimeUnit.SECONDS), "the only worker must keep polling after an Error");
        assertTrue(pool.state(1) != WorkerState.STOPPED);
        assertTrue(pool.stop());
        assertEquals(JobStatus.COMPLETED, reload(first).status());
        assertEquals(JobStatus.COMPLETED, reload(second).status());
        assertEquals(3, executions.get());
    }

    @Test
    void testOutcome_isDroppedWhenLeaseWasReclaimed() {
        pool = newPool(new ScriptedHandler(context -> {
            // A sweep resets this job while it runs and another worker leases it again.
            Instant now = Instant.now();
            assertEquals(1, jobStore.recoverStale(now.plusSeconds(1), now));
            assertTrue(jobStore.leaseNext(now).isPresent());
        }), testConfig());
        Job job = enqueue(3);

        pool.processNextJob(1);

        Job current = reload(job);
        assertEquals(JobStatus.RUNNING, current.status(), "first worker must not complete a job it no longer holds");
        assertEquals(2, current.attempts());
        assertEquals(1.0, meterRegistry.get("inspections_jobs_total").tag("outcome", "lease_lost").counter().count());

        assertTrue(jobStore.markFailed(job.id(), 2, "second lease failed", Instant.now()));
        assertFalse(jobStore.markCompleted(job.id(), 2, Instant.now()), "failed is terminal");
        assertEquals(JobStatus.FAILED, reload(job).status());
    }

    @Test
    void testRetry_isDroppedWhenLeaseWasReclaimed() {
        pool = newPool(new ScriptedHandler(context -> {
            Instant now = Instant.now();
            jobStore.recoverStale(now.plusSeconds(1), now);
            jobStore.leaseNext(now);
            throw new IllegalStateException("upstream unavailable");
        }), testConfig());
        Job job = enqueue(3);

        pool.processNextJob(1);

        Job current = reload(job);
        assertEquals(JobStatus.RUNNING, current.status());
        assertEquals(2, current.attempts());
        assertNull(current.errorMessage());
    }

    @Test
    void testUnregisteredType_failsPermanently() {
        pool = newPool(null, testConfig());
        Job job = enqueue(3);

        pool.processNextJob(1);

        Job failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(1, failed.attempts());
        assertTrue(failed.errorMessage().contains("no handler registered"));
    }

    @Test
    void testDeadlineExceeded_isTransient() {
        WorkerConfig config = WorkerConfig.of(1, Duration.ofMillis(20), Duration.ofMillis(100),
                Duration.ofSeconds(5), Duration.ofMinutes(10));
        pool = newPool(new ScriptedHandler(context -> context.sleep(Duration.ofSeconds(30))), config);
        Job job = enqueue(2);

        long start = System.nanoTime();
        pool.processNextJob(1);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMillis < 5_000, "handler should be released at the deadline");
        Job retried = reload(job);
        assertEquals(JobStatus.PENDING, retried.status());
        assertTrue(retried.errorMessage().contains("timeout"));
    }

    @Test
    void testHigherPriorityLeasedFirst() {
        List<UUID> executed = new ArrayList<>();
        pool = newPool(new ScriptedHandler(context -> executed.add(context.getJobId())), testConfig());
        Job low = jobStore.enqueue(TYPE, new byte[0], JobPriority.LOW.getValue(), 3, Instant.now().minusSeconds(5));
        Job high = jobStore.enqueue(TYPE, new byte[0], JobPriority.HIGH.getValue(), 3, Instant.now());

        pool.processNextJob(1);
        pool.processNextJob(1);

        assertEquals(List.of(high.id(), low.id()), executed);
    }

    @Test
    void testConcurrentWorkers_leaseEachJobExactlyOnce() throws Exception {
        Map<UUID, AtomicInteger> executions = new ConcurrentHashMap<>();
        pool = newPool(new ScriptedHandler(
                context -> executions.computeIfAbsent(context.getJobId(), id -> new AtomicInteger()).incrementAndGet()),
                testConfig());
        int jobCount = 200;
        for (int i = 0; i < jobCount; i++) {
            enqueue(3);
        }

        int workers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 1; w <= workers; w++) {
            int workerId = w;
            futures.add(executor.submit(() -> {
                go.await();
                while (pool.processNextJob(workerId)) {
                    // drain
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(jobCount, executions.size());
        assertTrue(executions.values().stream().allMatch(count -> count.get() == 1));
        assertEquals(jobCount, jobStore.leaseCount());
        assertEquals(jobCount, jobStore.countByStatus(JobStatus.COMPLETED));
    }

    @Test
    void testRecoverStaleJobs_preservesAttempts() {
        pool = newPool(new ScriptedHandler(context -> {
        }), testConfig());
        Instant longAgo = Instant.now().minus(Duration.ofHours(1));
        Job orphan = new Job(UUID.randomUUID(), TYPE, new byte[0], JobStatus.RUNNING, 5, 2, 5, longAgo, longAgo, null,
                null, longAgo);
        Instant recently = Instant.now().minusSeconds(10);
        Job busy = new Job(UUID.randomUUID(), TYPE, new byte[0], JobStatus.RUNNING, 5, 1, 5, recently, recently, null,
                null, recently);
        jobStore.put(orphan);
        jobStore.put(busy);

        assertEquals(1, pool.recoverStaleJobs());

        Job recovered = reload(orphan);
        assertEquals(JobStatus.PENDING, recovered.status());
        assertEquals(2, recovered.attempts());
        assertNull(recovered.startedAt());
        assertEquals(JobStatus.RUNNING, reload(busy).status());

        pool.processNextJob(1);
        assertEquals(3, reload(orphan).attempts());
        assertEquals(JobStatus.COMPLETED, reload(orphan).status());
    }

    @Test
    void testStartAndStop_drainsQueue() throws Exception {
        CountDownLatch processed = new CountDownLatch(3);
        pool = newPool(new ScriptedHandler(context -> processed.countDown()), testConfig());
        enqueue(3);
        enqueue(3);
        enqueue(3);

        pool.start();

        assertTrue(processed.await(10, TimeUnit.SECONDS));
        assertEquals(2, pool.states().size());
        assertTrue(pool.stop());
        assertTrue(pool.isStopping());
        assertEquals(WorkerState.STOPPED, pool.state(1));
        assertEquals(WorkerState.STOPPED, pool.state(2));
        assertEquals(3, jobStore.countByStatus(JobStatus.COMPLETED));
    }

    @Test
    void testStartTwice_throws() {
        pool = newPool(new ScriptedHandler(context -> {
        }), testConfig());
        pool.start();

        assertThrows(IllegalStateException.class, () -> pool.start());
    }

    @Test
    void testStop_withoutStart_returnsTrue() {
        pool = newPool(null, testConfig());

        assertTrue(pool.stop());
        assertEquals(WorkerState.STOPPED, pool.state(1));
    }

    @Test
    void testStop_timesOutAndCancelsBusyHandler() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        WorkerConfig config = WorkerConfig.of(1, Duration.ofMillis(20), Duration.ofMinutes(5), Duration.ofMillis(200),
                Duration.ofMinutes(10));
        pool = newPool(new ScriptedHandler(context -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
        }), config);
        enqueue(3);

        pool.start();
        assertTrue(entered.await(10, TimeUnit.SECONDS));

        assertFalse(pool.stop());
        release.countDown();
    }

    @FunctionalInterface
    interface JobBody {
        void run(JobContext context) throws Exception;
    }

    static final class ScriptedHandler implements JobHandler {

        private final JobBody body;

        ScriptedHandler(JobBody body) {
            this.body = body;
        }

        @Override
        public JobType handlesType() {
            return JobType.ANALYZE_INSPECTION;
        }

        @Override
        public void execute(JobContext context, byte[] payload) throws Exception {
            body.run(context);
        }
    }
}
