package villagecompute.inspections.jobs;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Optional periodic stale-job sweep on top of the one the pool runs at startup.
 *
 * <p>
 * Disabled by default; enable with {@code inspections.worker.stale-recovery-interval=15m}. Keep the interval and the
 * stale threshold well above the job timeout, since a job that is still executing looks exactly like an orphaned one.
 */
@ApplicationScoped
public class StaleJobRecoveryScheduler {

    private static final Logger LOG = Logger.getLogger(StaleJobRecoveryScheduler.class);

    @Inject
    WorkerPoolLifecycle lifecycle;

    @Scheduled(
            identity = "stale-job-recovery",
            every = "${inspections.worker.stale-recovery-interval:off}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void recoverStaleJobs() {
        lifecycle.pool().ifPresent(pool -> {
            try {
                pool.recoverStaleJobs();
            } catch (RuntimeException e) {
                LOG.errorf(e, "Periodic stale job recovery failed");
            }
        });
    }
}
