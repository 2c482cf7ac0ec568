package villagecompute.inspections.jobs;

import java.time.Clock;
import java.util.Optional;

import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.inspections.config.WorkerConfig;
import villagecompute.inspections.observability.JobMetrics;
import villagecompute.inspections.services.JobStore;

/**
 * Quarkus lifecycle bean that starts and stops the {@link WorkerPool}.
 *
 * <p>
 * On startup the worker configuration is validated (invalid values abort startup), queue depth gauges are registered,
 * the {@link JobHandlerRegistry} is built from every {@link JobHandler} bean, and the pool is started, which first
 * recovers stale jobs. Set {@code inspections.worker.enabled=false} to run a node that only enqueues.
 */
@ApplicationScoped
public class WorkerPoolLifecycle {

    private static final Logger LOG = Logger.getLogger(WorkerPoolLifecycle.class);

    @Inject
    JobStore jobStore;

    @Inject
    Instance<JobHandler> handlers;

    @Inject
    WorkerConfig workerConfig;

    @Inject
    JobMetrics metrics;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "inspections.worker.enabled",
            defaultValue = "true")
    boolean enabled;

    private volatile WorkerPool pool;

    void onStart(@Observes StartupEvent event) {
        workerConfig.validate();
        metrics.registerQueueDepthGauges(jobStore);

        if (!enabled) {
            LOG.info("Job worker disabled (inspections.worker.enabled=false), jobs will only be enqueued");
            return;
        }

        JobHandlerRegistry registry = new JobHandlerRegistry(handlers);
        WorkerPool workerPool = new WorkerPool(jobStore, registry, workerConfig, metrics, tracer, Clock.systemUTC());
        workerPool.start();
        pool = workerPool;
    }

    void onStop(@Observes ShutdownEvent event) {
        WorkerPool workerPool = pool;
        if (workerPool != null) {
            workerPool.stop();
        }
    }

    /**
     * Returns the running pool, or empty when the worker is disabled or not started yet.
     */
    public Optional<WorkerPool> pool() {
        return Optional.ofNullable(pool);
    }
}
