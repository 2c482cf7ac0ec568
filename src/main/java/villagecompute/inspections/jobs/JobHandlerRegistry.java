package villagecompute.inspections.jobs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

/**
 * Immutable mapping from job type key to handler.
 *
 * <p>
 * Built once from the discovered {@link JobHandler} beans before the worker pool starts. A later handler for an already
 * registered type replaces the earlier one and a warning is logged.
 */
public final class JobHandlerRegistry {

    private static final Logger LOG = Logger.getLogger(JobHandlerRegistry.class);

    private final Map<String, JobHandler> handlers;

    public JobHandlerRegistry(Iterable<? extends JobHandler> handlers) {
        Map<String, JobHandler> registry = new LinkedHashMap<>();
        for (JobHandler handler : handlers) {
            String key = handler.handlesType().getKey();
            JobHandler previous = registry.put(key, handler);
            if (previous != null) {
                LOG.warnf("Overwriting handler for job type %s: %s replaced by %s", key,
                        previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
            } else {
                LOG.debugf("Registered handler %s for job type %s", handler.getClass().getSimpleName(), key);
            }
        }
        this.handlers = Collections.unmodifiableMap(registry);
    }

    public Optional<JobHandler> find(String jobType) {
        return Optional.ofNullable(handlers.get(jobType));
    }

    public Set<String> registeredTypes() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }
}
