/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.config;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Worker pool settings.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code inspections.worker.concurrency} - Number of polling loops, 1..100 (default: 2)</li>
 * <li>{@code inspections.worker.poll-interval} - Wait between lease attempts, at least 1s (default: 5s)</li>
 * <li>{@code inspections.worker.job-timeout} - Deadline for one handler execution, at least 1s (default: 5m)</li>
 * <li>{@code inspections.worker.shutdown-timeout} - How long stop() waits for busy loops, at least 1s (default:
 * 30s)</li>
 * <li>{@code inspections.worker.stale-job-threshold} - Age after which a running job counts as orphaned, at least 1m
 * (default: 10m); must exceed the job timeout so a job still inside its deadline is never reclaimed</li>
 * <li>{@code inspections.worker.retry-base-delay} - First retry delay (default: 30s)</li>
 * <li>{@code inspections.worker.retry-max-delay} - Retry delay ceiling (default: 1h)</li>
 * </ul>
 *
 * <p>
 * {@link #validate()} is called by the pool lifecycle before anything starts; invalid values fail startup.
 */
@ApplicationScoped
public class WorkerConfig {

    private static final Logger LOG = Logger.getLogger(WorkerConfig.class);

    public static final int MAX_CONCURRENCY = 100;

    @ConfigProperty(
            name = "inspections.worker.concurrency",
            defaultValue = "2")
    int concurrency;

    @ConfigProperty(
            name = "inspections.worker.poll-interval",
            defaultValue = "5s")
    Duration pollInterval;

    @ConfigProperty(
            name = "inspections.worker.job-timeout",
            defaultValue = "5m")
    Duration jobTimeout;

    @ConfigProperty(
            name = "inspections.worker.shutdown-timeout",
            defaultValue = "30s")
    Duration shutdownTimeout;

    @ConfigProperty(
            name = "inspections.worker.stale-job-threshold",
            defaultValue = "10m")
    Duration staleJobThreshold;

    @ConfigProperty(
            name = "inspections.worker.retry-base-delay",
            defaultValue = "30s")
    Duration retryBaseDelay;

    @ConfigProperty(
            name = "inspections.worker.retry-max-delay",
            defaultValue = "1h")
    Duration retryMaxDelay;

    /**
     * Builds a configuration outside CDI, with the default retry delays.
     */
    public static WorkerConfig of(int concurrency, Duration pollInterval, Duration jobTimeout,
            Duration shutdownTimeout, Duration staleJobThreshold) {
        WorkerConfig config = new WorkerConfig();
        config.concurrency = concurrency;
        config.pollInterval = pollInterval;
        config.jobTimeout = jobTimeout;
        config.shutdownTimeout = shutdownTimeout;
        config.staleJobThreshold = staleJobThreshold;
        config.retryBaseDelay = Duration.ofSeconds(30);
        config.retryMaxDelay = Duration.ofHours(1);
        return config;
    }

    /**
     * Configuration with the documented defaults.
     */
    public static WorkerConfig defaults() {
        return of(2, Duration.ofSeconds(5), Duration.ofMinutes(5), Duration.ofSeconds(30), Duration.ofMinutes(10));
    }

    /**
     * Returns a copy with different retry delays.
     */
    public WorkerConfig withRetryDelays(Duration baseDelay, Duration maxDelay) {
        WorkerConfig copy = of(concurrency, pollInterval, jobTimeout, shutdownTimeout, staleJobThreshold);
        copy.retryBaseDelay = baseDelay;
        copy.retryMaxDelay = maxDelay;
        return copy;
    }

    /**
     * Checks every setting against its allowed range.
     *
     * @throws WorkerConfigurationException
     *             naming the first invalid setting
     */
    public void validate() {
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
            throw new WorkerConfigurationException(
                    "inspections.worker.concurrency must be between 1 and " + MAX_CONCURRENCY + ", got " + concurrency);
        }
        requireAtLeast("inspections.worker.poll-interval", pollInterval, Duration.ofSeconds(1));
        requireAtLeast("inspections.worker.job-timeout", jobTimeout, Duration.ofSeconds(1));
        requireAtLeast("inspections.worker.shutdown-timeout", shutdownTimeout, Duration.ofSeconds(1));
        requireAtLeast("inspections.worker.stale-job-threshold", staleJobThreshold, Duration.ofMinutes(1));
        if (staleJobThreshold.compareTo(jobTimeout) <= 0) {
            throw new WorkerConfigurationException("inspections.worker.stale-job-threshold (" + staleJobThreshold
                    + ") must be longer than inspections.worker.job-timeout (" + jobTimeout + ")");
        }
        requireAtLeast("inspections.worker.retry-base-delay", retryBaseDelay, Duration.ofSeconds(1));
        if (retryMaxDelay == null || retryMaxDelay.compareTo(retryBaseDelay) < 0) {
            throw new WorkerConfigurationException(
                    "inspections.worker.retry-max-delay must not be shorter than retry-base-delay");
        }
        LOG.debugf("Worker configuration valid: concurrency=%d, pollInterval=%s, jobTimeout=%s", concurrency,
                pollInterval, jobTimeout);
    }

    private static void requireAtLeast(String name, Duration value, Duration minimum) {
        if (value == null || value.compareTo(minimum) < 0) {
            throw new WorkerConfigurationException(name + " must be at least " + minimum + ", got " + value);
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration getStaleJobThreshold() {
        return staleJobThreshold;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    /**
     * Exception thrown when worker configuration is invalid.
     */
    public static class WorkerConfigurationException extends RuntimeException {

        public WorkerConfigurationException(String message) {
            super(message);
        }
    }
}
