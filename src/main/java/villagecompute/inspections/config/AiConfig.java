/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.config;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Configuration for the Anthropic vision model used by image analysis.
 *
 * <p>
 * This class performs startup validation to ensure the Anthropic API key is configured. If it is missing the
 * application fails to start with a descriptive error message.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code inspections.ai.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code inspections.ai.base-url} - API base URL (default: https://api.anthropic.com)</li>
 * <li>{@code inspections.ai.model} - Vision model name (default: claude-3-5-sonnet-20241022)</li>
 * <li>{@code inspections.ai.max-tokens} - Max output tokens (default: 4096)</li>
 * <li>{@code inspections.ai.max-retries} - Attempts per image, including the first (default: 3)</li>
 * <li>{@code inspections.ai.retry-base-delay} - First retry wait, doubled per attempt (default: 1s)</li>
 * <li>{@code inspections.ai.request-timeout} - HTTP timeout for one request (default: 60s)</li>
 * </ul>
 *
 * @see villagecompute.inspections.integration.ai.AnthropicVisionClient
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "inspections.ai.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "inspections.ai.base-url",
            defaultValue = "https://api.anthropic.com")
    String baseUrl;

    @ConfigProperty(
            name = "inspections.ai.model",
            defaultValue = "claude-3-5-sonnet-20241022")
    String model;

    @ConfigProperty(
            name = "inspections.ai.max-tokens",
            defaultValue = "4096")
    int maxTokens;

    @ConfigProperty(
            name = "inspections.ai.max-retries",
            defaultValue = "3")
    int maxRetries;

    @ConfigProperty(
            name = "inspections.ai.retry-base-delay",
            defaultValue = "1s")
    Duration retryBaseDelay;

    @ConfigProperty(
            name = "inspections.ai.request-timeout",
            defaultValue = "60s")
    Duration requestTimeout;

    /**
     * Builds a configuration outside CDI.
     */
    public static AiConfig of(String apiKey, String baseUrl, String model, int maxTokens, int maxRetries,
            Duration retryBaseDelay, Duration requestTimeout) {
        AiConfig config = new AiConfig();
        config.apiKey = Optional.ofNullable(apiKey);
        config.baseUrl = baseUrl;
        config.model = model;
        config.maxTokens = maxTokens;
        config.maxRetries = maxRetries;
        config.retryBaseDelay = retryBaseDelay;
        config.requestTimeout = requestTimeout;
        return config;
    }

    /**
     * Performs startup validation of the AI settings.
     *
     * @throws AiConfigurationException
     *             if the API key is not configured or a numeric setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.isEmpty() || apiKey.get().trim().isEmpty()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "Image analysis requires a valid Anthropic API key to function. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        if (maxRetries < 1) {
            throw new AiConfigurationException("inspections.ai.max-retries must be at least 1, got " + maxRetries);
        }
        if (maxTokens < 1) {
            throw new AiConfigurationException("inspections.ai.max-tokens must be at least 1, got " + maxTokens);
        }
        LOG.infof("Anthropic vision configured: model=%s, maxTokens=%d, maxRetries=%d, timeout=%s", model, maxTokens,
                maxRetries, requestTimeout);
    }

    public String getApiKey() {
        return apiKey.orElse("");
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }

        public AiConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
