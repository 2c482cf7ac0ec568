/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.integration.ai;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Set;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import villagecompute.inspections.config.AiConfig;
import villagecompute.inspections.exceptions.JobCancelledException;
import villagecompute.inspections.jobs.JobContext;
import villagecompute.inspections.services.AiUsageTrackingService;

/**
 * HTTP client for the Anthropic Messages API, used to analyze inspection photos.
 *
 * <p>
 * <b>Retry policy:</b> up to {@code inspections.ai.max-retries} attempts per image. Only rate limits, timeouts and
 * upstream unavailability are retried, waiting {@code retry-base-delay * 2^(attempt-1)} through
 * {@link JobContext#sleep(Duration)} so a cancelled job stops waiting. The request body is rebuilt for every attempt.
 *
 * <p>
 * <b>Status mapping:</b>
 * <ul>
 * <li>401 - unauthorized</li>
 * <li>408 - timeout</li>
 * <li>429 - rate limited</li>
 * <li>400 {@code invalid_request_error} - invalid image (content policy if the message says so)</li>
 * <li>502, 503, 504, 529 - unavailable</li>
 * <li>anything else - invalid request</li>
 * </ul>
 *
 * <p>
 * Usage of each successful call is tracked best-effort: a tracking failure is logged and the result still returned.
 */
@ApplicationScoped
public class AnthropicVisionClient implements ImageAnalysisProvider {

    private static final Logger LOG = Logger.getLogger(AnthropicVisionClient.class);

    static final String API_VERSION = "2023-06-01";
    static final String MESSAGES_PATH = "/v1/messages";
    static final int MAX_IMAGE_SIZE = 20 * 1024 * 1024;
    static final Set<String> SUPPORTED_CONTENT_TYPES = Set.of("image/jpeg", "image/png", "image/gif", "image/webp");

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    @Inject
    AiConfig aiConfig;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    AiUsageTrackingService usageTracking;

    @Inject
    Tracer tracer;

    private final HttpClient httpClient;

    public AnthropicVisionClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
    }

    @Override
    public AnalysisResult analyzeImage(AnalyzeImageRequest request, JobContext context) {
        validateImage(request);

        Span span = tracer.spanBuilder("ai.analyze_image").setAttribute("ai.model", aiConfig.getModel())
                .setAttribute("image.id", String.valueOf(request.imageId()))
                .setAttribute("image.size_bytes", request.imageData().length).startSpan();
        long startNanos = System.nanoTime();

        try (Scope scope = span.makeCurrent()) {
            JsonNode response = sendWithRetry(request, context);
            AnalysisResult parsed = parseAnalysis(response);

            JsonNode usageNode = response.path("usage");
            int inputTokens = usageNode.path("input_tokens").asInt(0);
            int outputTokens = usageNode.path("output_tokens").asInt(0);
            UsageInfo usage = new UsageInfo(aiConfig.getModel(), inputTokens, outputTokens,
                    AiUsageTrackingService.estimateCostCents(inputTokens, outputTokens),
                    Duration.ofNanos(System.nanoTime() - startNanos));
            AnalysisResult result = parsed.withUsage(usage);

            span.setAttribute("ai.input_tokens", inputTokens);
            span.setAttribute("ai.output_tokens", outputTokens);
            span.setAttribute("ai.violations", result.violations().size());
            span.setStatus(StatusCode.OK);

            trackUsage(request, usage);

            LOG.infof("Analyzed image %s: %d potential violation(s), %d input tokens, %d output tokens",
                    request.imageId(), result.violations().size(), inputTokens, outputTokens);
            return result;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private void validateImage(AnalyzeImageRequest request) {
        byte[] data = request.imageData();
        if (data == null || data.length == 0) {
            throw new AiProviderException(AiErrorKind.INVALID_IMAGE, "image data is empty");
        }
        if (data.length > MAX_IMAGE_SIZE) {
            throw new AiProviderException(AiErrorKind.INVALID_IMAGE,
                    "image exceeds maximum size of " + MAX_IMAGE_SIZE + " bytes");
        }
        String contentType = request.contentType();
        if (contentType == null || contentType.isBlank()) {
            throw new AiProviderException(AiErrorKind.INVALID_IMAGE, "content type is required");
        }
        if (!SUPPORTED_CONTENT_TYPES.contains(contentType)) {
            throw new AiProviderException(AiErrorKind.INVALID_IMAGE, "unsupported content type: " + contentType);
        }
    }

    private JsonNode sendWithRetry(AnalyzeImageRequest request, JobContext context) {
        int maxAttempts = Math.max(1, aiConfig.getMaxRetries());
        AiProviderException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            context.throwIfCancelled();
            try {
                return send(buildRequestBody(request), context);
            } catch (AiProviderException e) {
                lastError = e;
                if (!e.isRetryable() || attempt == maxAttempts) {
                    throw e;
                }
                Duration delay = aiConfig.getRetryBaseDelay().multipliedBy(1L << (attempt - 1));
                LOG.warnf("AI request for image %s failed (attempt %d/%d), retrying in %dms: %s", request.imageId(),
                        attempt, maxAttempts, delay.toMillis(), e.getMessage());
                context.sleep(delay);
            }
        }
        throw lastError;
    }

    String buildRequestBody(AnalyzeImageRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", aiConfig.getModel());
        body.put("max_tokens", aiConfig.getMaxTokens());

        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");

        ObjectNode image = content.addObject();
        image.put("type", "image");
        ObjectNode source = image.putObject("source");
        source.put("type", "base64");
        source.put("media_type", request.contentType());
        source.put("data", Base64.getEncoder().encodeToString(request.imageData()));

        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", AnalysisPrompts.imageAnalysis(request.context()));

        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AiProviderException(AiErrorKind.INVALID_REQUEST, "failed to serialize request", e);
        }
    }

    private JsonNode send(String body, JobContext context) {
        Duration timeout = aiConfig.getRequestTimeout();
        Duration remaining = context.remaining();
        if (remaining != null && remaining.compareTo(timeout) < 0) {
            timeout = remaining.isZero() ? Duration.ofMillis(1) : remaining;
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(aiConfig.getBaseUrl()) + MESSAGES_PATH)).timeout(timeout)
                .header("Content-Type", "application/json").header("x-api-key", aiConfig.getApiKey())
                .header("anthropic-version", API_VERSION).POST(HttpRequest.BodyPublishers.ofString(body)).build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AiProviderException(AiErrorKind.TIMEOUT, "no response within " + timeout, e);
        } catch (IOException e) {
            throw new AiProviderException(AiErrorKind.UNAVAILABLE, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted during AI request", e);
        }

        if (response.statusCode() != 200) {
            throw mapError(response.statusCode(), response.body());
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AiProviderException(AiErrorKind.INVALID_RESPONSE, "response body is not JSON", e);
        }
    }

    AiProviderException mapError(int statusCode, String body) {
        String errorType = "";
        String message = body;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            errorType = error.path("type").asText("");
            message = error.path("message").asText(body);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.debugf("Error response with status %d is not JSON", statusCode);
        }

        return switch (statusCode) {
            case 401 -> new AiProviderException(AiErrorKind.UNAUTHORIZED, message);
            case 408 -> new AiProviderException(AiErrorKind.TIMEOUT, message);
            case 429 -> new AiProviderException(AiErrorKind.RATE_LIMITED, message);
            case 400 -> {
                if (!"invalid_request_error".equals(errorType)) {
                    yield new AiProviderException(AiErrorKind.INVALID_REQUEST, "bad request: " + message);
                }
                if (message != null && message.toLowerCase().contains("policy")) {
                    yield new AiProviderException(AiErrorKind.CONTENT_POLICY, message);
                }
                yield new AiProviderException(AiErrorKind.INVALID_IMAGE, message);
            }
            case 502, 503, 504, 529 -> new AiProviderException(AiErrorKind.UNAVAILABLE,
                    "status " + statusCode + ": " + message);
            default -> new AiProviderException(AiErrorKind.INVALID_REQUEST,
                    "API error (status " + statusCode + "): " + message);
        };
    }

    AnalysisResult parseAnalysis(JsonNode response) {
        String text = null;
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                text = block.get("text").asText();
                break;
            }
        }
        if (text == null) {
            throw new AiProviderException(AiErrorKind.INVALID_RESPONSE, "response contains no text content");
        }

        JsonNode analysis;
        try {
            analysis = objectMapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new AiProviderException(AiErrorKind.INVALID_RESPONSE, "analysis text is not valid JSON", e);
        }
        if (analysis == null || !analysis.isObject()) {
            throw new AiProviderException(AiErrorKind.INVALID_RESPONSE, "analysis text is not a JSON object");
        }

        List<PotentialViolation> violations = new ArrayList<>();
        for (JsonNode node : analysis.path("violations")) {
            violations.add(parseViolation(node));
        }
        return new AnalysisResult(violations, textOrNull(analysis, "general_observations"),
                textOrNull(analysis, "image_quality_notes"), null);
    }

    private PotentialViolation parseViolation(JsonNode node) {
        BoundingBox box = null;
        JsonNode boxNode = node.path("bounding_box");
        if (boxNode.isObject()) {
            box = new BoundingBox(boxNode.path("x").asDouble(), boxNode.path("y").asDouble(),
                    boxNode.path("width").asDouble(), boxNode.path("height").asDouble());
        }

        List<String> regulations = new ArrayList<>();
        for (JsonNode regulation : node.path("suggested_regulations")) {
            if (regulation.isTextual() && !regulation.asText().isBlank()) {
                regulations.add(regulation.asText().strip());
            }
        }

        return new PotentialViolation(node.path("description").asText(""), textOrNull(node, "location"), box,
                Confidence.fromValue(node.path("confidence").asText(null)), textOrNull(node, "category"),
                Severity.fromValue(node.path("severity").asText(null)), regulations);
    }

    private void trackUsage(AnalyzeImageRequest request, UsageInfo usage) {
        try {
            usageTracking.recordUsage(request.userId(), request.inspectionId(), usage,
                    AiUsageTrackingService.REQUEST_TYPE_ANALYZE_IMAGE);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to track AI usage for image %s", request.imageId());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    // Models sometimes wrap the JSON in a markdown fence despite the prompt.
    static String stripCodeFence(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int lastFence = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, lastFence).strip();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
