/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.integration.ai;

/**
 * Classification of AI provider failures. Only transient kinds are retried.
 */
public enum AiErrorKind {
    RATE_LIMITED(true, "ai provider rate limit exceeded"),
    TIMEOUT(true, "ai request timed out"),
    UNAVAILABLE(true, "ai service temporarily unavailable"),
    INVALID_IMAGE(false, "invalid image format or content"),
    CONTENT_POLICY(false, "image violates content policy"),
    UNAUTHORIZED(false, "ai provider authentication failed"),
    INVALID_REQUEST(false, "ai request rejected"),
    INVALID_RESPONSE(false, "ai response could not be parsed");

    private final boolean retryable;
    private final String description;

    AiErrorKind(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getDescription() {
        return description;
    }
}
