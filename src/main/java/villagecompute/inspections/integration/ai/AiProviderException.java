/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.integration.ai;

/**
 * Exception thrown by an {@link ImageAnalysisProvider} call, carrying its {@link AiErrorKind}.
 */
public class AiProviderException extends RuntimeException {

    private final AiErrorKind kind;

    public AiProviderException(AiErrorKind kind, String message) {
        super(kind.getDescription() + ": " + message);
        this.kind = kind;
    }

    public AiProviderException(AiErrorKind kind, String message, Throwable cause) {
        super(kind.getDescription() + ": " + message, cause);
        this.kind = kind;
    }

    public AiErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
