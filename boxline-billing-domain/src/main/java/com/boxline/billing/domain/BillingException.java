package com.boxline.billing.domain;

/**
 * Base type for billing failures that callers are expected to handle.
 *
 * <p>{@link #reason()} is a stable, machine-readable code rendered by the API layer.
 */
public abstract class BillingException extends RuntimeException {

    protected BillingException(String message) {
        super(message);
    }

    protected BillingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reason();
}
