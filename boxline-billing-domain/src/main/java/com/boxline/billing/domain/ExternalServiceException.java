package com.boxline.billing.domain;

import java.util.Objects;

/**
 * A call to the payment gateway or notification service failed. A retry may succeed.
 */
public final class ExternalServiceException extends BillingException {

    private final String service;

    public ExternalServiceException(String service, String message) {
        super(message);
        this.service = Objects.requireNonNull(service, "service");
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = Objects.requireNonNull(service, "service");
    }

    public String service() {
        return service;
    }

    @Override
    public String reason() {
        return "external_service_error";
    }
}
