package com.boxline.billing.application.events;

import java.util.UUID;

public record RetryResult(UUID recordId, String externalId, String type, boolean success, String error) {

    public static RetryResult succeeded(UUID recordId, String externalId, String type) {
        return new RetryResult(recordId, externalId, type, true, null);
    }

    public static RetryResult failed(UUID recordId, String externalId, String type, String error) {
        return new RetryResult(recordId, externalId, type, false, error);
    }
}
