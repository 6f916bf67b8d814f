package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable record of an inbound billing event.
 *
 * Rules:
 * - one record per external id
 * - processed=true is terminal
 * - retryCount counts failed attempts
 */
public record BillingEvent(
        UUID id,
        String externalId,
        String type,
        UUID tenantId,
        String payload,
        BillingEventStatus status,
        boolean processed,
        Boolean handled,
        int retryCount,
        int maxRetries,
        String lastError,
        String lastErrorTrace,
        Instant nextRetryAt,
        Instant createdAt,
        Instant lastAttemptAt,
        Instant processedAt
) {

    public BillingEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(externalId, "externalId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
    }

    public static BillingEvent pending(UUID id, String externalId, String type, UUID tenantId, String payload,
                                       int maxRetries, Instant now) {
        return new BillingEvent(id, externalId, type, tenantId, payload, BillingEventStatus.PENDING, false, null,
                0, maxRetries, null, null, null, now, null, null);
    }

    public boolean retriesExhausted() {
        return retryCount >= maxRetries;
    }
}
