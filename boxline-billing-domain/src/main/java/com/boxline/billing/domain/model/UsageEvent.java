package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only usage record, tagged with the billing window it happened in.
 */
public record UsageEvent(
        UUID id,
        UUID tenantId,
        UsageEventType type,
        int quantity,
        boolean billable,
        BillingPeriod period,
        String actor,
        Attributes metadata,
        Instant createdAt
) {

    public UsageEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(period, "period");
        metadata = metadata == null ? Attributes.empty() : metadata;
    }
}
