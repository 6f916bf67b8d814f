package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit entry for a plan or lifecycle change of a subscription.
 */
public record SubscriptionChange(
        UUID id,
        UUID tenantId,
        UUID subscriptionId,
        SubscriptionChangeType changeType,
        UUID fromPlanId,
        UUID toPlanId,
        SubscriptionStatus fromStatus,
        SubscriptionStatus toStatus,
        long proratedAmount,
        Instant effectiveDate,
        String reason,
        String triggeredBy,
        String externalEventId,
        Instant createdAt
) {

    public SubscriptionChange {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(effectiveDate, "effectiveDate");
    }
}
