package com.boxline.billing.application.subscription;

import com.boxline.billing.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Subscription state as reported by the payment gateway in a webhook.
 */
public record GatewaySubscription(
        String externalSubscriptionId,
        String externalCustomerId,
        String externalProductId,
        UUID tenantId,
        SubscriptionStatus status,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        boolean cancelAtPeriodEnd,
        Instant canceledAt,
        long amount,
        String currency
) {

    public GatewaySubscription {
        Objects.requireNonNull(externalSubscriptionId, "externalSubscriptionId");
        Objects.requireNonNull(status, "status");
    }
}
