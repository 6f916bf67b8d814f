package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Local copy of a gateway subscription. Updated in place; every change returns a new value.
 */
public record Subscription(
        UUID id,
        UUID tenantId,
        UUID planId,
        SubscriptionStatus status,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        boolean cancelAtPeriodEnd,
        Instant canceledAt,
        String cancelReason,
        long amount,
        String currency,
        String externalSubscriptionId,
        String externalCustomerId,
        Instant lastSyncedAt,
        Instant createdAt
) {

    public Subscription {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(status, "status");
    }

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    public boolean hasPendingCancellation() {
        return cancelAtPeriodEnd && status == SubscriptionStatus.ACTIVE;
    }

    public BillingPeriod currentPeriod() {
        if (currentPeriodStart == null || currentPeriodEnd == null) {
            return null;
        }
        return new BillingPeriod(currentPeriodStart, currentPeriodEnd);
    }

    public Subscription withStatus(SubscriptionStatus newStatus, Instant now) {
        return new Subscription(id, tenantId, planId, newStatus, currentPeriodStart, currentPeriodEnd,
                cancelAtPeriodEnd, canceledAt, cancelReason, amount, currency, externalSubscriptionId,
                externalCustomerId, now, createdAt);
    }

    public Subscription scheduleCancellation(String reason, Instant now) {
        return new Subscription(id, tenantId, planId, status, currentPeriodStart, currentPeriodEnd,
                true, null, reason, amount, currency, externalSubscriptionId,
                externalCustomerId, now, createdAt);
    }

    public Subscription cancelNow(String reason, Instant now) {
        return new Subscription(id, tenantId, planId, SubscriptionStatus.CANCELED, currentPeriodStart,
                currentPeriodEnd, false, now, reason, amount, currency, externalSubscriptionId,
                externalCustomerId, now, createdAt);
    }

    public Subscription reactivate(Instant now) {
        return new Subscription(id, tenantId, planId, SubscriptionStatus.ACTIVE, currentPeriodStart,
                currentPeriodEnd, false, null, null, amount, currency, externalSubscriptionId,
                externalCustomerId, now, createdAt);
    }

    public Subscription withPlan(UUID newPlanId, long newAmount, Instant now) {
        return new Subscription(id, tenantId, newPlanId, status, currentPeriodStart, currentPeriodEnd,
                cancelAtPeriodEnd, canceledAt, cancelReason, newAmount, currency, externalSubscriptionId,
                externalCustomerId, now, createdAt);
    }

    /** Applies gateway-authoritative fields, keeping local identity. */
    public Subscription syncedFrom(
            UUID newPlanId,
            SubscriptionStatus newStatus,
            Instant periodStart,
            Instant periodEnd,
            boolean newCancelAtPeriodEnd,
            Instant newCanceledAt,
            long newAmount,
            String newCurrency,
            String customerId,
            Instant now
    ) {
        return new Subscription(id, tenantId, newPlanId, newStatus, periodStart, periodEnd,
                newCancelAtPeriodEnd, newCanceledAt, cancelReason, newAmount, newCurrency,
                externalSubscriptionId, customerId, now, createdAt);
    }
}
