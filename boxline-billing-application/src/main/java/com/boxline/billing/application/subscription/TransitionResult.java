package com.boxline.billing.application.subscription;

import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.TenantStatus;

import java.util.UUID;

/**
 * Outcome of {@link SubscriptionStateMachine#transition}.
 */
public record TransitionResult(
        Outcome outcome,
        UUID tenantId,
        Subscription subscription,
        SubscriptionStatus previousStatus,
        TenantStatus tenantStatus,
        String message
) {

    public enum Outcome {
        APPLIED,
        UNCHANGED,
        NO_ACTIVE_SUBSCRIPTION
    }

    public static TransitionResult applied(Subscription sub, SubscriptionStatus previous, TenantStatus tenantStatus) {
        return new TransitionResult(Outcome.APPLIED, sub.tenantId(), sub, previous, tenantStatus, null);
    }

    public static TransitionResult unchanged(Subscription sub) {
        return new TransitionResult(Outcome.UNCHANGED, sub.tenantId(), sub, sub.status(), null, null);
    }

    public static TransitionResult noActiveSubscription(UUID tenantId) {
        return new TransitionResult(Outcome.NO_ACTIVE_SUBSCRIPTION, tenantId, null, null, null,
                "No active subscription found");
    }

    public boolean success() {
        return outcome != Outcome.NO_ACTIVE_SUBSCRIPTION;
    }
}
