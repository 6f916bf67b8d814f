package com.boxline.billing.application.events;

import com.boxline.billing.domain.model.SubscriptionStatus;

import java.util.Locale;

/**
 * Maps gateway subscription status strings to local statuses.
 */
final class GatewayStatuses {

    private GatewayStatuses() {}

    static SubscriptionStatus map(String gatewayStatus) {
        if (gatewayStatus == null) {
            return SubscriptionStatus.INCOMPLETE;
        }
        switch (gatewayStatus.trim().toLowerCase(Locale.ROOT)) {
            case "trialing":
            case "trial":
                return SubscriptionStatus.TRIAL;
            case "active":
                return SubscriptionStatus.ACTIVE;
            case "past_due":
            case "unpaid":
                return SubscriptionStatus.PAST_DUE;
            case "canceled":
            case "cancelled":
            case "revoked":
                return SubscriptionStatus.CANCELED;
            case "paused":
                return SubscriptionStatus.PAUSED;
            default:
                // incomplete, incomplete_expired and anything unknown
                return SubscriptionStatus.INCOMPLETE;
        }
    }
}
