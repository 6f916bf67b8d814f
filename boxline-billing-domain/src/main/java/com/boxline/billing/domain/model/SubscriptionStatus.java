package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * Canonical subscription status.
 *
 * Transitions:
 * - trial -> active
 * - active -> past_due | canceled | incomplete | paused
 * - past_due -> active | canceled
 * - canceled and incomplete are terminal for the row; the tenant may get a new subscription.
 */
public enum SubscriptionStatus {
    TRIAL,
    ACTIVE,
    PAST_DUE,
    CANCELED,
    INCOMPLETE,
    PAUSED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == CANCELED || this == INCOMPLETE;
    }

    /**
     * Projects the subscription status onto what the tenant sees.
     *
     * @param paymentGraceOpen whether an unresolved payment_failed grace period is still running
     */
    public TenantStatus toTenantStatus(boolean paymentGraceOpen) {
        switch (this) {
            case TRIAL:
                return TenantStatus.TRIAL;
            case ACTIVE:
                return TenantStatus.ACTIVE;
            case PAST_DUE:
                return paymentGraceOpen ? TenantStatus.ACTIVE : TenantStatus.SUSPENDED;
            case PAUSED:
                return TenantStatus.PAUSED;
            default:
                return TenantStatus.SUSPENDED;
        }
    }

    public static SubscriptionStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("SubscriptionStatus code is blank");
        }
        String c = code.trim().toUpperCase(Locale.ROOT);
        if (c.equals("CANCELLED")) {
            return CANCELED;
        }
        return valueOf(c);
    }
}
