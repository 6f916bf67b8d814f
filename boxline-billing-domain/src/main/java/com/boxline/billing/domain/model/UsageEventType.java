package com.boxline.billing.domain.model;

import java.util.Locale;

public enum UsageEventType {
    ATHLETE_ADDED,
    ATHLETE_REMOVED,
    COACH_ADDED,
    COACH_REMOVED,
    SUBSCRIPTION_CREATED,
    SUBSCRIPTION_CANCELED,
    SUBSCRIPTION_REACTIVATED,
    GRACE_PERIOD_TRIGGERED,
    GRACE_PERIOD_RESOLVED,
    PLAN_UPGRADED,
    PLAN_DOWNGRADED,
    OVERAGE_BILLED,
    PAYMENT_RECEIVED,
    PAYMENT_FAILED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Events that may push a role over its seat limit. */
    public boolean addsSeat() {
        return this == ATHLETE_ADDED || this == COACH_ADDED;
    }

    public static UsageEventType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("UsageEventType code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
