package com.boxline.billing.domain.model;

import java.util.Locale;

public enum PlanChangeType {
    UPGRADE,
    DOWNGRADE,
    LATERAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Classifies a change by comparing monthly prices. */
    public static PlanChangeType classify(long fromMonthlyPrice, long toMonthlyPrice) {
        if (toMonthlyPrice > fromMonthlyPrice) {
            return UPGRADE;
        }
        if (toMonthlyPrice < fromMonthlyPrice) {
            return DOWNGRADE;
        }
        return LATERAL;
    }

    public SubscriptionChangeType toChangeType() {
        switch (this) {
            case UPGRADE:
                return SubscriptionChangeType.UPGRADE;
            case DOWNGRADE:
                return SubscriptionChangeType.DOWNGRADE;
            default:
                return SubscriptionChangeType.LATERAL;
        }
    }

    public static PlanChangeType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("PlanChangeType code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
