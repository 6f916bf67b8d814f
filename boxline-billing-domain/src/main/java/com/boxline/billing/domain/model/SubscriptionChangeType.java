package com.boxline.billing.domain.model;

import java.util.Locale;

public enum SubscriptionChangeType {
    CANCELED,
    REACTIVATED,
    UPGRADE,
    DOWNGRADE,
    LATERAL,
    STATUS_CHANGED;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubscriptionChangeType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("SubscriptionChangeType code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
