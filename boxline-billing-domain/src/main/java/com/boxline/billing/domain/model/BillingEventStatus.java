package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * Processing status of an inbound billing event.
 */
public enum BillingEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BillingEventStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("BillingEventStatus code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
