package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * When a plan change is charged. Only IMMEDIATE produces a prorated amount.
 */
public enum ProrationType {
    IMMEDIATE,
    NEXT_BILLING_CYCLE,
    END_OF_PERIOD;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ProrationType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProrationType code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
