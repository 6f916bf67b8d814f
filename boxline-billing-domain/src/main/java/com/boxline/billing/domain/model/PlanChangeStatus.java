package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * A pending request is either approved or canceled, never both.
 */
public enum PlanChangeStatus {
    PENDING,
    APPROVED,
    CANCELED;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PlanChangeStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("PlanChangeStatus code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
