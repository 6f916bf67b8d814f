package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * Commercial tier of a plan. Each tier has exactly one current plan version.
 */
public enum PlanTier {
    SEED,
    GROW,
    SCALE;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PlanTier fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("PlanTier code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
