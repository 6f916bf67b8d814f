package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * Billed seat roles. Owners and head coaches are not counted against limits.
 */
public enum MemberRole {
    ATHLETE,
    COACH;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MemberRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("MemberRole code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
