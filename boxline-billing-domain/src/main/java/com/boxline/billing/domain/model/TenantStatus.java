package com.boxline.billing.domain.model;

import java.util.Locale;

/**
 * Tenant-visible status. Coarser than {@link SubscriptionStatus}.
 */
public enum TenantStatus {
    TRIAL,
    ACTIVE,
    PAUSED,
    SUSPENDED;

    /** Lower-case wire/database value. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TenantStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("TenantStatus code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
