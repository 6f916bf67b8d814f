package com.boxline.billing.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Why a grace period was opened. At most one unresolved, unexpired period exists per tenant and reason.
 */
public enum GraceReason {
    ATHLETE_LIMIT_EXCEEDED,
    COACH_LIMIT_EXCEEDED,
    TRIAL_ENDING,
    PAYMENT_FAILED,
    SUBSCRIPTION_CANCELED,
    BILLING_ISSUE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GraceReason limitExceeded(MemberRole role) {
        Objects.requireNonNull(role, "role");
        return role == MemberRole.ATHLETE ? ATHLETE_LIMIT_EXCEEDED : COACH_LIMIT_EXCEEDED;
    }

    public static GraceReason fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("GraceReason code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
