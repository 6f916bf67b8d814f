package com.boxline.billing.domain.grace;

import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.GraceSeverity;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static grace period policy keyed by reason.
 */
public final class GracePolicy {

    private static final Map<GraceReason, GraceTerms> TERMS;

    static {
        Map<GraceReason, GraceTerms> m = new EnumMap<>(GraceReason.class);
        m.put(GraceReason.ATHLETE_LIMIT_EXCEEDED, new GraceTerms(Duration.ofDays(14), GraceSeverity.WARNING));
        m.put(GraceReason.COACH_LIMIT_EXCEEDED, new GraceTerms(Duration.ofDays(14), GraceSeverity.WARNING));
        m.put(GraceReason.TRIAL_ENDING, new GraceTerms(Duration.ofDays(7), GraceSeverity.CRITICAL));
        m.put(GraceReason.PAYMENT_FAILED, new GraceTerms(Duration.ofDays(3), GraceSeverity.CRITICAL));
        m.put(GraceReason.SUBSCRIPTION_CANCELED, new GraceTerms(Duration.ZERO, GraceSeverity.BLOCKING));
        m.put(GraceReason.BILLING_ISSUE, new GraceTerms(Duration.ofDays(7), GraceSeverity.WARNING));
        TERMS = Collections.unmodifiableMap(m);
    }

    private static final GraceTerms FALLBACK = new GraceTerms(Duration.ofDays(7), GraceSeverity.WARNING);

    private GracePolicy() {}

    public static GraceTerms termsFor(GraceReason reason) {
        return TERMS.getOrDefault(reason, FALLBACK);
    }

    /** Policy terms with caller overrides applied. */
    public static GraceTerms termsFor(GraceReason reason, GraceOverrides overrides) {
        GraceTerms base = termsFor(reason);
        if (overrides == null) {
            return base;
        }
        return new GraceTerms(
                overrides.duration() != null ? overrides.duration() : base.duration(),
                overrides.severity() != null ? overrides.severity() : base.severity());
    }
}
