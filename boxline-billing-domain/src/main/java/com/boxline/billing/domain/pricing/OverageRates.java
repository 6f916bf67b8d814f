package com.boxline.billing.domain.pricing;

import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.model.Plan;

/**
 * Per-seat overage rates in minor units.
 */
public record OverageRates(long athleteRate, long coachRate) {

    public static final OverageRates DEFAULT = new OverageRates(100, 100);

    public long of(MemberRole role) {
        return role == MemberRole.ATHLETE ? athleteRate : coachRate;
    }

    /** Plan rates where set, {@code defaults} otherwise. */
    public static OverageRates resolve(Plan plan, OverageRates defaults) {
        if (plan == null) {
            return defaults;
        }
        return new OverageRates(
                plan.overageRateFor(MemberRole.ATHLETE).orElse(defaults.athleteRate()),
                plan.overageRateFor(MemberRole.COACH).orElse(defaults.coachRate()));
    }
}
