package com.boxline.billing.domain.model;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Versioned commercial plan. Prices and rates are in minor currency units.
 *
 * Overage rates are optional; a missing rate falls back to the configured default.
 */
public record Plan(
        UUID id,
        PlanTier tier,
        String name,
        int version,
        boolean current,
        int athleteLimit,
        int coachLimit,
        long monthlyPrice,
        Long athleteOverageRate,
        Long coachOverageRate,
        String externalProductId
) {

    public Plan {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tier, "tier");
    }

    public int limitFor(MemberRole role) {
        return role == MemberRole.ATHLETE ? athleteLimit : coachLimit;
    }

    public OptionalLong overageRateFor(MemberRole role) {
        Long rate = role == MemberRole.ATHLETE ? athleteOverageRate : coachOverageRate;
        return rate == null ? OptionalLong.empty() : OptionalLong.of(rate);
    }
}
