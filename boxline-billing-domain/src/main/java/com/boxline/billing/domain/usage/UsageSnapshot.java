package com.boxline.billing.domain.usage;

import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.pricing.OverageRates;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time usage of a tenant. Computed from authoritative counts, never cached.
 */
public record UsageSnapshot(
        UUID tenantId,
        RoleUsage athletes,
        RoleUsage coaches,
        long estimatedOverageAmount,
        boolean overageEnabled,
        Instant nextBillingDate
) {

    public static UsageSnapshot compute(
            UUID tenantId,
            SeatCounts counts,
            SeatLimits limits,
            OverageRates rates,
            boolean overageEnabled,
            Instant nextBillingDate
    ) {
        RoleUsage a = RoleUsage.of(MemberRole.ATHLETE, counts.athletes(), limits.athletes(),
                rates.athleteRate());
        RoleUsage c = RoleUsage.of(MemberRole.COACH, counts.coaches(), limits.coaches(), rates.coachRate());
        return new UsageSnapshot(tenantId, a, c, a.overageAmount() + c.overageAmount(), overageEnabled,
                nextBillingDate);
    }

    public RoleUsage of(MemberRole role) {
        return role == MemberRole.ATHLETE ? athletes : coaches;
    }

    public List<RoleUsage> roles() {
        return List.of(athletes, coaches);
    }

    public boolean anyOverLimit() {
        return athletes.overLimit() || coaches.overLimit();
    }
}
