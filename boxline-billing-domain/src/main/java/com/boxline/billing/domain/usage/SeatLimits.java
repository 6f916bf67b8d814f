package com.boxline.billing.domain.usage;

import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.Tenant;

/**
 * Seat limits per billed role.
 *
 * Resolution order: current plan, then the limits stored on the tenant, then {@link #DEFAULT}.
 */
public record SeatLimits(int athletes, int coaches) {

    public static final SeatLimits DEFAULT = new SeatLimits(75, 3);

    public int of(MemberRole role) {
        return role == MemberRole.ATHLETE ? athletes : coaches;
    }

    public static SeatLimits of(Plan plan) {
        return new SeatLimits(plan.athleteLimit(), plan.coachLimit());
    }

    public static SeatLimits resolve(Plan plan, Tenant tenant) {
        if (plan != null) {
            return of(plan);
        }
        if (tenant != null && tenant.athleteLimit() > 0 && tenant.coachLimit() > 0) {
            return new SeatLimits(tenant.athleteLimit(), tenant.coachLimit());
        }
        return DEFAULT;
    }
}
