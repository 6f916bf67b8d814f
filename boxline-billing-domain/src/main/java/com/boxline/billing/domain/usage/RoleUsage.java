package com.boxline.billing.domain.usage;

import com.boxline.billing.domain.model.MemberRole;

/**
 * Usage of one role against its limit.
 */
public record RoleUsage(
        MemberRole role,
        int count,
        int limit,
        int percentage,
        boolean overLimit,
        int overage,
        long rate,
        long overageAmount
) {

    public static final int APPROACHING_THRESHOLD_PCT = 90;

    public static RoleUsage of(MemberRole role, int count, int limit, long rate) {
        int pct = limit > 0 ? (int) Math.round(count * 100.0 / limit) : 0;
        boolean over = count > limit;
        int overage = over ? count - limit : 0;
        return new RoleUsage(role, count, limit, pct, over, overage, rate, overage * rate);
    }

    /** At or above the warning threshold but not yet over the limit. */
    public boolean isApproaching() {
        return !overLimit && percentage >= APPROACHING_THRESHOLD_PCT;
    }
}
