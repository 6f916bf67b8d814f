package com.boxline.billing.domain.model;

/**
 * Overage of one role within a period. {@code amount = overage * rate}.
 */
public record RoleOverage(int count, int limit, int overage, long rate, long amount) {

    public static RoleOverage of(int count, int limit, long rate) {
        int over = Math.max(0, count - limit);
        return new RoleOverage(count, limit, over, rate, over * rate);
    }
}
