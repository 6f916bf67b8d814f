package com.boxline.billing.domain.pricing;

import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.RoleOverage;

import java.util.UUID;

/**
 * Overage breakdown for one tenant and period. Only produced when at least one role is over.
 */
public record OverageCalculation(
        UUID tenantId,
        UUID subscriptionId,
        BillingPeriod period,
        RoleOverage athletes,
        RoleOverage coaches,
        long totalOverageAmount
) {

    public int athleteOverage() {
        return athletes.overage();
    }

    public int coachOverage() {
        return coaches.overage();
    }
}
