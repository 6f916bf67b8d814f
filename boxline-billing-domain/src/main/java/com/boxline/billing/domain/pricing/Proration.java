package com.boxline.billing.domain.pricing;

import com.boxline.billing.domain.model.ProrationType;

/**
 * Prorated charge (positive) or credit (negative) in minor units.
 */
public record Proration(ProrationType type, long amount, long totalDays, long remainingDays) {

    public static Proration none(ProrationType type) {
        return new Proration(type, 0, 0, 0);
    }
}
