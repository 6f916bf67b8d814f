package com.boxline.billing.domain.pricing;

import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.ProrationType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Mid-cycle proration.
 *
 * Rules:
 * - daily rate = monthly price / total days of the current period (both plans use the same divisor)
 * - amount = (new daily - current daily) * remaining days, rounded half-up to minor units
 * - only IMMEDIATE prorates; deferred types charge nothing now
 */
public final class ProrationCalculator {

    private ProrationCalculator() {}

    public static Proration prorate(
            long currentMonthlyPrice,
            long targetMonthlyPrice,
            BillingPeriod currentPeriod,
            Instant now,
            ProrationType type
    ) {
        Objects.requireNonNull(type, "type");
        if (type != ProrationType.IMMEDIATE || currentPeriod == null) {
            return Proration.none(type);
        }

        long totalDays = currentPeriod.totalDays();
        long remainingDays = currentPeriod.remainingDays(now);
        if (totalDays == 0 || remainingDays == 0) {
            return new Proration(type, 0, totalDays, remainingDays);
        }

        // (target/total - current/total) * remaining == (target - current) * remaining / total
        BigDecimal amount = BigDecimal.valueOf(targetMonthlyPrice - currentMonthlyPrice)
                .multiply(BigDecimal.valueOf(remainingDays))
                .divide(BigDecimal.valueOf(totalDays), 0, RoundingMode.HALF_UP);

        return new Proration(type, amount.longValueExact(), totalDays, remainingDays);
    }
}
