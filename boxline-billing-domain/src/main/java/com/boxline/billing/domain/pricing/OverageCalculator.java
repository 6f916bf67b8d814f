package com.boxline.billing.domain.pricing;

import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.RoleOverage;
import com.boxline.billing.domain.usage.SeatCounts;
import com.boxline.billing.domain.usage.SeatLimits;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Pure overage arithmetic: {@code max(0, count - limit) * rate} per role.
 */
public final class OverageCalculator {

    private OverageCalculator() {}

    /**
     * @return empty when no role is over its limit
     */
    public static Optional<OverageCalculation> calculate(
            UUID tenantId,
            UUID subscriptionId,
            BillingPeriod period,
            SeatCounts counts,
            SeatLimits limits,
            OverageRates rates
    ) {
        Objects.requireNonNull(counts, "counts");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(rates, "rates");

        RoleOverage athletes = RoleOverage.of(counts.athletes(), limits.athletes(), rates.athleteRate());
        RoleOverage coaches = RoleOverage.of(counts.coaches(), limits.coaches(), rates.coachRate());

        if (athletes.overage() == 0 && coaches.overage() == 0) {
            return Optional.empty();
        }
        return Optional.of(new OverageCalculation(tenantId, subscriptionId, period, athletes, coaches,
                athletes.amount() + coaches.amount()));
    }
}
