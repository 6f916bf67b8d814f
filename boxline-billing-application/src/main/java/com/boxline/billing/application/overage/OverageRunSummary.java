package com.boxline.billing.application.overage;

import com.boxline.billing.domain.model.BillingPeriod;

import java.util.List;

/**
 * Summary of a monthly overage run. {@code created} counts records inserted by this run;
 * {@code alreadyBilled} counts tenants whose record for the period existed before.
 */
public record OverageRunSummary(
        BillingPeriod period,
        List<TenantOverageResult> results,
        int succeeded,
        int failed,
        int created,
        int alreadyBilled,
        long totalAmount
) {

    public static OverageRunSummary of(BillingPeriod period, List<TenantOverageResult> results) {
        int ok = 0;
        int bad = 0;
        int created = 0;
        int existing = 0;
        long total = 0;
        for (TenantOverageResult r : results) {
            if (r.success()) ok++;
            else bad++;
            if (r.created()) {
                created++;
                total += r.amount();
            } else if (r.success() && r.overageBillingId() != null) {
                existing++;
            }
        }
        return new OverageRunSummary(period, List.copyOf(results), ok, bad, created, existing, total);
    }
}
