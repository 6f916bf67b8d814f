package com.boxline.billing.application.overage;

import java.util.UUID;

/**
 * Per-tenant line of a monthly overage run.
 */
public record TenantOverageResult(
        UUID tenantId,
        UUID subscriptionId,
        boolean success,
        boolean created,
        long amount,
        UUID overageBillingId,
        String message
) {

    public static TenantOverageResult billed(UUID tenantId, UUID subscriptionId, OverageCharge charge) {
        if (charge.record() == null) {
            return new TenantOverageResult(tenantId, subscriptionId, true, false, 0, null, "no overage");
        }
        return new TenantOverageResult(tenantId, subscriptionId, true, !charge.existing(), charge.amount(),
                charge.record().id(), charge.existing() ? "already billed" : "billed");
    }

    public static TenantOverageResult skipped(UUID tenantId, UUID subscriptionId, String message) {
        return new TenantOverageResult(tenantId, subscriptionId, true, false, 0, null, message);
    }

    public static TenantOverageResult failed(UUID tenantId, UUID subscriptionId, String error) {
        return new TenantOverageResult(tenantId, subscriptionId, false, false, 0, null, error);
    }
}
