package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Overage charge for one tenant and one billing period. Unique per (tenant, period start, period end).
 */
public record OverageBillingRecord(
        UUID id,
        UUID tenantId,
        UUID subscriptionId,
        BillingPeriod period,
        RoleOverage athletes,
        RoleOverage coaches,
        long totalAmount,
        String currency,
        OverageStatus status,
        UUID orderId,
        String externalInvoiceId,
        String failureReason,
        Instant createdAt,
        Instant paidAt
) {

    public OverageBillingRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(status, "status");
    }

    public OverageBillingRecord withOrder(UUID newOrderId) {
        return new OverageBillingRecord(id, tenantId, subscriptionId, period, athletes, coaches, totalAmount,
                currency, status, newOrderId, externalInvoiceId, failureReason, createdAt, paidAt);
    }

    public OverageBillingRecord markPaid(String invoiceId, Instant now) {
        return new OverageBillingRecord(id, tenantId, subscriptionId, period, athletes, coaches, totalAmount,
                currency, OverageStatus.PAID, orderId, invoiceId != null ? invoiceId : externalInvoiceId, null,
                createdAt, now);
    }

    public OverageBillingRecord markFailed(String reason) {
        return new OverageBillingRecord(id, tenantId, subscriptionId, period, athletes, coaches, totalAmount,
                currency, OverageStatus.FAILED, orderId, externalInvoiceId, reason, createdAt, null);
    }
}
