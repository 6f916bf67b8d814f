package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Payable order. Overage orders point back at their {@link OverageBillingRecord}.
 */
public record BillingOrder(
        UUID id,
        UUID tenantId,
        String type,
        OrderStatus status,
        long amount,
        String currency,
        String description,
        UUID overageBillingId,
        String externalInvoiceId,
        Instant createdAt,
        Instant paidAt
) {

    public static final String TYPE_OVERAGE = "overage";

    public BillingOrder {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(status, "status");
    }

    public BillingOrder withStatus(OrderStatus newStatus, String invoiceId, Instant now) {
        return new BillingOrder(id, tenantId, type, newStatus, amount, currency, description, overageBillingId,
                invoiceId != null ? invoiceId : externalInvoiceId, createdAt,
                newStatus == OrderStatus.PAID ? now : paidAt);
    }
}
