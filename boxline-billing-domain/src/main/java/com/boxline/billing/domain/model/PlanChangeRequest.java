package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record PlanChangeRequest(
        UUID id,
        UUID tenantId,
        UUID subscriptionId,
        UUID fromPlanId,
        UUID toPlanId,
        PlanChangeType changeType,
        ProrationType prorationType,
        PlanChangeStatus status,
        Instant requestedEffectiveDate,
        String requestedBy,
        Instant requestedAt,
        String decidedBy,
        Instant decidedAt,
        Long proratedAmount,
        String cancelReason
) {

    public PlanChangeRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(toPlanId, "toPlanId");
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(prorationType, "prorationType");
        Objects.requireNonNull(status, "status");
    }

    public boolean isPending() {
        return status == PlanChangeStatus.PENDING;
    }

    public PlanChangeRequest approved(String approver, long amount, Instant now) {
        return new PlanChangeRequest(id, tenantId, subscriptionId, fromPlanId, toPlanId, changeType, prorationType,
                PlanChangeStatus.APPROVED, requestedEffectiveDate, requestedBy, requestedAt, approver, now,
                amount, null);
    }

    public PlanChangeRequest canceled(String actor, String reason, Instant now) {
        return new PlanChangeRequest(id, tenantId, subscriptionId, fromPlanId, toPlanId, changeType, prorationType,
                PlanChangeStatus.CANCELED, requestedEffectiveDate, requestedBy, requestedAt, actor, now,
                null, reason);
    }
}
