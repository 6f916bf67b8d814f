package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A customer organization (a box). Carries a denormalized copy of its billing state.
 */
public record Tenant(
        UUID id,
        String name,
        PlanTier tier,
        TenantStatus status,
        SubscriptionStatus subscriptionStatus,
        int athleteLimit,
        int coachLimit,
        boolean overageEnabled,
        Instant nextBillingDate,
        String externalCustomerId,
        UUID ownerUserId
) {

    public Tenant {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
    }

    public int storedLimitFor(MemberRole role) {
        return role == MemberRole.ATHLETE ? athleteLimit : coachLimit;
    }
}
