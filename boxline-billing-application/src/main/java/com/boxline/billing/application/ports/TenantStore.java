package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.TenantStatus;
import com.boxline.billing.domain.usage.SeatLimits;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Tenant billing columns. Updates are column-scoped so concurrent writers of unrelated fields do not
 * overwrite each other.
 */
public interface TenantStore {

    Optional<Tenant> findById(UUID id);

    Optional<Tenant> findByExternalCustomerId(String externalCustomerId);

    void updateBillingStatus(UUID tenantId, TenantStatus status, SubscriptionStatus subscriptionStatus);

    void updatePlan(UUID tenantId, PlanTier tier, SeatLimits limits);

    void setOverageEnabled(UUID tenantId, boolean enabled);

    void setExternalCustomerId(UUID tenantId, String externalCustomerId);

    void setNextBillingDate(UUID tenantId, Instant nextBillingDate);
}
