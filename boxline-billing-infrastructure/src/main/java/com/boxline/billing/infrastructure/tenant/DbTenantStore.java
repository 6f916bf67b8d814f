package com.boxline.billing.infrastructure.tenant;

import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.TenantStatus;
import com.boxline.billing.domain.usage.SeatLimits;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: tenant billing columns behind {@link TenantStore}.
 *
 * Updates of an unknown tenant fail with {@link NotFoundException} instead of silently touching
 * zero rows.
 */
@Component
public class DbTenantStore implements TenantStore {

  private final TenantRepository tenants;
  private final Clock clock;

  public DbTenantStore(TenantRepository tenants, Clock clock) {
    this.tenants = tenants;
    this.clock = clock;
  }

  @Override
  public Optional<Tenant> findById(UUID id) {
    return tenants.findById(id).map(DbTenantStore::toDomain);
  }

  @Override
  public Optional<Tenant> findByExternalCustomerId(String externalCustomerId) {
    if (externalCustomerId == null || externalCustomerId.isBlank()) return Optional.empty();
    return tenants.findByExternalCustomerId(externalCustomerId).map(DbTenantStore::toDomain);
  }

  @Override
  public void updateBillingStatus(UUID tenantId, TenantStatus status, SubscriptionStatus subscriptionStatus) {
    requireUpdated(tenantId, tenants.updateBillingStatus(tenantId, status.code(),
        subscriptionStatus == null ? null : subscriptionStatus.code(), clock.instant()));
  }

  @Override
  public void updatePlan(UUID tenantId, PlanTier tier, SeatLimits limits) {
    requireUpdated(tenantId, tenants.updatePlan(tenantId, tier.code(), limits.athletes(), limits.coaches(),
        clock.instant()));
  }

  @Override
  public void setOverageEnabled(UUID tenantId, boolean enabled) {
    requireUpdated(tenantId, tenants.updateOverageEnabled(tenantId, enabled, clock.instant()));
  }

  @Override
  public void setExternalCustomerId(UUID tenantId, String externalCustomerId) {
    requireUpdated(tenantId, tenants.updateExternalCustomerId(tenantId, externalCustomerId, clock.instant()));
  }

  @Override
  public void setNextBillingDate(UUID tenantId, Instant nextBillingDate) {
    requireUpdated(tenantId, tenants.updateNextBillingDate(tenantId, nextBillingDate, clock.instant()));
  }

  private static void requireUpdated(UUID tenantId, int rows) {
    if (rows == 0) throw NotFoundException.of("tenant", tenantId);
  }

  static Tenant toDomain(TenantEntity e) {
    return new Tenant(
        e.getId(),
        e.getName(),
        e.getTier() == null ? null : PlanTier.fromCode(e.getTier()),
        TenantStatus.fromCode(e.getStatus()),
        e.getSubscriptionStatus() == null ? null : SubscriptionStatus.fromCode(e.getSubscriptionStatus()),
        e.getAthleteLimit(),
        e.getCoachLimit(),
        e.isOverageEnabled(),
        e.getNextBillingDate(),
        e.getExternalCustomerId(),
        e.getOwnerUserId()
    );
  }
}
