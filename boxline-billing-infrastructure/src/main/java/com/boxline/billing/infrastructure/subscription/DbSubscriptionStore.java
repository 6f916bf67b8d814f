package com.boxline.billing.infrastructure.subscription;

import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: subscriptions table behind {@link SubscriptionStore}.
 *
 * Saves are flushed immediately. The one-active-per-tenant index is checked per statement, so the
 * demotion of an old active row must reach the database before the new active row does.
 */
@Component
public class DbSubscriptionStore implements SubscriptionStore {

  private static final List<String> CURRENT_STATUSES = List.of(
      SubscriptionStatus.TRIAL.code(),
      SubscriptionStatus.ACTIVE.code(),
      SubscriptionStatus.PAST_DUE.code(),
      SubscriptionStatus.PAUSED.code()
  );

  private final SubscriptionRepository subscriptions;

  public DbSubscriptionStore(SubscriptionRepository subscriptions) {
    this.subscriptions = subscriptions;
  }

  @Override
  public Optional<Subscription> findById(UUID id) {
    return subscriptions.findById(id).map(DbSubscriptionStore::toDomain);
  }

  @Override
  public Optional<Subscription> findByExternalId(String externalSubscriptionId) {
    if (externalSubscriptionId == null || externalSubscriptionId.isBlank()) return Optional.empty();
    return subscriptions.findByExternalSubscriptionId(externalSubscriptionId).map(DbSubscriptionStore::toDomain);
  }

  @Override
  public Optional<Subscription> findActiveByTenant(UUID tenantId) {
    return subscriptions.findFirstByTenantIdAndStatusOrderByLastSyncedAtDesc(tenantId,
        SubscriptionStatus.ACTIVE.code()).map(DbSubscriptionStore::toDomain);
  }

  @Override
  public Optional<Subscription> findCurrentByTenant(UUID tenantId) {
    return subscriptions.findFirstByTenantIdAndStatusInOrderByLastSyncedAtDesc(tenantId, CURRENT_STATUSES)
        .map(DbSubscriptionStore::toDomain);
  }

  @Override
  public Optional<Subscription> findLatestByTenant(UUID tenantId) {
    return subscriptions.findFirstByTenantIdOrderByLastSyncedAtDesc(tenantId).map(DbSubscriptionStore::toDomain);
  }

  @Override
  public List<Subscription> findByTenantAndStatus(UUID tenantId, SubscriptionStatus status) {
    return subscriptions.findByTenantIdAndStatusOrderByLastSyncedAtDesc(tenantId, status.code()).stream()
        .map(DbSubscriptionStore::toDomain)
        .toList();
  }

  @Override
  public List<Subscription> findAllActive() {
    return subscriptions.findByStatusOrderByCreatedAtAsc(SubscriptionStatus.ACTIVE.code()).stream()
        .map(DbSubscriptionStore::toDomain)
        .toList();
  }

  @Override
  public Subscription save(Subscription subscription) {
    return toDomain(subscriptions.saveAndFlush(toEntity(subscription)));
  }

  static Subscription toDomain(SubscriptionEntity e) {
    return new Subscription(
        e.getId(),
        e.getTenantId(),
        e.getPlanId(),
        SubscriptionStatus.fromCode(e.getStatus()),
        e.getCurrentPeriodStart(),
        e.getCurrentPeriodEnd(),
        e.isCancelAtPeriodEnd(),
        e.getCanceledAt(),
        e.getCancelReason(),
        e.getAmount(),
        e.getCurrency(),
        e.getExternalSubscriptionId(),
        e.getExternalCustomerId(),
        e.getLastSyncedAt(),
        e.getCreatedAt()
    );
  }

  static SubscriptionEntity toEntity(Subscription d) {
    SubscriptionEntity e = new SubscriptionEntity();
    e.setId(d.id());
    e.setTenantId(d.tenantId());
    e.setPlanId(d.planId());
    e.setStatus(d.status().code());
    e.setCurrentPeriodStart(d.currentPeriodStart());
    e.setCurrentPeriodEnd(d.currentPeriodEnd());
    e.setCancelAtPeriodEnd(d.cancelAtPeriodEnd());
    e.setCanceledAt(d.canceledAt());
    e.setCancelReason(d.cancelReason());
    e.setAmount(d.amount());
    e.setCurrency(d.currency());
    e.setExternalSubscriptionId(d.externalSubscriptionId());
    e.setExternalCustomerId(d.externalCustomerId());
    e.setLastSyncedAt(d.lastSyncedAt());
    e.setCreatedAt(d.createdAt());
    return e;
  }
}
