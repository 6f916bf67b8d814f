package com.boxline.billing.infrastructure.subscription;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "subscriptions",
    uniqueConstraints = @UniqueConstraint(name = "uk_subscriptions_external", columnNames = "external_subscription_id"),
    indexes = @Index(name = "ix_subscriptions_tenant_synced", columnList = "tenant_id,last_synced_at")
)
public class SubscriptionEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(name = "plan_id", columnDefinition = "uuid")
  private UUID planId;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(name = "current_period_start")
  private Instant currentPeriodStart;

  @Column(name = "current_period_end")
  private Instant currentPeriodEnd;

  @Column(name = "cancel_at_period_end", nullable = false)
  private boolean cancelAtPeriodEnd;

  @Column(name = "canceled_at")
  private Instant canceledAt;

  @Column(name = "cancel_reason", columnDefinition = "text")
  private String cancelReason;

  @Column(nullable = false)
  private long amount;

  @Column(length = 8)
  private String currency;

  @Column(name = "external_subscription_id", length = 128)
  private String externalSubscriptionId;

  @Column(name = "external_customer_id", length = 128)
  private String externalCustomerId;

  @Column(name = "last_synced_at")
  private Instant lastSyncedAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public SubscriptionEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public UUID getPlanId() { return planId; }
  public void setPlanId(UUID planId) { this.planId = planId; }

  public String getStatus() { return status; }
  public void setStatus(String status) { this.status = status; }

  public Instant getCurrentPeriodStart() { return currentPeriodStart; }
  public void setCurrentPeriodStart(Instant currentPeriodStart) { this.currentPeriodStart = currentPeriodStart; }

  public Instant getCurrentPeriodEnd() { return currentPeriodEnd; }
  public void setCurrentPeriodEnd(Instant currentPeriodEnd) { this.currentPeriodEnd = currentPeriodEnd; }

  public boolean isCancelAtPeriodEnd() { return cancelAtPeriodEnd; }
  public void setCancelAtPeriodEnd(boolean cancelAtPeriodEnd) { this.cancelAtPeriodEnd = cancelAtPeriodEnd; }

  public Instant getCanceledAt() { return canceledAt; }
  public void setCanceledAt(Instant canceledAt) { this.canceledAt = canceledAt; }

  public String getCancelReason() { return cancelReason; }
  public void setCancelReason(String cancelReason) { this.cancelReason = cancelReason; }

  public long getAmount() { return amount; }
  public void setAmount(long amount) { this.amount = amount; }

  public String getCurrency() { return currency; }
  public void setCurrency(String currency) { this.currency = currency; }

  public String getExternalSubscriptionId() { return externalSubscriptionId; }
  public void setExternalSubscriptionId(String externalSubscriptionId) { this.externalSubscriptionId = externalSubscriptionId; }

  public String getExternalCustomerId() { return externalCustomerId; }
  public void setExternalCustomerId(String externalCustomerId) { this.externalCustomerId = externalCustomerId; }

  public Instant getLastSyncedAt() { return lastSyncedAt; }
  public void setLastSyncedAt(Instant lastSyncedAt) { this.lastSyncedAt = lastSyncedAt; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (id == null) id = UUID.randomUUID();
  }
}
