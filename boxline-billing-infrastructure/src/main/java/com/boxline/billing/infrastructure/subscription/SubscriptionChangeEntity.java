package com.boxline.billing.infrastructure.subscription;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "subscription_changes", indexes = @Index(name = "ix_subscription_changes_tenant", columnList = "tenant_id,created_at"))
public class SubscriptionChangeEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(name = "subscription_id", nullable = false, columnDefinition = "uuid")
  private UUID subscriptionId;

  @Column(name = "change_type", nullable = false, length = 32)
  private String changeType;

  @Column(name = "from_plan_id", columnDefinition = "uuid")
  private UUID fromPlanId;

  @Column(name = "to_plan_id", columnDefinition = "uuid")
  private UUID toPlanId;

  @Column(name = "from_status", length = 16)
  private String fromStatus;

  @Column(name = "to_status", length = 16)
  private String toStatus;

  @Column(name = "prorated_amount", nullable = false)
  private long proratedAmount;

  @Column(name = "effective_date", nullable = false)
  private Instant effectiveDate;

  @Column(columnDefinition = "text")
  private String reason;

  @Column(name = "triggered_by", length = 128)
  private String triggeredBy;

  @Column(name = "external_event_id", length = 255)
  private String externalEventId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public SubscriptionChangeEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public UUID getSubscriptionId() { return subscriptionId; }
  public void setSubscriptionId(UUID subscriptionId) { this.subscriptionId = subscriptionId; }

  public String getChangeType() { return changeType; }
  public void setChangeType(String changeType) { this.changeType = changeType; }

  public UUID getFromPlanId() { return fromPlanId; }
  public void setFromPlanId(UUID fromPlanId) { this.fromPlanId = fromPlanId; }

  public UUID getToPlanId() { return toPlanId; }
  public void setToPlanId(UUID toPlanId) { this.toPlanId = toPlanId; }

  public String getFromStatus() { return fromStatus; }
  public void setFromStatus(String fromStatus) { this.fromStatus = fromStatus; }

  public String getToStatus() { return toStatus; }
  public void setToStatus(String toStatus) { this.toStatus = toStatus; }

  public long getProratedAmount() { return proratedAmount; }
  public void setProratedAmount(long proratedAmount) { this.proratedAmount = proratedAmount; }

  public Instant getEffectiveDate() { return effectiveDate; }
  public void setEffectiveDate(Instant effectiveDate) { this.effectiveDate = effectiveDate; }

  public String getReason() { return reason; }
  public void setReason(String reason) { this.reason = reason; }

  public String getTriggeredBy() { return triggeredBy; }
  public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }

  public String getExternalEventId() { return externalEventId; }
  public void setExternalEventId(String externalEventId) { this.externalEventId = externalEventId; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
