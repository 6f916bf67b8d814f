package com.boxline.billing.infrastructure.planchange;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "plan_change_requests", indexes = @Index(name = "ix_plan_change_requests_tenant", columnList = "tenant_id,status"))
public class PlanChangeRequestEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(name = "subscription_id", columnDefinition = "uuid")
  private UUID subscriptionId;

  @Column(name = "from_plan_id", columnDefinition = "uuid")
  private UUID fromPlanId;

  @Column(name = "to_plan_id", nullable = false, columnDefinition = "uuid")
  private UUID toPlanId;

  @Column(name = "change_type", nullable = false, length = 16)
  private String changeType;

  @Column(name = "proration_type", nullable = false, length = 32)
  private String prorationType;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(name = "requested_effective_date")
  private Instant requestedEffectiveDate;

  @Column(name = "requested_by", length = 128)
  private String requestedBy;

  @Column(name = "requested_at", nullable = false)
  private Instant requestedAt;

  @Column(name = "decided_by", length = 128)
  private String decidedBy;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "prorated_amount")
  private Long proratedAmount;

  @Column(name = "cancel_reason", columnDefinition = "text")
  private String cancelReason;

  public PlanChangeRequestEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public UUID getSubscriptionId() { return subscriptionId; }
  public void setSubscriptionId(UUID subscriptionId) { this.subscriptionId = subscriptionId; }

  public UUID getFromPlanId() { return fromPlanId; }
  public void setFromPlanId(UUID fromPlanId) { this.fromPlanId = fromPlanId; }

  public UUID getToPlanId() { return toPlanId; }
  public void setToPlanId(UUID toPlanId) { this.toPlanId = toPlanId; }

  public String getChangeType() { return changeType; }
  public void setChangeType(String changeType) { this.changeType = changeType; }

  public String getProrationType() { return prorationType; }
  public void setProrationType(String prorationType) { this.prorationType = prorationType; }

  public String getStatus() { return status; }
  public void setStatus(String status) { this.status = status; }

  public Instant getRequestedEffectiveDate() { return requestedEffectiveDate; }
  public void setRequestedEffectiveDate(Instant requestedEffectiveDate) { this.requestedEffectiveDate = requestedEffectiveDate; }

  public String getRequestedBy() { return requestedBy; }
  public void setRequestedBy(String requestedBy) { this.requestedBy = requestedBy; }

  public Instant getRequestedAt() { return requestedAt; }
  public void setRequestedAt(Instant requestedAt) { this.requestedAt = requestedAt; }

  public String getDecidedBy() { return decidedBy; }
  public void setDecidedBy(String decidedBy) { this.decidedBy = decidedBy; }

  public Instant getDecidedAt() { return decidedAt; }
  public void setDecidedAt(Instant decidedAt) { this.decidedAt = decidedAt; }

  public Long getProratedAmount() { return proratedAmount; }
  public void setProratedAmount(Long proratedAmount) { this.proratedAmount = proratedAmount; }

  public String getCancelReason() { return cancelReason; }
  public void setCancelReason(String cancelReason) { this.cancelReason = cancelReason; }
}
