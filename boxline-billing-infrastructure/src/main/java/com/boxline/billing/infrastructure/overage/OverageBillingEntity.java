package com.boxline.billing.infrastructure.overage;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "overage_billing",
    uniqueConstraints = @UniqueConstraint(name = "uk_overage_billing_period", columnNames = {"tenant_id", "period_start", "period_end"})
)
public class OverageBillingEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(name = "subscription_id", columnDefinition = "uuid")
  private UUID subscriptionId;

  @Column(name = "period_start", nullable = false)
  private Instant periodStart;

  @Column(name = "period_end", nullable = false)
  private Instant periodEnd;

  @Column(name = "athlete_count", nullable = false)
  private int athleteCount;

  @Column(name = "athlete_limit", nullable = false)
  private int athleteLimit;

  @Column(name = "athlete_overage", nullable = false)
  private int athleteOverage;

  @Column(name = "athlete_rate", nullable = false)
  private long athleteRate;

  @Column(name = "athlete_amount", nullable = false)
  private long athleteAmount;

  @Column(name = "coach_count", nullable = false)
  private int coachCount;

  @Column(name = "coach_limit", nullable = false)
  private int coachLimit;

  @Column(name = "coach_overage", nullable = false)
  private int coachOverage;

  @Column(name = "coach_rate", nullable = false)
  private long coachRate;

  @Column(name = "coach_amount", nullable = false)
  private long coachAmount;

  @Column(name = "total_amount", nullable = false)
  private long totalAmount;

  @Column(nullable = false, length = 8)
  private String currency;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(name = "order_id", columnDefinition = "uuid")
  private UUID orderId;

  @Column(name = "external_invoice_id", length = 128)
  private String externalInvoiceId;

  @Column(name = "failure_reason", columnDefinition = "text")
  private String failureReason;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "paid_at")
  private Instant paidAt;

  public OverageBillingEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public UUID getSubscriptionId() { return subscriptionId; }
  public void setSubscriptionId(UUID subscriptionId) { this.subscriptionId = subscriptionId; }

  public Instant getPeriodStart() { return periodStart; }
  public void setPeriodStart(Instant periodStart) { this.periodStart = periodStart; }

  public Instant getPeriodEnd() { return periodEnd; }
  public void setPeriodEnd(Instant periodEnd) { this.periodEnd = periodEnd; }

  public int getAthleteCount() { return athleteCount; }
  public void setAthleteCount(int athleteCount) { this.athleteCount = athleteCount; }

  public int getAthleteLimit() { return athleteLimit; }
  public void setAthleteLimit(int athleteLimit) { this.athleteLimit = athleteLimit; }

  public int getAthleteOverage() { return athleteOverage; }
  public void setAthleteOverage(int athleteOverage) { this.athleteOverage = athleteOverage; }

  public long getAthleteRate() { return athleteRate; }
  public void setAthleteRate(long athleteRate) { this.athleteRate = athleteRate; }

  public long getAthleteAmount() { return athleteAmount; }
  public void setAthleteAmount(long athleteAmount) { this.athleteAmount = athleteAmount; }

  public int getCoachCount() { return coachCount; }
  public void setCoachCount(int coachCount) { this.coachCount = coachCount; }

  public int getCoachLimit() { return coachLimit; }
  public void setCoachLimit(int coachLimit) { this.coachLimit = coachLimit; }

  public int getCoachOverage() { return coachOverage; }
  public void setCoachOverage(int coachOverage) { this.coachOverage = coachOverage; }

  public long getCoachRate() { return coachRate; }
  public void setCoachRate(long coachRate) { this.coachRate = coachRate; }

  public long getCoachAmount() { return coachAmount; }
  public void setCoachAmount(long coachAmount) { this.coachAmount = coachAmount; }

  public long getTotalAmount() { return totalAmount; }
  public void setTotalAmount(long totalAmount) { this.totalAmount = totalAmount; }

  public String getCurrency() { return currency; }
  public void setCurrency(String currency) { this.currency = currency; }

  public String getStatus() { return status; }
  public void setStatus(String status) { this.status = status; }

  public UUID getOrderId() { return orderId; }
  public void setOrderId(UUID orderId) { this.orderId = orderId; }

  public String getExternalInvoiceId() { return externalInvoiceId; }
  public void setExternalInvoiceId(String externalInvoiceId) { this.externalInvoiceId = externalInvoiceId; }

  public String getFailureReason() { return failureReason; }
  public void setFailureReason(String failureReason) { this.failureReason = failureReason; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getPaidAt() { return paidAt; }
  public void setPaidAt(Instant paidAt) { this.paidAt = paidAt; }
}
