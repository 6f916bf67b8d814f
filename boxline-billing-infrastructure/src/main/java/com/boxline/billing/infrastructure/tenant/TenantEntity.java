package com.boxline.billing.infrastructure.tenant;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "tenants",
    uniqueConstraints = @UniqueConstraint(name = "uk_tenants_customer", columnNames = "external_customer_id")
)
public class TenantEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(nullable = false, length = 255)
  private String name;

  @Column(length = 16)
  private String tier;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(name = "subscription_status", length = 16)
  private String subscriptionStatus;

  @Column(name = "athlete_limit", nullable = false)
  private int athleteLimit;

  @Column(name = "coach_limit", nullable = false)
  private int coachLimit;

  @Column(name = "overage_enabled", nullable = false)
  private boolean overageEnabled;

  @Column(name = "next_billing_date")
  private Instant nextBillingDate;

  @Column(name = "external_customer_id", length = 128)
  private String externalCustomerId;

  @Column(name = "owner_user_id", columnDefinition = "uuid")
  private UUID ownerUserId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public TenantEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public String getTier() { return tier; }
  public void setTier(String tier) { this.tier = tier; }

  public String getStatus() { return status; }
  public void setStatus(String status) { this.status = status; }

  public String getSubscriptionStatus() { return subscriptionStatus; }
  public void setSubscriptionStatus(String subscriptionStatus) { this.subscriptionStatus = subscriptionStatus; }

  public int getAthleteLimit() { return athleteLimit; }
  public void setAthleteLimit(int athleteLimit) { this.athleteLimit = athleteLimit; }

  public int getCoachLimit() { return coachLimit; }
  public void setCoachLimit(int coachLimit) { this.coachLimit = coachLimit; }

  public boolean isOverageEnabled() { return overageEnabled; }
  public void setOverageEnabled(boolean overageEnabled) { this.overageEnabled = overageEnabled; }

  public Instant getNextBillingDate() { return nextBillingDate; }
  public void setNextBillingDate(Instant nextBillingDate) { this.nextBillingDate = nextBillingDate; }

  public String getExternalCustomerId() { return externalCustomerId; }
  public void setExternalCustomerId(String externalCustomerId) { this.externalCustomerId = externalCustomerId; }

  public UUID getOwnerUserId() { return ownerUserId; }
  public void setOwnerUserId(UUID ownerUserId) { this.ownerUserId = ownerUserId; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getUpdatedAt() { return updatedAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

  @PrePersist
  void prePersist() {
    Instant now = Instant.now();
    if (createdAt == null) createdAt = now;
    if (updatedAt == null) updatedAt = now;
    if (id == null) id = UUID.randomUUID();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
