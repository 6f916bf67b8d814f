package com.boxline.billing.infrastructure.plan;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "plans",
    uniqueConstraints = @UniqueConstraint(name = "uk_plans_tier_version", columnNames = {"tier", "version"}),
    indexes = @Index(name = "ix_plans_product", columnList = "external_product_id")
)
public class PlanEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(nullable = false, length = 16)
  private String tier;

  @Column(nullable = false, length = 64)
  private String name;

  @Column(nullable = false)
  private int version;

  @Column(name = "is_current", nullable = false)
  private boolean current;

  @Column(name = "athlete_limit", nullable = false)
  private int athleteLimit;

  @Column(name = "coach_limit", nullable = false)
  private int coachLimit;

  @Column(name = "monthly_price", nullable = false)
  private long monthlyPrice;

  @Column(name = "athlete_overage_rate")
  private Long athleteOverageRate;

  @Column(name = "coach_overage_rate")
  private Long coachOverageRate;

  @Column(name = "external_product_id", length = 128)
  private String externalProductId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public PlanEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public String getTier() { return tier; }
  public void setTier(String tier) { this.tier = tier; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public int getVersion() { return version; }
  public void setVersion(int version) { this.version = version; }

  public boolean isCurrent() { return current; }
  public void setCurrent(boolean current) { this.current = current; }

  public int getAthleteLimit() { return athleteLimit; }
  public void setAthleteLimit(int athleteLimit) { this.athleteLimit = athleteLimit; }

  public int getCoachLimit() { return coachLimit; }
  public void setCoachLimit(int coachLimit) { this.coachLimit = coachLimit; }

  public long getMonthlyPrice() { return monthlyPrice; }
  public void setMonthlyPrice(long monthlyPrice) { this.monthlyPrice = monthlyPrice; }

  public Long getAthleteOverageRate() { return athleteOverageRate; }
  public void setAthleteOverageRate(Long athleteOverageRate) { this.athleteOverageRate = athleteOverageRate; }

  public Long getCoachOverageRate() { return coachOverageRate; }
  public void setCoachOverageRate(Long coachOverageRate) { this.coachOverageRate = coachOverageRate; }

  public String getExternalProductId() { return externalProductId; }
  public void setExternalProductId(String externalProductId) { this.externalProductId = externalProductId; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (id == null) id = UUID.randomUUID();
  }
}
