package com.boxline.billing.infrastructure.usage;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "usage_events", indexes = @Index(name = "ix_usage_events_tenant_created", columnList = "tenant_id,created_at"))
public class UsageEventEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(nullable = false, length = 32)
  private String type;

  @Column(nullable = false)
  private int quantity;

  @Column(nullable = false)
  private boolean billable;

  @Column(name = "period_start", nullable = false)
  private Instant periodStart;

  @Column(name = "period_end", nullable = false)
  private Instant periodEnd;

  @Column(length = 128)
  private String actor;

  @Column(columnDefinition = "text")
  private String metadata;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public UsageEventEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public String getType() { return type; }
  public void setType(String type) { this.type = type; }

  public int getQuantity() { return quantity; }
  public void setQuantity(int quantity) { this.quantity = quantity; }

  public boolean isBillable() { return billable; }
  public void setBillable(boolean billable) { this.billable = billable; }

  public Instant getPeriodStart() { return periodStart; }
  public void setPeriodStart(Instant periodStart) { this.periodStart = periodStart; }

  public Instant getPeriodEnd() { return periodEnd; }
  public void setPeriodEnd(Instant periodEnd) { this.periodEnd = periodEnd; }

  public String getActor() { return actor; }
  public void setActor(String actor) { this.actor = actor; }

  public String getMetadata() { return metadata; }
  public void setMetadata(String metadata) { this.metadata = metadata; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
