package com.boxline.billing.infrastructure.grace;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The "one unresolved period per (tenant, reason)" rule is a partial unique index in the
 * migration; JPA cannot declare it.
 */
@Entity
@Table(name = "grace_periods", indexes = @Index(name = "ix_grace_periods_tenant_reason", columnList = "tenant_id,reason"))
public class GracePeriodEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(nullable = false, length = 32)
  private String reason;

  @Column(nullable = false, length = 16)
  private String severity;

  @Column(name = "opened_at", nullable = false)
  private Instant openedAt;

  @Column(name = "ends_at", nullable = false)
  private Instant endsAt;

  @Column(name = "auto_resolve", nullable = false)
  private boolean autoResolve;

  @Column(columnDefinition = "text")
  private String context;

  @Column(nullable = false)
  private boolean resolved;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(columnDefinition = "text")
  private String resolution;

  @Column(name = "resolved_by", length = 128)
  private String resolvedBy;

  @Column(name = "auto_resolved", nullable = false)
  private boolean autoResolved;

  public GracePeriodEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public String getReason() { return reason; }
  public void setReason(String reason) { this.reason = reason; }

  public String getSeverity() { return severity; }
  public void setSeverity(String severity) { this.severity = severity; }

  public Instant getOpenedAt() { return openedAt; }
  public void setOpenedAt(Instant openedAt) { this.openedAt = openedAt; }

  public Instant getEndsAt() { return endsAt; }
  public void setEndsAt(Instant endsAt) { this.endsAt = endsAt; }

  public boolean isAutoResolve() { return autoResolve; }
  public void setAutoResolve(boolean autoResolve) { this.autoResolve = autoResolve; }

  public String getContext() { return context; }
  public void setContext(String context) { this.context = context; }

  public boolean isResolved() { return resolved; }
  public void setResolved(boolean resolved) { this.resolved = resolved; }

  public Instant getResolvedAt() { return resolvedAt; }
  public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }

  public String getResolution() { return resolution; }
  public void setResolution(String resolution) { this.resolution = resolution; }

  public String getResolvedBy() { return resolvedBy; }
  public void setResolvedBy(String resolvedBy) { this.resolvedBy = resolvedBy; }

  public boolean isAutoResolved() { return autoResolved; }
  public void setAutoResolved(boolean autoResolved) { this.autoResolved = autoResolved; }
}
