package com.boxline.billing.infrastructure.membership;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of box memberships. Rows are owned by the membership service.
 */
@Entity
@Table(name = "memberships", indexes = @Index(name = "ix_memberships_tenant_role", columnList = "tenant_id,role"))
public class MembershipEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
  private UUID userId;

  @Column(nullable = false, length = 16)
  private String role;

  @Column(nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public MembershipEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public UUID getUserId() { return userId; }
  public void setUserId(UUID userId) { this.userId = userId; }

  public String getRole() { return role; }
  public void setRole(String role) { this.role = role; }

  public boolean isActive() { return active; }
  public void setActive(boolean active) { this.active = active; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (id == null) id = UUID.randomUUID();
  }
}
