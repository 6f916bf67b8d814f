package com.boxline.billing.infrastructure.event;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "billing_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_billing_events_external", columnNames = "external_id"),
    indexes = @Index(name = "ix_billing_events_retry", columnList = "status,next_retry_at")
)
public class BillingEventEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "external_id", nullable = false, length = 255)
  private String externalId;

  @Column(nullable = false, length = 128)
  private String type;

  @Column(name = "tenant_id", columnDefinition = "uuid")
  private UUID tenantId;

  @Column(columnDefinition = "text")
  private String payload;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(nullable = false)
  private boolean processed;

  @Column
  private Boolean handled;

  @Column(name = "retry_count", nullable = false)
  private int retryCount;

  @Column(name = "max_retries", nullable = false)
  private int maxRetries;

  @Column(name = "last_error", columnDefinition = "text")
  private String lastError;

  @Column(name = "last_error_trace", columnDefinition = "text")
  private String lastErrorTrace;

  @Column(name = "next_retry_at")
  private Instant nextRetryAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "last_attempt_at")
  private Instant lastAttemptAt;

  @Column(name = "processed_at")
  private Instant processedAt;

  public BillingEventEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public String getExternalId() { return externalId; }
  public void setExternalId(String externalId) { this.externalId = externalId; }

  public String getType() { return type; }
  public void setType(String type) { this.type = type; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public String getPayload() { return payload; }
  public void setPayload(String payload) { this.payload = payload; }

  public String getStatus() { return status; }
  public void setStatus(String status) { this.status = status; }

  public boolean isProcessed() { return processed; }
  public void setProcessed(boolean processed) { this.processed = processed; }

  public Boolean getHandled() { return handled; }
  public void setHandled(Boolean handled) { this.handled = handled; }

  public int getRetryCount() { return retryCount; }
  public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

  public int getMaxRetries() { return maxRetries; }
  public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

  public String getLastError() { return lastError; }
  public void setLastError(String lastError) { this.lastError = lastError; }

  public String getLastErrorTrace() { return lastErrorTrace; }
  public void setLastErrorTrace(String lastErrorTrace) { this.lastErrorTrace = lastErrorTrace; }

  public Instant getNextRetryAt() { return nextRetryAt; }
  public void setNextRetryAt(Instant nextRetryAt) { this.nextRetryAt = nextRetryAt; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getLastAttemptAt() { return lastAttemptAt; }
  public void setLastAttemptAt(Instant lastAttemptAt) { this.lastAttemptAt = lastAttemptAt; }

  public Instant getProcessedAt() { return processedAt; }
  public void setProcessedAt(Instant processedAt) { this.processedAt = processedAt; }
}
