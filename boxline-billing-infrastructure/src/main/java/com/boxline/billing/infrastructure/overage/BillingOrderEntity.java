package com.boxline.billing.infrastructure.overage;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "billing_orders")
public class BillingOrderEntity {

  @Id
  @Column(columnDefinition = "uuid")
  private UUID id;

  @Column(name = "tenant_id", nullable = false, columnDefinition = "uuid")
  private UUID tenantId;

  @Column(nullable = false, length = 32)
  private String type;

  @Column(nullable = false, length = 16)
  private String status;

  @Column(nullable = false)
  private long amount;

  @Column(nullable = false, length = 8)
  private String currency;

  @Column(columnDefinition = "text")
  private String description;

  @Column(name = "overage_billing_id", columnDefinition = "uuid")
  private UUID overageBillingId;

  @Column(name = "external_invoice_id", length = 128)
  private String externalInvoiceId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "paid_at")
  private Instant paidAt;

  public BillingOrderEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getTenantId() { return tenantId; }
  public void setTenantId(UUID tenantId) { this.tenantId = tenantId; }

  public String getType() { return type; }
  public void setType(String type) { this.type = type; }

  public String getStatus() { return status; }
  public void setStatus(String status) { this.status = status; }

  public long getAmount() { return amount; }
  public void setAmount(long amount) { this.amount = amount; }

  public String getCurrency() { return currency; }
  public void setCurrency(String currency) { this.currency = currency; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public UUID getOverageBillingId() { return overageBillingId; }
  public void setOverageBillingId(UUID overageBillingId) { this.overageBillingId = overageBillingId; }

  public String getExternalInvoiceId() { return externalInvoiceId; }
  public void setExternalInvoiceId(String externalInvoiceId) { this.externalInvoiceId = externalInvoiceId; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getPaidAt() { return paidAt; }
  public void setPaidAt(Instant paidAt) { this.paidAt = paidAt; }
}
