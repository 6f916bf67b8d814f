package com.boxline.billing.infrastructure.overage;

public interface OverageBillingRepositoryCustom {

  /** INSERT ... ON CONFLICT DO NOTHING on (tenant_id, period_start, period_end). */
  boolean insertIfAbsent(OverageBillingEntity e);
}
