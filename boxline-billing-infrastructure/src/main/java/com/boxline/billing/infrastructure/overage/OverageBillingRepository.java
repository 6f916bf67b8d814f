package com.boxline.billing.infrastructure.overage;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OverageBillingRepository
    extends JpaRepository<OverageBillingEntity, UUID>, OverageBillingRepositoryCustom {

  Optional<OverageBillingEntity> findByTenantIdAndPeriodStartAndPeriodEnd(UUID tenantId, Instant periodStart,
                                                                         Instant periodEnd);

  List<OverageBillingEntity> findByTenantIdOrderByPeriodStartDesc(UUID tenantId);
}
