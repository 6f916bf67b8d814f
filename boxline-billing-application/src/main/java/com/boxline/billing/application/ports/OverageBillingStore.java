package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.OverageBillingRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OverageBillingStore {

    /** Inserts unless a record for (tenant, period start, period end) exists. */
    InsertResult<OverageBillingRecord> insertIfAbsent(OverageBillingRecord record);

    Optional<OverageBillingRecord> findById(UUID id);

    Optional<OverageBillingRecord> findByTenantAndPeriod(UUID tenantId, BillingPeriod period);

    List<OverageBillingRecord> findByTenant(UUID tenantId);

    OverageBillingRecord save(OverageBillingRecord record);
}
