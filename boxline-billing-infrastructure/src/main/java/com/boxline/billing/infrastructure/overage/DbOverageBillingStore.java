package com.boxline.billing.infrastructure.overage;

import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.application.ports.OverageBillingStore;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.OverageBillingRecord;
import com.boxline.billing.domain.model.OverageStatus;
import com.boxline.billing.domain.model.RoleOverage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: overage_billing table behind {@link OverageBillingStore}.
 */
@Component
public class DbOverageBillingStore implements OverageBillingStore {

  private final OverageBillingRepository records;

  public DbOverageBillingStore(OverageBillingRepository records) {
    this.records = records;
  }

  @Override
  public InsertResult<OverageBillingRecord> insertIfAbsent(OverageBillingRecord record) {
    boolean inserted = records.insertIfAbsent(toEntity(record));
    OverageBillingRecord stored = findByTenantAndPeriod(record.tenantId(), record.period())
        .orElseThrow(() -> new IllegalStateException("overage record vanished after insert: tenantId="
            + record.tenantId() + " period=" + record.period()));
    return inserted ? InsertResult.inserted(stored) : InsertResult.existing(stored);
  }

  @Override
  public Optional<OverageBillingRecord> findById(UUID id) {
    return records.findById(id).map(DbOverageBillingStore::toDomain);
  }

  @Override
  public Optional<OverageBillingRecord> findByTenantAndPeriod(UUID tenantId, BillingPeriod period) {
    return records.findByTenantIdAndPeriodStartAndPeriodEnd(tenantId, period.start(), period.end())
        .map(DbOverageBillingStore::toDomain);
  }

  @Override
  public List<OverageBillingRecord> findByTenant(UUID tenantId) {
    return records.findByTenantIdOrderByPeriodStartDesc(tenantId).stream()
        .map(DbOverageBillingStore::toDomain)
        .toList();
  }

  @Override
  public OverageBillingRecord save(OverageBillingRecord record) {
    return toDomain(records.saveAndFlush(toEntity(record)));
  }

  static OverageBillingRecord toDomain(OverageBillingEntity e) {
    return new OverageBillingRecord(
        e.getId(),
        e.getTenantId(),
        e.getSubscriptionId(),
        new BillingPeriod(e.getPeriodStart(), e.getPeriodEnd()),
        new RoleOverage(e.getAthleteCount(), e.getAthleteLimit(), e.getAthleteOverage(), e.getAthleteRate(),
            e.getAthleteAmount()),
        new RoleOverage(e.getCoachCount(), e.getCoachLimit(), e.getCoachOverage(), e.getCoachRate(),
            e.getCoachAmount()),
        e.getTotalAmount(),
        e.getCurrency(),
        OverageStatus.fromCode(e.getStatus()),
        e.getOrderId(),
        e.getExternalInvoiceId(),
        e.getFailureReason(),
        e.getCreatedAt(),
        e.getPaidAt()
    );
  }

  static OverageBillingEntity toEntity(OverageBillingRecord d) {
    OverageBillingEntity e = new OverageBillingEntity();
    e.setId(d.id());
    e.setTenantId(d.tenantId());
    e.setSubscriptionId(d.subscriptionId());
    e.setPeriodStart(d.period().start());
    e.setPeriodEnd(d.period().end());
    RoleOverage a = d.athletes() == null ? new RoleOverage(0, 0, 0, 0, 0) : d.athletes();
    e.setAthleteCount(a.count());
    e.setAthleteLimit(a.limit());
    e.setAthleteOverage(a.overage());
    e.setAthleteRate(a.rate());
    e.setAthleteAmount(a.amount());
    RoleOverage c = d.coaches() == null ? new RoleOverage(0, 0, 0, 0, 0) : d.coaches();
    e.setCoachCount(c.count());
    e.setCoachLimit(c.limit());
    e.setCoachOverage(c.overage());
    e.setCoachRate(c.rate());
    e.setCoachAmount(c.amount());
    e.setTotalAmount(d.totalAmount());
    e.setCurrency(d.currency());
    e.setStatus(d.status().code());
    e.setOrderId(d.orderId());
    e.setExternalInvoiceId(d.externalInvoiceId());
    e.setFailureReason(d.failureReason());
    e.setCreatedAt(d.createdAt());
    e.setPaidAt(d.paidAt());
    return e;
  }
}
