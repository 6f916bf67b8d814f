package com.boxline.billing.infrastructure.usage;

import com.boxline.billing.application.ports.UsageEventStore;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.UsageEvent;
import com.boxline.billing.domain.model.UsageEventType;
import com.boxline.billing.infrastructure.json.AttributesJson;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class DbUsageEventStore implements UsageEventStore {

  private final UsageEventRepository events;
  private final AttributesJson json;

  public DbUsageEventStore(UsageEventRepository events, AttributesJson json) {
    this.events = events;
    this.json = json;
  }

  @Override
  public void appendAll(List<UsageEvent> batch) {
    if (batch == null || batch.isEmpty()) return;
    events.saveAll(batch.stream().map(this::toEntity).toList());
  }

  @Override
  public List<UsageEvent> findRecentByTenant(UUID tenantId, int limit) {
    return events.findByTenantIdOrderByCreatedAtDesc(tenantId, PageRequest.of(0, Math.max(1, limit))).stream()
        .map(e -> new UsageEvent(
            e.getId(),
            e.getTenantId(),
            UsageEventType.fromCode(e.getType()),
            e.getQuantity(),
            e.isBillable(),
            new BillingPeriod(e.getPeriodStart(), e.getPeriodEnd()),
            e.getActor(),
            json.read(e.getMetadata()),
            e.getCreatedAt()))
        .toList();
  }

  private UsageEventEntity toEntity(UsageEvent d) {
    UsageEventEntity e = new UsageEventEntity();
    e.setId(d.id());
    e.setTenantId(d.tenantId());
    e.setType(d.type().code());
    e.setQuantity(d.quantity());
    e.setBillable(d.billable());
    e.setPeriodStart(d.period().start());
    e.setPeriodEnd(d.period().end());
    e.setActor(d.actor());
    e.setMetadata(json.write(d.metadata()));
    e.setCreatedAt(d.createdAt());
    return e;
  }
}
