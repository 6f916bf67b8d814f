package com.boxline.billing.infrastructure.subscription;

import com.boxline.billing.application.ports.SubscriptionChangeLog;
import com.boxline.billing.domain.model.SubscriptionChange;
import com.boxline.billing.domain.model.SubscriptionChangeType;
import com.boxline.billing.domain.model.SubscriptionStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class DbSubscriptionChangeLog implements SubscriptionChangeLog {

  private final SubscriptionChangeRepository changes;

  public DbSubscriptionChangeLog(SubscriptionChangeRepository changes) {
    this.changes = changes;
  }

  @Override
  public void append(SubscriptionChange c) {
    SubscriptionChangeEntity e = new SubscriptionChangeEntity();
    e.setId(c.id());
    e.setTenantId(c.tenantId());
    e.setSubscriptionId(c.subscriptionId());
    e.setChangeType(c.changeType().code());
    e.setFromPlanId(c.fromPlanId());
    e.setToPlanId(c.toPlanId());
    e.setFromStatus(c.fromStatus() == null ? null : c.fromStatus().code());
    e.setToStatus(c.toStatus() == null ? null : c.toStatus().code());
    e.setProratedAmount(c.proratedAmount());
    e.setEffectiveDate(c.effectiveDate());
    e.setReason(c.reason());
    e.setTriggeredBy(c.triggeredBy());
    e.setExternalEventId(c.externalEventId());
    e.setCreatedAt(c.createdAt());
    changes.save(e);
  }

  @Override
  public List<SubscriptionChange> findByTenant(UUID tenantId) {
    return changes.findByTenantIdOrderByCreatedAtDesc(tenantId).stream()
        .map(e -> new SubscriptionChange(
            e.getId(),
            e.getTenantId(),
            e.getSubscriptionId(),
            SubscriptionChangeType.fromCode(e.getChangeType()),
            e.getFromPlanId(),
            e.getToPlanId(),
            e.getFromStatus() == null ? null : SubscriptionStatus.fromCode(e.getFromStatus()),
            e.getToStatus() == null ? null : SubscriptionStatus.fromCode(e.getToStatus()),
            e.getProratedAmount(),
            e.getEffectiveDate(),
            e.getReason(),
            e.getTriggeredBy(),
            e.getExternalEventId(),
            e.getCreatedAt()))
        .toList();
  }
}
