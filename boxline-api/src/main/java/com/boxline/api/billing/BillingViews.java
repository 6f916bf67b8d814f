package com.boxline.api.billing;

import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.UsageEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shapes for domain values whose records do not serialize as-is (attribute maps, nullable
 * timestamps that clients expect as ISO strings).
 */
final class BillingViews {

  private BillingViews() {}

  static Map<String, Object> subscription(Subscription s) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", s.id());
    m.put("tenantId", s.tenantId());
    m.put("planId", s.planId());
    m.put("status", s.status().code());
    m.put("currentPeriodStart", iso(s.currentPeriodStart()));
    m.put("currentPeriodEnd", iso(s.currentPeriodEnd()));
    m.put("cancelAtPeriodEnd", s.cancelAtPeriodEnd());
    m.put("canceledAt", iso(s.canceledAt()));
    m.put("cancelReason", s.cancelReason());
    m.put("amount", s.amount());
    m.put("currency", s.currency());
    m.put("externalSubscriptionId", s.externalSubscriptionId());
    return m;
  }

  static Map<String, Object> gracePeriod(GracePeriod gp) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", gp.id());
    m.put("tenantId", gp.tenantId());
    m.put("reason", gp.reason().code());
    m.put("severity", gp.severity().code());
    m.put("openedAt", iso(gp.openedAt()));
    m.put("endsAt", iso(gp.endsAt()));
    m.put("autoResolve", gp.autoResolve());
    m.put("context", gp.context().asMap());
    m.put("resolved", gp.resolved());
    m.put("resolvedAt", iso(gp.resolvedAt()));
    m.put("resolution", gp.resolution());
    m.put("resolvedBy", gp.resolvedBy());
    m.put("autoResolved", gp.autoResolved());
    return m;
  }

  static Map<String, Object> usageEvent(UsageEvent e) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", e.id());
    m.put("type", e.type().code());
    m.put("quantity", e.quantity());
    m.put("billable", e.billable());
    m.put("periodStart", iso(e.period().start()));
    m.put("periodEnd", iso(e.period().end()));
    m.put("actor", e.actor());
    m.put("metadata", e.metadata().asMap());
    m.put("createdAt", iso(e.createdAt()));
    return m;
  }

  private static String iso(Instant t) {
    return t == null ? null : t.toString();
  }
}
