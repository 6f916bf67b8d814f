package com.boxline.billing.infrastructure.grace;

import com.boxline.billing.infrastructure.persistence.NativeParams;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class GracePeriodRepositoryImpl implements GracePeriodRepositoryCustom {

  @PersistenceContext
  private EntityManager em;

  @Override
  @Transactional
  public boolean insertIfNoneUnresolved(GracePeriodEntity e) {
    Query q = em.createNativeQuery(
        "INSERT INTO grace_periods " +
            "(id, tenant_id, reason, severity, opened_at, ends_at, auto_resolve, context, resolved, auto_resolved) " +
            "VALUES (:id, :tenantId, :reason, :severity, :openedAt, :endsAt, :autoResolve, " +
            NativeParams.ref("context", e.getContext()) + ", false, false) " +
            "ON CONFLICT DO NOTHING"
    )
        .setParameter("id", e.getId())
        .setParameter("tenantId", e.getTenantId())
        .setParameter("reason", e.getReason())
        .setParameter("severity", e.getSeverity())
        .setParameter("openedAt", e.getOpenedAt())
        .setParameter("endsAt", e.getEndsAt())
        .setParameter("autoResolve", e.isAutoResolve());
    NativeParams.bind(q, "context", e.getContext());
    return q.executeUpdate() == 1;
  }
}
