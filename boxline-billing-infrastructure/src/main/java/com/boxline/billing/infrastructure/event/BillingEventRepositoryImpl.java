package com.boxline.billing.infrastructure.event;

import com.boxline.billing.infrastructure.persistence.NativeParams;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public class BillingEventRepositoryImpl implements BillingEventRepositoryCustom {

  @PersistenceContext
  private EntityManager em;

  @Override
  @Transactional
  public boolean insertIfAbsent(BillingEventEntity e) {
    Query q = em.createNativeQuery(
        "INSERT INTO billing_events " +
            "(id, external_id, type, tenant_id, payload, status, processed, retry_count, max_retries, created_at) " +
            "VALUES (:id, :externalId, :type, " + NativeParams.ref("tenantId", e.getTenantId()) + ", " +
            NativeParams.ref("payload", e.getPayload()) + ", :status, false, 0, :maxRetries, :createdAt) " +
            "ON CONFLICT DO NOTHING"
    )
        .setParameter("id", e.getId())
        .setParameter("externalId", e.getExternalId())
        .setParameter("type", e.getType())
        .setParameter("status", e.getStatus())
        .setParameter("maxRetries", e.getMaxRetries())
        .setParameter("createdAt", e.getCreatedAt());
    NativeParams.bind(q, "tenantId", e.getTenantId());
    NativeParams.bind(q, "payload", e.getPayload());
    return execute(q) == 1;
  }

  @Override
  @Transactional
  public boolean claim(UUID id, Instant now, Instant staleBefore) {
    // Single statement so two concurrent deliveries cannot both win.
    int updated = execute(em.createNativeQuery(
        "UPDATE billing_events SET status = 'processing', last_attempt_at = :now " +
            "WHERE id = :id AND processed = false " +
            "AND (status IN ('pending','failed') " +
            "  OR (status = 'processing' AND (last_attempt_at IS NULL OR last_attempt_at < :staleBefore)))"
    )
        .setParameter("now", now)
        .setParameter("id", id)
        .setParameter("staleBefore", staleBefore));
    return updated == 1;
  }

  @Override
  @Transactional
  public int markProcessed(UUID id, boolean handled, UUID tenantId, Instant now) {
    String tenantSet = tenantId == null ? "" : ", tenant_id = :tenantId";
    Query q = em.createNativeQuery(
        "UPDATE billing_events SET status = 'processed', processed = true, handled = :handled, " +
            "processed_at = :now, next_retry_at = NULL" + tenantSet + " WHERE id = :id"
    )
        .setParameter("handled", handled)
        .setParameter("now", now)
        .setParameter("id", id);
    if (tenantId != null) q.setParameter("tenantId", tenantId);
    return execute(q);
  }

  @Override
  @Transactional
  public int markFailed(UUID id, String error, String trace, Instant nextRetryAt, Instant now) {
    Query q = em.createNativeQuery(
        "UPDATE billing_events SET status = 'failed', retry_count = retry_count + 1, " +
            "last_error = " + NativeParams.ref("error", error) +
            ", last_error_trace = " + NativeParams.ref("trace", trace) +
            ", next_retry_at = " + NativeParams.ref("nextRetryAt", nextRetryAt) + ", " +
            "last_attempt_at = :now WHERE id = :id AND processed = false"
    )
        .setParameter("id", id)
        .setParameter("now", now);
    NativeParams.bind(q, "error", error);
    NativeParams.bind(q, "trace", trace);
    NativeParams.bind(q, "nextRetryAt", nextRetryAt);
    return execute(q);
  }

  @Override
  @Transactional(readOnly = true)
  public List<UUID> findRetryableIds(int maxRetries, Instant now, int limit) {
    return em.createNativeQuery(
        "SELECT id FROM billing_events " +
            "WHERE status = 'failed' AND processed = false " +
            "AND retry_count < :maxRetries " +
            "AND (next_retry_at IS NULL OR next_retry_at <= :now) " +
            "ORDER BY created_at ASC " +
            "LIMIT :limit"
    )
        .setParameter("maxRetries", maxRetries)
        .setParameter("now", now)
        .setParameter("limit", limit)
        .getResultList();
  }

  // Pending changes are flushed before a native statement runs; clearing afterwards keeps
  // later reads in the same transaction from returning the pre-update entity.
  private int execute(Query q) {
    int n = q.executeUpdate();
    em.clear();
    return n;
  }
}
