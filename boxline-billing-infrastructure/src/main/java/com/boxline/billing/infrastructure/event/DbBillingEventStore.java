package com.boxline.billing.infrastructure.event;

import com.boxline.billing.application.ports.BillingEventStore;
import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.domain.model.BillingEvent;
import com.boxline.billing.domain.model.BillingEventStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: billing_events table behind {@link BillingEventStore}.
 */
@Component
public class DbBillingEventStore implements BillingEventStore {

  private final BillingEventRepository events;

  public DbBillingEventStore(BillingEventRepository events) {
    this.events = events;
  }

  @Override
  public InsertResult<BillingEvent> insertIfAbsent(BillingEvent event) {
    boolean inserted = events.insertIfAbsent(toEntity(event));
    BillingEvent stored = events.findByExternalId(event.externalId())
        .map(DbBillingEventStore::toDomain)
        .orElseThrow(() -> new IllegalStateException("billing event vanished after insert: " + event.externalId()));
    return inserted ? InsertResult.inserted(stored) : InsertResult.existing(stored);
  }

  @Override
  public Optional<BillingEvent> findByExternalId(String externalId) {
    return events.findByExternalId(externalId).map(DbBillingEventStore::toDomain);
  }

  @Override
  public Optional<BillingEvent> findById(UUID id) {
    return events.findById(id).map(DbBillingEventStore::toDomain);
  }

  @Override
  public boolean claim(UUID id, Instant now, Instant staleBefore) {
    return events.claim(id, now, staleBefore);
  }

  @Override
  public void markProcessed(UUID id, boolean handled, UUID tenantId, Instant now) {
    events.markProcessed(id, handled, tenantId, now);
  }

  @Override
  public void markFailed(UUID id, String error, String trace, Instant nextRetryAt, Instant now) {
    events.markFailed(id, error, trace, nextRetryAt, now);
  }

  @Override
  public List<BillingEvent> findRetryable(int maxRetries, Instant now, int limit) {
    List<UUID> ids = events.findRetryableIds(maxRetries, now, limit);
    List<BillingEvent> out = new ArrayList<>(ids.size());
    for (UUID id : ids) {
      events.findById(id).map(DbBillingEventStore::toDomain).ifPresent(out::add);
    }
    return out;
  }

  static BillingEvent toDomain(BillingEventEntity e) {
    return new BillingEvent(
        e.getId(),
        e.getExternalId(),
        e.getType(),
        e.getTenantId(),
        e.getPayload(),
        BillingEventStatus.fromCode(e.getStatus()),
        e.isProcessed(),
        e.getHandled(),
        e.getRetryCount(),
        e.getMaxRetries(),
        e.getLastError(),
        e.getLastErrorTrace(),
        e.getNextRetryAt(),
        e.getCreatedAt(),
        e.getLastAttemptAt(),
        e.getProcessedAt()
    );
  }

  static BillingEventEntity toEntity(BillingEvent d) {
    BillingEventEntity e = new BillingEventEntity();
    e.setId(d.id());
    e.setExternalId(d.externalId());
    e.setType(d.type());
    e.setTenantId(d.tenantId());
    e.setPayload(d.payload());
    e.setStatus(d.status().code());
    e.setProcessed(d.processed());
    e.setHandled(d.handled());
    e.setRetryCount(d.retryCount());
    e.setMaxRetries(d.maxRetries());
    e.setLastError(d.lastError());
    e.setLastErrorTrace(d.lastErrorTrace());
    e.setNextRetryAt(d.nextRetryAt());
    e.setCreatedAt(d.createdAt());
    e.setLastAttemptAt(d.lastAttemptAt());
    e.setProcessedAt(d.processedAt());
    return e;
  }
}
