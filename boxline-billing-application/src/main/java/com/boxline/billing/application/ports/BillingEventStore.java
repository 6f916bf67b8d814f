package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.BillingEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BillingEventStore {

    /** Inserts unless a record with the same external id exists, in which case that record is returned. */
    InsertResult<BillingEvent> insertIfAbsent(BillingEvent event);

    Optional<BillingEvent> findByExternalId(String externalId);

    Optional<BillingEvent> findById(UUID id);

    /**
     * Moves a pending or failed event (or one stuck in processing since before {@code staleBefore})
     * to processing. Returns false when another caller owns it or it is already processed.
     */
    boolean claim(UUID id, Instant now, Instant staleBefore);

    void markProcessed(UUID id, boolean handled, UUID tenantId, Instant now);

    /** Sets status failed and increments the retry count. */
    void markFailed(UUID id, String error, String trace, Instant nextRetryAt, Instant now);

    /** Failed events with {@code retryCount < maxRetries} due at {@code now}, oldest first. */
    List<BillingEvent> findRetryable(int maxRetries, Instant now, int limit);
}
