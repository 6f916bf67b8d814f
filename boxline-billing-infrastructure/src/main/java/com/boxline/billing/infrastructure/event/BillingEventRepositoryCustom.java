package com.boxline.billing.infrastructure.event;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Claim primitives for billing events.
 *
 * Claim semantics:
 * - pending and failed rows can be claimed (status -> processing).
 * - a processing row whose last attempt is older than staleBefore can be reclaimed.
 * - processed rows are never claimed again.
 */
public interface BillingEventRepositoryCustom {

  /** INSERT ... ON CONFLICT DO NOTHING on external_id. Returns true if the row was written. */
  boolean insertIfAbsent(BillingEventEntity e);

  boolean claim(UUID id, Instant now, Instant staleBefore);

  int markProcessed(UUID id, boolean handled, UUID tenantId, Instant now);

  int markFailed(UUID id, String error, String trace, Instant nextRetryAt, Instant now);

  /** Failed rows with retries left that are due at {@code now}, oldest first. */
  List<UUID> findRetryableIds(int maxRetries, Instant now, int limit);
}
