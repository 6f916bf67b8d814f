package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GracePeriodStore {

    Optional<GracePeriod> findById(UUID id);

    /** The unresolved period for (tenant, reason), expired or not. */
    Optional<GracePeriod> findUnresolved(UUID tenantId, GraceReason reason);

    /**
     * Inserts unless an unresolved period for the same (tenant, reason) exists; the existing one is
     * returned in that case.
     */
    InsertResult<GracePeriod> insertIfNoneUnresolved(GracePeriod gracePeriod);

    /** Persists resolution fields. Returns false if the period was already resolved. */
    boolean markResolved(GracePeriod resolved);

    List<GracePeriod> findUnresolvedByTenant(UUID tenantId, Collection<GraceReason> reasons);

    List<GracePeriod> findUnresolvedEndingBetween(Instant from, Instant to);

    List<GracePeriod> findExpiredAutoResolvable(Instant now, int limit);

    List<GracePeriod> findByTenant(UUID tenantId);
}
