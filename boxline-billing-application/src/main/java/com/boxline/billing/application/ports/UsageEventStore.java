package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.UsageEvent;

import java.util.List;
import java.util.UUID;

/** Append-only. */
public interface UsageEventStore {

    void appendAll(List<UsageEvent> events);

    List<UsageEvent> findRecentByTenant(UUID tenantId, int limit);
}
