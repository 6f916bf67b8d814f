package com.boxline.billing.application.events;

import java.util.Set;
import java.util.UUID;

/**
 * Handles one family of billing event types.
 */
public interface BillingEventHandler {

    Set<String> eventTypes();

    /**
     * @param tenantId resolved tenant, null when it could not be derived from the event
     * @throws RuntimeException to mark the event failed; it will be retried
     */
    void handle(InboundEvent event, UUID tenantId);
}
