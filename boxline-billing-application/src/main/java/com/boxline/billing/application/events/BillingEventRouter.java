package com.boxline.billing.application.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Dispatches a deduplicated event to the handler registered for its type.
 * Unknown types are reported as not handled and never fail.
 */
public final class BillingEventRouter {

    private static final Logger log = LoggerFactory.getLogger(BillingEventRouter.class);

    private final Map<String, BillingEventHandler> handlers;
    private final TenantResolver tenantResolver;

    public BillingEventRouter(List<BillingEventHandler> handlers, TenantResolver tenantResolver) {
        this.tenantResolver = Objects.requireNonNull(tenantResolver, "tenantResolver");
        Map<String, BillingEventHandler> m = new HashMap<>();
        for (BillingEventHandler h : handlers) {
            for (String type : h.eventTypes()) {
                BillingEventHandler previous = m.put(type, h);
                if (previous != null) {
                    throw new IllegalStateException("Two handlers for event type " + type + ": "
                            + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
                }
            }
        }
        this.handlers = Collections.unmodifiableMap(m);
    }

    public RouteResult route(InboundEvent event) {
        UUID tenantId = tenantResolver.resolve(event).orElse(null);
        if (tenantId != null) {
            MDC.put(BillingEventService.MDC_TENANT_ID, tenantId.toString());
        }
        BillingEventHandler handler = handlers.get(event.type());
        if (handler == null) {
            log.info("Unhandled billing event type. eventId={} type={}", event.id(), event.type());
            return new RouteResult(false, tenantId);
        }
        handler.handle(event, tenantId);
        return new RouteResult(true, tenantId);
    }

    public Set<String> supportedTypes() {
        return handlers.keySet();
    }
}
