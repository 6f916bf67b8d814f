package com.boxline.billing.application.events;

import java.util.UUID;

/** {@code handled=false} means no handler is registered for the event type. */
public record RouteResult(boolean handled, UUID tenantId) {
}
