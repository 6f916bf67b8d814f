package com.boxline.billing.application.events;

import com.boxline.billing.application.subscription.GatewaySubscription;
import com.boxline.billing.application.subscription.SubscriptionStateMachine;
import com.boxline.billing.application.subscription.TransitionContext;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Applies gateway subscription lifecycle events through {@link SubscriptionStateMachine#syncFromGateway}.
 *
 * {@code subscription.revoked} always lands as canceled, whatever status the payload carries.
 */
public final class SubscriptionEventHandler implements BillingEventHandler {

    static final String CREATED = "subscription.created";
    static final String UPDATED = "subscription.updated";
    static final String ACTIVE = "subscription.active";
    static final String CANCELED = "subscription.canceled";
    static final String REVOKED = "subscription.revoked";
    static final String UNCANCELED = "subscription.uncanceled";

    private final SubscriptionStateMachine stateMachine;
    private final Clock clock;

    public SubscriptionEventHandler(SubscriptionStateMachine stateMachine, Clock clock) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(CREATED, UPDATED, ACTIVE, CANCELED, REVOKED, UNCANCELED);
    }

    @Override
    public void handle(InboundEvent event, UUID tenantId) {
        JsonNode data = event.data();
        String externalId = JsonFields.text(data, "id");
        if (externalId == null) {
            throw new IllegalArgumentException("subscription event without data.id: " + event.id());
        }

        SubscriptionStatus status = GatewayStatuses.map(JsonFields.text(data, "status"));
        Instant canceledAt = JsonFields.instant(data, "canceled_at");
        boolean cancelAtPeriodEnd = JsonFields.bool(data, "cancel_at_period_end");
        if (REVOKED.equals(event.type())) {
            status = SubscriptionStatus.CANCELED;
            if (canceledAt == null) canceledAt = clock.instant();
        } else if (UNCANCELED.equals(event.type())) {
            cancelAtPeriodEnd = false;
        }

        GatewaySubscription snapshot = new GatewaySubscription(
                externalId,
                JsonFields.text(data, "customer_id"),
                JsonFields.text(data, "product_id"),
                tenantId,
                status,
                JsonFields.instant(data, "current_period_start"),
                JsonFields.instant(data, "current_period_end"),
                cancelAtPeriodEnd,
                canceledAt,
                JsonFields.number(data, "amount"),
                JsonFields.text(data, "currency"));

        stateMachine.syncFromGateway(snapshot, TransitionContext.ofEvent(event.id(), event.type()));
    }
}
