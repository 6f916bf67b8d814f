package com.boxline.billing.application.events;

import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.subscription.SubscriptionStateMachine;
import com.boxline.billing.application.subscription.TransitionContext;
import com.boxline.billing.application.subscription.TransitionResult;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Payment outcomes.
 *
 * Payments for overage orders carry {@code metadata.overageBillingId} and settle the overage record.
 * Any other payment moves the tenant's subscription (paid to active, failed to past_due).
 */
public final class PaymentEventHandler implements BillingEventHandler {

    private static final Logger log = LoggerFactory.getLogger(PaymentEventHandler.class);

    static final String ORDER_PAID = "order.paid";
    static final String INVOICE_PAID = "invoice.paid";
    static final String INVOICE_PAYMENT_FAILED = "invoice.payment_failed";
    static final String ORDER_PAYMENT_FAILED = "order.payment_failed";

    private final SubscriptionStateMachine stateMachine;
    private final OverageBillingEngine overage;

    public PaymentEventHandler(SubscriptionStateMachine stateMachine, OverageBillingEngine overage) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.overage = Objects.requireNonNull(overage, "overage");
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(ORDER_PAID, INVOICE_PAID, INVOICE_PAYMENT_FAILED, ORDER_PAYMENT_FAILED);
    }

    @Override
    public void handle(InboundEvent event, UUID tenantId) {
        boolean paid = ORDER_PAID.equals(event.type()) || INVOICE_PAID.equals(event.type());
        JsonNode data = event.data();

        UUID overageBillingId = JsonFields.uuid(JsonFields.object(data, "metadata"), "overageBillingId");
        if (overageBillingId != null) {
            String invoiceId = JsonFields.firstText(data, "invoice_id", "id");
            if (paid) {
                overage.markOverageAsPaid(overageBillingId, invoiceId).orElseThrow();
            } else {
                String reason = JsonFields.firstText(data, "failure_reason", "status");
                overage.markOverageAsFailed(overageBillingId, reason == null ? "payment_failed" : reason).orElseThrow();
            }
            return;
        }

        if (tenantId == null) {
            throw NotFoundException.of("tenant for event", event.id());
        }
        SubscriptionStatus target = paid ? SubscriptionStatus.ACTIVE : SubscriptionStatus.PAST_DUE;
        TransitionResult result = stateMachine.transition(tenantId, target,
                TransitionContext.ofEvent(event.id(), event.type()));
        if (!result.success()) {
            log.info("Payment event without live subscription. tenantId={} eventId={} type={}",
                    tenantId, event.id(), event.type());
        }
    }
}
