package com.boxline.billing.application.events;

import com.boxline.billing.application.subscription.SubscriptionStateMachine;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/** {@code trial.expired}: a trial that is no longer in trial is a stale event and is ignored. */
public final class TrialEventHandler implements BillingEventHandler {

    private static final Logger log = LoggerFactory.getLogger(TrialEventHandler.class);

    static final String TRIAL_EXPIRED = "trial.expired";

    private final SubscriptionStateMachine stateMachine;

    public TrialEventHandler(SubscriptionStateMachine stateMachine) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(TRIAL_EXPIRED);
    }

    @Override
    public void handle(InboundEvent event, UUID tenantId) {
        if (tenantId == null) {
            throw NotFoundException.of("tenant for event", event.id());
        }
        BillingOutcome<Subscription> outcome = stateMachine.expireTrial(tenantId);
        if (!outcome.isOk()) {
            log.info("Trial expiry ignored. tenantId={} eventId={} reason={}", tenantId, event.id(), outcome.message());
        }
    }
}
