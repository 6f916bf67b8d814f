package com.boxline.billing.application.planchange;

import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.application.ports.PlanCatalog;
import com.boxline.billing.application.ports.PlanChangeRequestStore;
import com.boxline.billing.application.ports.SubscriptionChangeLog;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.application.ports.UnitOfWork;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.InvalidStateException;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.PlanChangeStatus;
import com.boxline.billing.domain.model.PlanChangeType;
import com.boxline.billing.domain.model.ProrationType;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionChange;
import com.boxline.billing.domain.model.UsageEventDraft;
import com.boxline.billing.domain.model.UsageEventType;
import com.boxline.billing.domain.pricing.Proration;
import com.boxline.billing.domain.pricing.ProrationCalculator;
import com.boxline.billing.domain.usage.SeatLimits;
import com.boxline.billing.domain.usage.UsageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Plan change requests: request, approve (with proration), cancel.
 *
 * Approval is a single unit of work: request status, subscription plan, tenant tier and limits,
 * and the audit record either all change or none do. The pending -> approved step is a
 * compare-and-set, so a request can be approved once even under concurrent approvers.
 */
public final class PlanChangeWorkflow {

    private static final Logger log = LoggerFactory.getLogger(PlanChangeWorkflow.class);

    static final String RESOLUTION_PLAN_UPGRADED = "plan_upgraded";
    static final String RESOLUTION_PLAN_DOWNGRADED = "plan_downgraded";
    static final String RESOLUTION_PLAN_CHANGED = "plan_changed";

    private final PlanChangeRequestStore requests;
    private final SubscriptionStore subscriptions;
    private final PlanCatalog plans;
    private final TenantStore tenants;
    private final SubscriptionChangeLog changeLog;
    private final UsageLedger usage;
    private final GracePeriodManager gracePeriods;
    private final PaymentGatewayPort gateway;
    private final BillingNotifier notifier;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public PlanChangeWorkflow(
            PlanChangeRequestStore requests,
            SubscriptionStore subscriptions,
            PlanCatalog plans,
            TenantStore tenants,
            SubscriptionChangeLog changeLog,
            UsageLedger usage,
            GracePeriodManager gracePeriods,
            PaymentGatewayPort gateway,
            BillingNotifier notifier,
            UnitOfWork unitOfWork,
            Clock clock
    ) {
        this.requests = Objects.requireNonNull(requests, "requests");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.plans = Objects.requireNonNull(plans, "plans");
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.changeLog = Objects.requireNonNull(changeLog, "changeLog");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.gracePeriods = Objects.requireNonNull(gracePeriods, "gracePeriods");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BillingOutcome<PlanChangeRequest> requestChange(
            UUID tenantId,
            UUID toPlanId,
            String actor,
            Instant effectiveDate,
            ProrationType prorationType
    ) {
        Optional<Subscription> active = subscriptions.findActiveByTenant(tenantId);
        if (active.isEmpty()) {
            return BillingOutcome.notFound("No active subscription found");
        }
        Optional<Plan> target = plans.findById(toPlanId);
        if (target.isEmpty()) {
            return BillingOutcome.notFound("Target plan not found: " + toPlanId);
        }
        Subscription sub = active.get();
        if (toPlanId.equals(sub.planId())) {
            return BillingOutcome.invalidState("Subscription is already on plan " + toPlanId);
        }

        long fromPrice = plans.findById(sub.planId()).map(Plan::monthlyPrice).orElse(sub.amount());
        PlanChangeType type = PlanChangeType.classify(fromPrice, target.get().monthlyPrice());
        Instant now = clock.instant();

        PlanChangeRequest request = requests.insert(new PlanChangeRequest(
                UUID.randomUUID(),
                tenantId,
                sub.id(),
                sub.planId(),
                toPlanId,
                type,
                prorationType == null ? ProrationType.IMMEDIATE : prorationType,
                PlanChangeStatus.PENDING,
                effectiveDate,
                actor,
                now,
                null,
                null,
                null,
                null
        ));
        log.info("Plan change requested. tenantId={} requestId={} type={} from={} to={}",
                tenantId, request.id(), type.code(), sub.planId(), toPlanId);
        return BillingOutcome.ok(request);
    }

    /**
     * Approves a pending request and applies it.
     */
    public BillingOutcome<PlanChangeResult> processRequest(UUID requestId, String approver) {
        Optional<PlanChangeRequest> found = requests.findById(requestId);
        if (found.isEmpty()) {
            return BillingOutcome.notFound("Plan change request not found: " + requestId);
        }
        PlanChangeRequest request = found.get();
        if (!request.isPending()) {
            return BillingOutcome.invalidState("Plan change request is " + request.status().code());
        }
        Optional<Subscription> subscription = request.subscriptionId() == null
                ? Optional.empty()
                : subscriptions.findById(request.subscriptionId()).filter(Subscription::isActive);
        if (subscription.isEmpty()) {
            return BillingOutcome.notFound("No active subscription found");
        }
        Optional<Plan> target = plans.findById(request.toPlanId());
        if (target.isEmpty()) {
            return BillingOutcome.notFound("Target plan not found: " + request.toPlanId());
        }

        Subscription sub = subscription.get();
        Plan newPlan = target.get();
        long currentPrice = plans.findById(sub.planId()).map(Plan::monthlyPrice).orElse(sub.amount());

        if (sub.externalSubscriptionId() != null && newPlan.externalProductId() != null) {
            gateway.updateSubscription(sub.externalSubscriptionId(), newPlan.externalProductId(),
                    request.prorationType() == ProrationType.IMMEDIATE);
        }

        try {
            PlanChangeResult result = unitOfWork.inTransaction(() -> apply(request, sub, newPlan, currentPrice, approver));
            notifier.planChanged(result.request(), newPlan.name());
            return BillingOutcome.ok(result);
        } catch (InvalidStateException e) {
            return BillingOutcome.invalidState(e.getMessage());
        }
    }

    public BillingOutcome<PlanChangeRequest> cancelRequest(UUID requestId, String actor, String reason) {
        Optional<PlanChangeRequest> found = requests.findById(requestId);
        if (found.isEmpty()) {
            return BillingOutcome.notFound("Plan change request not found: " + requestId);
        }
        PlanChangeRequest request = found.get();
        if (!request.isPending()) {
            return BillingOutcome.invalidState("Plan change request is " + request.status().code());
        }
        PlanChangeRequest canceled = request.canceled(actor, reason, clock.instant());
        if (!requests.transition(PlanChangeStatus.PENDING, canceled)) {
            return BillingOutcome.invalidState("Plan change request is no longer pending");
        }
        log.info("Plan change canceled. requestId={} actor={}", requestId, actor);
        return BillingOutcome.ok(canceled);
    }

    public List<PlanChangeRequest> pendingRequests(UUID tenantId) {
        return requests.findPendingByTenant(tenantId);
    }

    private PlanChangeResult apply(PlanChangeRequest request, Subscription sub, Plan newPlan, long currentPrice,
                                   String approver) {
        Instant now = clock.instant();
        Proration proration = ProrationCalculator.prorate(currentPrice, newPlan.monthlyPrice(), sub.currentPeriod(),
                now, request.prorationType());

        PlanChangeRequest approved = request.approved(approver, proration.amount(), now);
        if (!requests.transition(PlanChangeStatus.PENDING, approved)) {
            // Rolls back the unit; the caller turns this into a rejected outcome.
            throw new InvalidStateException("Plan change request is no longer pending");
        }

        Subscription updated = subscriptions.save(sub.withPlan(newPlan.id(), newPlan.monthlyPrice(), now));
        tenants.updatePlan(sub.tenantId(), newPlan.tier(), SeatLimits.of(newPlan));

        Instant effective = request.requestedEffectiveDate() != null ? request.requestedEffectiveDate() : now;
        SubscriptionChange change = new SubscriptionChange(
                UUID.randomUUID(),
                sub.tenantId(),
                sub.id(),
                request.changeType().toChangeType(),
                sub.planId(),
                newPlan.id(),
                sub.status(),
                updated.status(),
                proration.amount(),
                effective,
                "plan_change_request:" + request.id(),
                approver,
                null,
                now
        );
        changeLog.append(change);

        if (request.changeType() != PlanChangeType.LATERAL) {
            UsageEventType type = request.changeType() == PlanChangeType.UPGRADE
                    ? UsageEventType.PLAN_UPGRADED
                    : UsageEventType.PLAN_DOWNGRADED;
            usage.recordUsageEvent(sub.tenantId(), UsageEventDraft.of(type, approver, Attributes.empty()
                    .with(Attributes.FROM_PLAN_ID, sub.planId())
                    .with(Attributes.TO_PLAN_ID, newPlan.id())
                    .with(Attributes.AMOUNT, proration.amount())));
        }
        resolveCoveredLimits(sub.tenantId(), newPlan, request.changeType(), approver);

        log.info("Plan change applied. tenantId={} requestId={} to={} prorated={} remainingDays={}",
                sub.tenantId(), request.id(), newPlan.id(), proration.amount(), proration.remainingDays());
        return new PlanChangeResult(approved, updated, change, proration);
    }

    /** Closes limit grace periods the new plan's limits cover, labelled by the direction of the change. */
    private void resolveCoveredLimits(UUID tenantId, Plan newPlan, PlanChangeType changeType, String actor) {
        UsageSnapshot now = usage.computeUsage(tenantId);
        List<GraceReason> covered = new ArrayList<>();
        for (MemberRole role : MemberRole.values()) {
            if (now.of(role).count() <= newPlan.limitFor(role)) {
                covered.add(GraceReason.limitExceeded(role));
            }
        }
        gracePeriods.resolveForReasons(tenantId, covered, resolutionFor(changeType), actor);
    }

    static String resolutionFor(PlanChangeType changeType) {
        switch (changeType) {
            case UPGRADE:
                return RESOLUTION_PLAN_UPGRADED;
            case DOWNGRADE:
                return RESOLUTION_PLAN_DOWNGRADED;
            default:
                return RESOLUTION_PLAN_CHANGED;
        }
    }
}
