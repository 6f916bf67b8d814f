package com.boxline.billing.application.subscription;

import com.boxline.billing.application.Actors;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.application.ports.PlanCatalog;
import com.boxline.billing.application.ports.SubscriptionChangeLog;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.application.ports.UnitOfWork;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.grace.GraceOverrides;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionChange;
import com.boxline.billing.domain.model.SubscriptionChangeType;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.TenantStatus;
import com.boxline.billing.domain.model.UsageEventDraft;
import com.boxline.billing.domain.model.UsageEventType;
import com.boxline.billing.domain.usage.SeatLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the subscription status of a tenant and the side effects of each change.
 *
 * Rules:
 * - At most one subscription per tenant is active. A row becoming active supersedes any other
 *   active row of the same tenant.
 * - Re-applying the current status only refreshes the sync timestamp.
 * - Gateway calls happen before any local write; a gateway failure leaves local state untouched.
 * - Local writes of one change (subscription, tenant, grace periods, audit) commit together.
 *
 * Side effects on entering a status:
 * - past_due: payment_failed grace period (3 days, critical), payment failed notice
 * - canceled: subscription_canceled grace period (immediate, blocking)
 * - active: resolves payment_failed and billing_issue with "payment_received"
 */
public final class SubscriptionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionStateMachine.class);

    static final String RESOLUTION_PAYMENT_RECEIVED = "payment_received";
    static final String RESOLUTION_REACTIVATED = "reactivated";
    static final String REASON_SUPERSEDED = "superseded";

    private static final Set<GraceReason> PAYMENT_REASONS =
            EnumSet.of(GraceReason.PAYMENT_FAILED, GraceReason.BILLING_ISSUE);
    private static final Set<GraceReason> CANCELLATION_REASONS =
            EnumSet.of(GraceReason.SUBSCRIPTION_CANCELED, GraceReason.BILLING_ISSUE);

    private final SubscriptionStore subscriptions;
    private final TenantStore tenants;
    private final PlanCatalog plans;
    private final GracePeriodManager gracePeriods;
    private final UsageLedger usage;
    private final SubscriptionChangeLog changeLog;
    private final PaymentGatewayPort gateway;
    private final BillingNotifier notifier;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public SubscriptionStateMachine(
            SubscriptionStore subscriptions,
            TenantStore tenants,
            PlanCatalog plans,
            GracePeriodManager gracePeriods,
            UsageLedger usage,
            SubscriptionChangeLog changeLog,
            PaymentGatewayPort gateway,
            BillingNotifier notifier,
            UnitOfWork unitOfWork,
            Clock clock
    ) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.plans = Objects.requireNonNull(plans, "plans");
        this.gracePeriods = Objects.requireNonNull(gracePeriods, "gracePeriods");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.changeLog = Objects.requireNonNull(changeLog, "changeLog");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Moves the tenant's current subscription to {@code newStatus}.
     * Returns {@link TransitionResult.Outcome#NO_ACTIVE_SUBSCRIPTION} without writing anything when the
     * tenant has no live (trial, active, past_due, paused) subscription.
     */
    public TransitionResult transition(UUID tenantId, SubscriptionStatus newStatus, TransitionContext ctx) {
        Objects.requireNonNull(newStatus, "newStatus");
        TransitionContext context = ctx == null ? TransitionContext.ofActor(Actors.SYSTEM, null) : ctx;

        return unitOfWork.inTransaction(() -> {
            Optional<Subscription> current = subscriptions.findCurrentByTenant(tenantId);
            if (current.isEmpty()) {
                log.info("Transition skipped, no active subscription. tenantId={} to={}", tenantId, newStatus.code());
                return TransitionResult.noActiveSubscription(tenantId);
            }
            Subscription sub = current.get();
            Instant now = clock.instant();

            if (sub.status() == newStatus) {
                return TransitionResult.unchanged(subscriptions.save(sub.withStatus(newStatus, now)));
            }

            SubscriptionStatus previous = sub.status();
            Subscription updated = newStatus == SubscriptionStatus.CANCELED
                    ? sub.cancelNow(context.reason(), now)
                    : sub.withStatus(newStatus, now);
            if (newStatus == SubscriptionStatus.ACTIVE) {
                supersedeOtherActive(updated, now);
            }
            Subscription saved = subscriptions.save(updated);

            appendChange(saved, SubscriptionChangeType.STATUS_CHANGED, previous, newStatus, saved.planId(),
                    saved.planId(), 0, now, context);
            applyEntryEffects(saved, previous, context);
            TenantStatus tenantStatus = syncTenant(saved);

            log.info("Subscription transition. tenantId={} subscriptionId={} from={} to={} tenantStatus={}",
                    tenantId, saved.id(), previous.code(), newStatus.code(), tenantStatus.code());
            return TransitionResult.applied(saved, previous, tenantStatus);
        });
    }

    /**
     * Cancels the tenant's active subscription, now or at the end of the current period.
     */
    public BillingOutcome<Subscription> cancel(UUID tenantId, boolean cancelAtPeriodEnd, String reason, String actor) {
        Optional<Subscription> active = subscriptions.findActiveByTenant(tenantId);
        if (active.isEmpty()) {
            return BillingOutcome.notFound("No active subscription found");
        }
        Subscription sub = active.get();
        if (cancelAtPeriodEnd && sub.hasPendingCancellation()) {
            return BillingOutcome.ok(sub);
        }

        if (sub.externalSubscriptionId() != null) {
            gateway.cancelSubscription(sub.externalSubscriptionId(), cancelAtPeriodEnd);
        }

        Subscription result = unitOfWork.inTransaction(() -> {
            Instant now = clock.instant();
            TransitionContext ctx = TransitionContext.ofActor(actor, reason);
            Subscription saved;
            Instant effective;
            if (cancelAtPeriodEnd) {
                saved = subscriptions.save(sub.scheduleCancellation(reason, now));
                effective = sub.currentPeriodEnd() != null ? sub.currentPeriodEnd() : now;
            } else {
                saved = subscriptions.save(sub.cancelNow(reason, now));
                effective = now;
                gracePeriods.open(tenantId, GraceReason.SUBSCRIPTION_CANCELED,
                        GraceOverrides.withContext(Attributes.empty().with(Attributes.REASON, reason)));
                tenants.updateBillingStatus(tenantId, TenantStatus.SUSPENDED, SubscriptionStatus.CANCELED);
            }

            appendChange(saved, SubscriptionChangeType.CANCELED, sub.status(), saved.status(), saved.planId(),
                    saved.planId(), 0, effective, ctx);
            usage.recordUsageEvent(tenantId, UsageEventDraft.of(UsageEventType.SUBSCRIPTION_CANCELED, actor,
                    Attributes.empty().with(Attributes.REASON, reason)));
            notifier.subscriptionCanceled(saved, effective);

            log.info("Subscription canceled. tenantId={} subscriptionId={} atPeriodEnd={} effective={}",
                    tenantId, saved.id(), cancelAtPeriodEnd, effective);
            return saved;
        });
        return BillingOutcome.ok(result);
    }

    /**
     * Withdraws a pending cancellation or brings a canceled subscription back to active.
     */
    public BillingOutcome<Subscription> reactivate(UUID tenantId, String actor) {
        Optional<Subscription> candidate = subscriptions.findActiveByTenant(tenantId)
                .filter(Subscription::hasPendingCancellation)
                .or(() -> subscriptions.findLatestByTenant(tenantId)
                        .filter(s -> s.status() == SubscriptionStatus.CANCELED));
        if (candidate.isEmpty()) {
            return BillingOutcome.notFound("No canceled subscription found");
        }
        Subscription sub = candidate.get();

        if (sub.status() == SubscriptionStatus.CANCELED) {
            Optional<Subscription> otherActive = subscriptions.findActiveByTenant(tenantId);
            if (otherActive.isPresent()) {
                return BillingOutcome.invalidState("Tenant already has an active subscription");
            }
        }

        if (sub.hasPendingCancellation() && sub.externalSubscriptionId() != null) {
            gateway.resumeSubscription(sub.externalSubscriptionId());
        }

        Subscription result = unitOfWork.inTransaction(() -> {
            Instant now = clock.instant();
            Subscription saved = subscriptions.save(sub.reactivate(now));
            tenants.updateBillingStatus(tenantId, TenantStatus.ACTIVE, SubscriptionStatus.ACTIVE);
            gracePeriods.resolveForReasons(tenantId, CANCELLATION_REASONS, RESOLUTION_REACTIVATED, actor);

            SubscriptionChange change = appendChange(saved, SubscriptionChangeType.REACTIVATED, sub.status(),
                    SubscriptionStatus.ACTIVE, saved.planId(), saved.planId(), 0, now,
                    TransitionContext.ofActor(actor, null));
            usage.recordUsageEvent(tenantId, UsageEventDraft.of(UsageEventType.SUBSCRIPTION_REACTIVATED, actor));
            notifier.subscriptionReactivated(saved, change.id());

            log.info("Subscription reactivated. tenantId={} subscriptionId={}", tenantId, saved.id());
            return saved;
        });
        return BillingOutcome.ok(result);
    }

    /** Ends a trial that was not converted: trial becomes incomplete and a trial_ending grace period opens. */
    public BillingOutcome<Subscription> expireTrial(UUID tenantId) {
        Optional<Subscription> current = subscriptions.findCurrentByTenant(tenantId);
        if (current.isEmpty()) {
            return BillingOutcome.notFound("No trial subscription found");
        }
        Subscription sub = current.get();
        if (sub.status() != SubscriptionStatus.TRIAL) {
            return BillingOutcome.invalidState("Subscription is not in trial: " + sub.status().code());
        }

        return BillingOutcome.ok(unitOfWork.inTransaction(() -> {
            Instant now = clock.instant();
            Subscription saved = subscriptions.save(sub.withStatus(SubscriptionStatus.INCOMPLETE, now));
            tenants.updateBillingStatus(tenantId, TenantStatus.SUSPENDED, SubscriptionStatus.INCOMPLETE);
            gracePeriods.open(tenantId, GraceReason.TRIAL_ENDING);
            appendChange(saved, SubscriptionChangeType.STATUS_CHANGED, SubscriptionStatus.TRIAL,
                    SubscriptionStatus.INCOMPLETE, saved.planId(), saved.planId(), 0, now,
                    TransitionContext.ofActor(Actors.SCHEDULER, "trial_expired"));
            log.info("Trial expired. tenantId={} subscriptionId={}", tenantId, saved.id());
            return saved;
        }));
    }

    /**
     * Applies gateway-reported subscription state. Creates the local row on first sight.
     *
     * @throws NotFoundException if the product is not in the plan catalog or the tenant cannot be resolved
     */
    public Subscription syncFromGateway(GatewaySubscription snapshot, TransitionContext ctx) {
        Plan plan = plans.findCurrentByExternalProductId(snapshot.externalProductId())
                .orElseThrow(() -> NotFoundException.of("plan for product", snapshot.externalProductId()));

        return unitOfWork.inTransaction(() -> {
            Instant now = clock.instant();
            Optional<Subscription> existing = subscriptions.findByExternalId(snapshot.externalSubscriptionId());

            Subscription base;
            SubscriptionStatus previous;
            UUID previousPlan;
            if (existing.isPresent()) {
                base = existing.get();
                previous = base.status();
                previousPlan = base.planId();
            } else {
                UUID tenantId = snapshot.tenantId();
                if (tenantId == null || tenants.findById(tenantId).isEmpty()) {
                    throw NotFoundException.of("tenant for subscription", snapshot.externalSubscriptionId());
                }
                base = new Subscription(UUID.randomUUID(), tenantId, plan.id(), snapshot.status(), null, null, false,
                        null, null, 0, snapshot.currency(), snapshot.externalSubscriptionId(),
                        snapshot.externalCustomerId(), now, now);
                previous = null;
                previousPlan = null;
            }

            Subscription updated = base.syncedFrom(plan.id(), snapshot.status(), snapshot.currentPeriodStart(),
                    snapshot.currentPeriodEnd(), snapshot.cancelAtPeriodEnd(), snapshot.canceledAt(),
                    snapshot.amount(), snapshot.currency(), snapshot.externalCustomerId(), now);
            if (updated.isActive()) {
                supersedeOtherActive(updated, now);
            }
            Subscription saved = subscriptions.save(updated);

            if (!plan.id().equals(previousPlan)) {
                tenants.updatePlan(saved.tenantId(), plan.tier(), SeatLimits.of(plan));
            }
            if (snapshot.currentPeriodEnd() != null) {
                tenants.setNextBillingDate(saved.tenantId(), snapshot.currentPeriodEnd());
            }
            if (snapshot.externalCustomerId() != null) {
                tenants.setExternalCustomerId(saved.tenantId(), snapshot.externalCustomerId());
            }

            if (previous == null) {
                usage.recordUsageEvent(saved.tenantId(), UsageEventDraft.of(UsageEventType.SUBSCRIPTION_CREATED,
                        Actors.GATEWAY, Attributes.empty().with(Attributes.PLAN_ID, plan.id())
                                .with(Attributes.EVENT_ID, ctx == null ? null : ctx.eventId())));
            }
            if (previous != saved.status()) {
                appendChange(saved, SubscriptionChangeType.STATUS_CHANGED, previous, saved.status(), previousPlan,
                        saved.planId(), 0, now, ctx);
                applyEntryEffects(saved, previous, ctx);
            }
            TenantStatus tenantStatus = syncTenant(saved);

            log.info("Subscription synced from gateway. tenantId={} subscriptionId={} externalId={} status={} "
                            + "tenantStatus={} created={}", saved.tenantId(), saved.id(),
                    saved.externalSubscriptionId(), saved.status().code(), tenantStatus.code(), previous == null);
            return saved;
        });
    }

    public List<SubscriptionChange> history(UUID tenantId) {
        return changeLog.findByTenant(tenantId);
    }

    private void applyEntryEffects(Subscription sub, SubscriptionStatus previous, TransitionContext ctx) {
        String key = ctx == null ? String.valueOf(sub.lastSyncedAt().toEpochMilli())
                : ctx.dedupKey(String.valueOf(sub.lastSyncedAt().toEpochMilli()));
        switch (sub.status()) {
            case PAST_DUE:
                gracePeriods.open(sub.tenantId(), GraceReason.PAYMENT_FAILED);
                usage.recordUsageEvent(sub.tenantId(), UsageEventDraft.of(UsageEventType.PAYMENT_FAILED, Actors.GATEWAY));
                notifier.paymentFailed(sub, key);
                break;
            case CANCELED:
                gracePeriods.open(sub.tenantId(), GraceReason.SUBSCRIPTION_CANCELED);
                break;
            case ACTIVE:
                int resolved = gracePeriods.resolveForReasons(sub.tenantId(), PAYMENT_REASONS,
                        RESOLUTION_PAYMENT_RECEIVED, ctx == null ? Actors.SYSTEM : ctx.actor());
                if (previous == SubscriptionStatus.PAST_DUE || resolved > 0) {
                    usage.recordUsageEvent(sub.tenantId(),
                            UsageEventDraft.of(UsageEventType.PAYMENT_RECEIVED, Actors.GATEWAY));
                    notifier.paymentReceived(sub, key);
                }
                break;
            default:
                break;
        }
    }

    private TenantStatus syncTenant(Subscription sub) {
        boolean paymentGraceOpen = sub.status() == SubscriptionStatus.PAST_DUE
                && gracePeriods.hasOpen(sub.tenantId(), GraceReason.PAYMENT_FAILED);
        TenantStatus status = sub.status().toTenantStatus(paymentGraceOpen);
        tenants.updateBillingStatus(sub.tenantId(), status, sub.status());
        return status;
    }

    private void supersedeOtherActive(Subscription keep, Instant now) {
        for (Subscription other : subscriptions.findByTenantAndStatus(keep.tenantId(), SubscriptionStatus.ACTIVE)) {
            if (other.id().equals(keep.id())) continue;
            Subscription closed = subscriptions.save(other.cancelNow(REASON_SUPERSEDED, now));
            appendChange(closed, SubscriptionChangeType.CANCELED, SubscriptionStatus.ACTIVE,
                    SubscriptionStatus.CANCELED, other.planId(), other.planId(), 0, now,
                    TransitionContext.ofActor(Actors.SYSTEM, REASON_SUPERSEDED));
            log.warn("Superseded active subscription. tenantId={} closed={} kept={}",
                    keep.tenantId(), other.id(), keep.id());
        }
    }

    private SubscriptionChange appendChange(
            Subscription sub,
            SubscriptionChangeType type,
            SubscriptionStatus from,
            SubscriptionStatus to,
            UUID fromPlan,
            UUID toPlan,
            long prorated,
            Instant effective,
            TransitionContext ctx
    ) {
        SubscriptionChange change = new SubscriptionChange(
                UUID.randomUUID(),
                sub.tenantId(),
                sub.id(),
                type,
                fromPlan,
                toPlan,
                from,
                to,
                prorated,
                effective,
                ctx == null ? null : ctx.reason(),
                ctx == null ? Actors.SYSTEM : ctx.actor(),
                ctx == null ? null : ctx.eventId(),
                clock.instant()
        );
        changeLog.append(change);
        return change;
    }
}
