package com.boxline.billing.application.usage;

import com.boxline.billing.application.grace.GraceOpenResult;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.ports.MembershipCounter;
import com.boxline.billing.application.ports.PlanCatalog;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.application.ports.UsageEventStore;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.grace.GraceOverrides;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.UsageEvent;
import com.boxline.billing.domain.model.UsageEventDraft;
import com.boxline.billing.domain.model.UsageEventType;
import com.boxline.billing.domain.pricing.OverageRates;
import com.boxline.billing.domain.usage.RoleUsage;
import com.boxline.billing.domain.usage.SeatCounts;
import com.boxline.billing.domain.usage.SeatLimits;
import com.boxline.billing.domain.usage.UsageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Seat usage per tenant and the append-only usage event log.
 *
 * Limits come from the plan of the tenant's current subscription, then the current plan of the
 * tenant's tier, then the limits stored on the tenant, then {@link SeatLimits#DEFAULT}.
 */
public final class UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

    private final TenantStore tenants;
    private final SubscriptionStore subscriptions;
    private final PlanCatalog plans;
    private final MembershipCounter members;
    private final UsageEventStore events;
    private final GracePeriodManager gracePeriods;
    private final BillingNotifier notifier;
    private final OverageRates defaultRates;
    private final Clock clock;

    public UsageLedger(
            TenantStore tenants,
            SubscriptionStore subscriptions,
            PlanCatalog plans,
            MembershipCounter members,
            UsageEventStore events,
            GracePeriodManager gracePeriods,
            BillingNotifier notifier,
            OverageRates defaultRates,
            Clock clock
    ) {
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.plans = Objects.requireNonNull(plans, "plans");
        this.members = Objects.requireNonNull(members, "members");
        this.events = Objects.requireNonNull(events, "events");
        this.gracePeriods = Objects.requireNonNull(gracePeriods, "gracePeriods");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.defaultRates = defaultRates == null ? OverageRates.DEFAULT : defaultRates;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Current counts against current limits.
     *
     * @throws NotFoundException if the tenant does not exist
     */
    public UsageSnapshot computeUsage(UUID tenantId) {
        Tenant tenant = tenants.findById(tenantId).orElseThrow(() -> NotFoundException.of("tenant", tenantId));
        return computeUsage(tenant);
    }

    public UsageSnapshot computeUsage(Tenant tenant) {
        Plan plan = currentPlan(tenant).orElse(null);
        SeatCounts counts = new SeatCounts(
                members.countActive(tenant.id(), MemberRole.ATHLETE),
                members.countActive(tenant.id(), MemberRole.COACH));
        return UsageSnapshot.compute(
                tenant.id(),
                counts,
                SeatLimits.resolve(plan, tenant),
                OverageRates.resolve(plan, defaultRates),
                tenant.overageEnabled(),
                tenant.nextBillingDate());
    }

    /**
     * Appends events tagged with the tenant's current billing window.
     *
     * @throws IllegalArgumentException if {@code drafts} is empty
     * @throws NotFoundException if the tenant does not exist
     */
    public List<UsageEvent> recordUsageEvents(UUID tenantId, List<UsageEventDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new IllegalArgumentException("No usage events to record");
        }
        Tenant tenant = tenants.findById(tenantId).orElseThrow(() -> NotFoundException.of("tenant", tenantId));
        Instant now = clock.instant();
        BillingPeriod period = BillingPeriod.endingAt(tenant.nextBillingDate(), now);

        List<UsageEvent> out = new ArrayList<>(drafts.size());
        for (UsageEventDraft d : drafts) {
            out.add(new UsageEvent(UUID.randomUUID(), tenantId, d.type(), d.quantity(), d.billable(), period,
                    d.actor(), d.metadata(), now));
        }
        events.appendAll(out);
        return out;
    }

    public void recordUsageEvent(UUID tenantId, UsageEventDraft draft) {
        recordUsageEvents(tenantId, List.of(draft));
    }

    /**
     * Opens limit grace periods for roles pushed over their limit by a seat-adding trigger, or warns
     * when a role is close to its limit. Sends at most one notification of each kind per call.
     * Does nothing while overage billing is enabled.
     */
    public LimitCheck enforceLimits(UUID tenantId, Collection<UsageEventType> triggers) {
        Tenant tenant = tenants.findById(tenantId).orElseThrow(() -> NotFoundException.of("tenant", tenantId));
        UsageSnapshot usage = computeUsage(tenant);

        if (tenant.overageEnabled()) {
            return LimitCheck.skipped(usage, "overage billing enabled");
        }
        Set<MemberRole> roles = rolesTriggered(triggers);
        if (roles.isEmpty()) {
            return LimitCheck.skipped(usage, "no seat-adding trigger");
        }

        List<RoleUsage> exceeded = new ArrayList<>();
        List<RoleUsage> approaching = new ArrayList<>();
        List<GracePeriod> opened = new ArrayList<>();

        for (MemberRole role : roles) {
            RoleUsage u = usage.of(role);
            if (u.overLimit()) {
                exceeded.add(u);
                GraceOpenResult r = gracePeriods.open(tenantId, GraceReason.limitExceeded(role),
                        GraceOverrides.withContext(limitContext(u)));
                opened.add(r.gracePeriod());
                if (!r.wasExisting()) {
                    recordUsageEvent(tenantId, UsageEventDraft.of(UsageEventType.GRACE_PERIOD_TRIGGERED, null,
                            limitContext(u)));
                }
            } else if (u.isApproaching()) {
                approaching.add(u);
            }
        }

        if (!exceeded.isEmpty()) {
            log.info("Seat limit exceeded. tenantId={} roles={}", tenantId, exceeded.stream().map(RoleUsage::role).toList());
            notifier.limitExceeded(tenant, exceeded);
        }
        if (!approaching.isEmpty()) {
            notifier.limitApproaching(tenant, approaching);
        }

        return new LimitCheck(usage, exceeded.stream().map(RoleUsage::role).toList(),
                approaching.stream().map(RoleUsage::role).toList(), opened, null);
    }

    public List<UsageEvent> recentEvents(UUID tenantId, int limit) {
        return events.findRecentByTenant(tenantId, limit);
    }

    Optional<Plan> currentPlan(Tenant tenant) {
        Optional<Plan> fromSubscription = subscriptions.findCurrentByTenant(tenant.id())
                .map(Subscription::planId)
                .flatMap(plans::findById);
        if (fromSubscription.isPresent() || tenant.tier() == null) {
            return fromSubscription;
        }
        return plans.findCurrentByTier(tenant.tier());
    }

    private static Set<MemberRole> rolesTriggered(Collection<UsageEventType> triggers) {
        Set<MemberRole> roles = EnumSet.noneOf(MemberRole.class);
        if (triggers == null) return roles;
        for (UsageEventType t : triggers) {
            if (t == UsageEventType.ATHLETE_ADDED) roles.add(MemberRole.ATHLETE);
            if (t == UsageEventType.COACH_ADDED) roles.add(MemberRole.COACH);
        }
        return roles;
    }

    private static Attributes limitContext(RoleUsage u) {
        return Attributes.empty()
                .with(Attributes.ROLE, u.role().code())
                .with(Attributes.COUNT, (long) u.count())
                .with(Attributes.LIMIT, (long) u.limit())
                .with(Attributes.OVERAGE, (long) u.overage());
    }
}
