package com.boxline.billing.application.grace;

import com.boxline.billing.application.Actors;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.ports.GracePeriodStore;
import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.application.ports.UnitOfWork;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.grace.GraceOverrides;
import com.boxline.billing.domain.grace.GracePolicy;
import com.boxline.billing.domain.grace.GraceTerms;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Opens and resolves grace periods.
 *
 * Rules:
 * - At most one unresolved, unexpired period per (tenant, reason). A second open returns the first.
 * - An unresolved period that has already expired is closed as "expired" before a new one is opened.
 * - Concurrent opens are settled by the store's unique key; the loser gets the winner's row.
 * - Notifications are best-effort and sent after commit.
 */
public final class GracePeriodManager {

    private static final Logger log = LoggerFactory.getLogger(GracePeriodManager.class);

    public static final String RESOLUTION_EXPIRED = "expired";

    private final GracePeriodStore store;
    private final BillingNotifier notifier;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public GracePeriodManager(GracePeriodStore store, BillingNotifier notifier, UnitOfWork unitOfWork, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public GraceOpenResult open(UUID tenantId, GraceReason reason) {
        return open(tenantId, reason, GraceOverrides.none());
    }

    public GraceOpenResult open(UUID tenantId, GraceReason reason, GraceOverrides overrides) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(reason, "reason");
        GraceOverrides o = overrides == null ? GraceOverrides.none() : overrides;

        return unitOfWork.inTransaction(() -> {
            Instant now = clock.instant();

            Optional<GracePeriod> current = store.findUnresolved(tenantId, reason);
            if (current.isPresent()) {
                GracePeriod gp = current.get();
                if (gp.isOpenAt(now)) {
                    return GraceOpenResult.existing(gp);
                }
                store.markResolved(gp.resolve(RESOLUTION_EXPIRED, Actors.SYSTEM, true, now));
                log.info("Closed expired grace period before reopening. tenantId={} reason={} id={}",
                        tenantId, reason.code(), gp.id());
            }

            GraceTerms terms = GracePolicy.termsFor(reason, o);
            Duration duration = terms.duration();
            Attributes context = (o.context() == null ? Attributes.empty() : o.context())
                    .with(Attributes.DAYS_REMAINING, duration.toDays());

            GracePeriod candidate = new GracePeriod(
                    UUID.randomUUID(),
                    tenantId,
                    reason,
                    terms.severity(),
                    now,
                    now.plus(duration),
                    o.autoResolveOrDefault(),
                    context,
                    false,
                    null,
                    null,
                    null,
                    false
            );

            InsertResult<GracePeriod> r = store.insertIfNoneUnresolved(candidate);
            if (!r.inserted()) {
                return GraceOpenResult.existing(r.value());
            }

            log.info("Grace period opened. tenantId={} reason={} severity={} endsAt={}",
                    tenantId, reason.code(), terms.severity().code(), candidate.endsAt());
            notifier.gracePeriodOpened(candidate);
            return GraceOpenResult.created(candidate);
        });
    }

    public BillingOutcome<GracePeriod> resolve(UUID gracePeriodId, String resolution, String actor,
                                               boolean autoResolved) {
        return unitOfWork.inTransaction(() -> {
            Optional<GracePeriod> found = store.findById(gracePeriodId);
            if (found.isEmpty()) {
                return BillingOutcome.<GracePeriod>notFound("Grace period not found: " + gracePeriodId);
            }
            GracePeriod gp = found.get();
            if (gp.resolved()) {
                return BillingOutcome.ok(gp);
            }
            return BillingOutcome.ok(doResolve(gp, resolution, actor, autoResolved, clock.instant()));
        });
    }

    /** Resolves every unresolved period of the tenant with one of {@code reasons}. */
    public int resolveForReasons(UUID tenantId, Collection<GraceReason> reasons, String resolution, String actor) {
        if (reasons == null || reasons.isEmpty()) {
            return 0;
        }
        return unitOfWork.inTransaction(() -> {
            Instant now = clock.instant();
            int count = 0;
            for (GracePeriod gp : store.findUnresolvedByTenant(tenantId, reasons)) {
                GracePeriod resolved = gp.resolve(resolution, actor, false, now);
                if (store.markResolved(resolved)) {
                    notifier.gracePeriodResolved(resolved);
                    count++;
                }
            }
            if (count > 0) {
                log.info("Grace periods resolved. tenantId={} reasons={} resolution={} count={}",
                        tenantId, reasons, resolution, count);
            }
            return count;
        });
    }

    /** Unresolved periods ending within {@code daysAhead} days. Read-only. */
    public List<GracePeriod> sweepExpiring(int daysAhead) {
        Instant now = clock.instant();
        return store.findUnresolvedEndingBetween(now, now.plus(Duration.ofDays(Math.max(0, daysAhead))));
    }

    /**
     * Closes expired periods flagged auto-resolve. Each period is resolved in its own unit so one bad
     * row does not block the rest.
     */
    public int autoResolveExpired(int limit) {
        Instant now = clock.instant();
        int count = 0;
        for (GracePeriod gp : store.findExpiredAutoResolvable(now, limit)) {
            try {
                boolean done = unitOfWork.inTransaction(() -> doResolve(gp, RESOLUTION_EXPIRED, Actors.SCHEDULER,
                        true, now).resolved());
                if (done) count++;
            } catch (RuntimeException e) {
                log.warn("Auto-resolve failed. gracePeriodId={} err={}", gp.id(), e.toString());
            }
        }
        return count;
    }

    public boolean hasOpen(UUID tenantId, GraceReason reason) {
        Instant now = clock.instant();
        return store.findUnresolved(tenantId, reason).map(gp -> gp.isOpenAt(now)).orElse(false);
    }

    public List<GracePeriod> findByTenant(UUID tenantId) {
        return store.findByTenant(tenantId);
    }

    private GracePeriod doResolve(GracePeriod gp, String resolution, String actor, boolean auto, Instant now) {
        GracePeriod resolved = gp.resolve(resolution, actor, auto, now);
        if (!store.markResolved(resolved)) {
            return store.findById(gp.id()).orElse(resolved);
        }
        log.info("Grace period resolved. tenantId={} reason={} resolution={} auto={}",
                gp.tenantId(), gp.reason().code(), resolution, auto);
        notifier.gracePeriodResolved(resolved);
        return resolved;
    }
}
