package com.boxline.billing.application.overage;

import com.boxline.billing.application.Errors;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.batch.BoundedBatchRunner;
import com.boxline.billing.application.ports.BillingOrderStore;
import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.application.ports.OverageBillingStore;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.application.ports.UnitOfWork;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.BillingOrder;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.model.OrderStatus;
import com.boxline.billing.domain.model.OverageBillingRecord;
import com.boxline.billing.domain.model.OverageStatus;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.UsageEventDraft;
import com.boxline.billing.domain.model.UsageEventType;
import com.boxline.billing.domain.pricing.OverageCalculation;
import com.boxline.billing.domain.pricing.OverageCalculator;
import com.boxline.billing.domain.pricing.OverageRates;
import com.boxline.billing.domain.usage.SeatCounts;
import com.boxline.billing.domain.usage.SeatLimits;
import com.boxline.billing.domain.usage.UsageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Overage calculation, recording and the monthly batch.
 *
 * Rules:
 * - One record per (tenant, period start, period end); re-running a period returns the existing record.
 * - Records are only created for tenants with overage billing enabled.
 * - The monthly run never stops on a tenant failure and always returns one result per tenant.
 */
public final class OverageBillingEngine {

    private static final Logger log = LoggerFactory.getLogger(OverageBillingEngine.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    static final String NOT_ENABLED = "overage billing not enabled";
    static final String RESOLUTION_OVERAGE_ENABLED = "overage_enabled";

    private final UsageLedger usage;
    private final OverageBillingStore records;
    private final BillingOrderStore orders;
    private final SubscriptionStore subscriptions;
    private final TenantStore tenants;
    private final GracePeriodManager gracePeriods;
    private final BillingNotifier notifier;
    private final BoundedBatchRunner batchRunner;
    private final UnitOfWork unitOfWork;
    private final String currency;
    private final Clock clock;

    public OverageBillingEngine(
            UsageLedger usage,
            OverageBillingStore records,
            BillingOrderStore orders,
            SubscriptionStore subscriptions,
            TenantStore tenants,
            GracePeriodManager gracePeriods,
            BillingNotifier notifier,
            BoundedBatchRunner batchRunner,
            UnitOfWork unitOfWork,
            String currency,
            Clock clock
    ) {
        this.usage = Objects.requireNonNull(usage, "usage");
        this.records = Objects.requireNonNull(records, "records");
        this.orders = Objects.requireNonNull(orders, "orders");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.gracePeriods = Objects.requireNonNull(gracePeriods, "gracePeriods");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.batchRunner = Objects.requireNonNull(batchRunner, "batchRunner");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.currency = currency == null ? "USD" : currency;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Overage of the tenant's current usage for {@code period}. Empty when no role is over its limit.
     *
     * @throws NotFoundException if the tenant does not exist
     */
    public Optional<OverageCalculation> calculateOverageForPeriod(UUID tenantId, UUID subscriptionId,
                                                                  BillingPeriod period) {
        UsageSnapshot u = usage.computeUsage(tenantId);
        return OverageCalculator.calculate(
                tenantId,
                subscriptionId,
                period,
                new SeatCounts(u.athletes().count(), u.coaches().count()),
                new SeatLimits(u.athletes().limit(), u.coaches().limit()),
                new OverageRates(u.athletes().rate(), u.coaches().rate()));
    }

    /**
     * Records the overage of a period, or returns the record that already exists for it.
     */
    public BillingOutcome<OverageCharge> createOverageBilling(UUID tenantId, UUID subscriptionId, BillingPeriod period) {
        Optional<Tenant> tenant = tenants.findById(tenantId);
        if (tenant.isEmpty()) {
            return BillingOutcome.notFound("Tenant not found: " + tenantId);
        }
        if (!tenant.get().overageEnabled()) {
            return BillingOutcome.invalidState("Overage billing not enabled for tenant " + tenantId);
        }

        Optional<OverageBillingRecord> existing = records.findByTenantAndPeriod(tenantId, period);
        if (existing.isPresent()) {
            return BillingOutcome.ok(existingCharge(existing.get()));
        }

        Optional<OverageCalculation> calc = calculateOverageForPeriod(tenantId, subscriptionId, period);
        if (calc.isEmpty()) {
            return BillingOutcome.ok(OverageCharge.none());
        }

        OverageCalculation c = calc.get();
        OverageBillingRecord candidate = new OverageBillingRecord(
                UUID.randomUUID(),
                tenantId,
                subscriptionId,
                period,
                c.athletes(),
                c.coaches(),
                c.totalOverageAmount(),
                currency,
                OverageStatus.CALCULATED,
                null,
                null,
                null,
                clock.instant(),
                null
        );
        InsertResult<OverageBillingRecord> r = records.insertIfAbsent(candidate);
        if (!r.inserted()) {
            return BillingOutcome.ok(existingCharge(r.value()));
        }
        log.info("Overage recorded. tenantId={} period={}..{} athletes={} coaches={} total={}",
                tenantId, period.start(), period.end(), c.athleteOverage(), c.coachOverage(),
                c.totalOverageAmount());
        return BillingOutcome.ok(new OverageCharge(r.value(), null, false));
    }

    /**
     * Records the overage of a period and creates its payable order. Idempotent per period.
     */
    public BillingOutcome<OverageCharge> createOverageOrder(UUID tenantId, UUID subscriptionId, BillingPeriod period) {
        return unitOfWork.inTransaction(() -> {
            BillingOutcome<OverageCharge> billed = createOverageBilling(tenantId, subscriptionId, period);
            if (!billed.isOk() || !billed.value().hasCharge()) {
                return billed;
            }
            OverageCharge charge = billed.value();
            if (charge.order() != null || charge.record().orderId() != null) {
                return billed;
            }

            OverageBillingRecord record = charge.record();
            Instant now = clock.instant();
            BillingOrder order = orders.save(new BillingOrder(
                    UUID.randomUUID(),
                    tenantId,
                    BillingOrder.TYPE_OVERAGE,
                    OrderStatus.PENDING,
                    record.totalAmount(),
                    record.currency(),
                    "Overage charges for " + DAY.format(period.start()) + " to " + DAY.format(period.end()),
                    record.id(),
                    null,
                    now,
                    null
            ));
            OverageBillingRecord linked = records.save(record.withOrder(order.id()));

            usage.recordUsageEvent(tenantId, new UsageEventDraft(UsageEventType.OVERAGE_BILLED,
                    record.athletes().overage() + record.coaches().overage(), true, null,
                    Attributes.empty().with(Attributes.AMOUNT, record.totalAmount())));
            notifier.overageBilled(linked);
            return BillingOutcome.ok(new OverageCharge(linked, order, charge.existing()));
        });
    }

    /** Bills the previous calendar month (UTC). */
    public OverageRunSummary processMonthlyOverageBilling() {
        return processMonthlyOverageBilling(BillingPeriod.previousMonth(clock.instant()));
    }

    public OverageRunSummary processMonthlyOverageBilling(BillingPeriod period) {
        List<Subscription> active = subscriptions.findAllActive();
        log.info("Monthly overage run started. period={}..{} subscriptions={}", period.start(), period.end(),
                active.size());

        List<TenantOverageResult> results = batchRunner.run(
                active,
                sub -> billTenant(sub, period),
                (sub, e) -> {
                    log.warn("Overage billing failed. tenantId={} subscriptionId={} err={}",
                            sub.tenantId(), sub.id(), e.toString());
                    return TenantOverageResult.failed(sub.tenantId(), sub.id(), Errors.safeError(e));
                });

        OverageRunSummary summary = OverageRunSummary.of(period, results);
        log.info("Monthly overage run finished. succeeded={} failed={} created={} alreadyBilled={} total={}",
                summary.succeeded(), summary.failed(), summary.created(), summary.alreadyBilled(),
                summary.totalAmount());
        return summary;
    }

    public BillingOutcome<OverageBillingRecord> markOverageAsPaid(UUID recordId, String externalInvoiceId) {
        return unitOfWork.inTransaction(() -> {
            Optional<OverageBillingRecord> found = records.findById(recordId);
            if (found.isEmpty()) {
                return BillingOutcome.<OverageBillingRecord>notFound("Overage record not found: " + recordId);
            }
            OverageBillingRecord record = found.get();
            if (record.status() == OverageStatus.PAID) {
                return BillingOutcome.ok(record);
            }
            Instant now = clock.instant();
            OverageBillingRecord paid = records.save(record.markPaid(externalInvoiceId, now));
            updateOrder(record.orderId(), OrderStatus.PAID, externalInvoiceId, now);
            log.info("Overage paid. tenantId={} recordId={} amount={}", record.tenantId(), recordId,
                    record.totalAmount());
            return BillingOutcome.ok(paid);
        });
    }

    public BillingOutcome<OverageBillingRecord> markOverageAsFailed(UUID recordId, String reason) {
        return unitOfWork.inTransaction(() -> {
            Optional<OverageBillingRecord> found = records.findById(recordId);
            if (found.isEmpty()) {
                return BillingOutcome.<OverageBillingRecord>notFound("Overage record not found: " + recordId);
            }
            OverageBillingRecord record = found.get();
            if (record.status() == OverageStatus.PAID) {
                return BillingOutcome.<OverageBillingRecord>invalidState("Overage record already paid: " + recordId);
            }
            OverageBillingRecord failed = records.save(record.markFailed(reason));
            updateOrder(record.orderId(), OrderStatus.FAILED, null, clock.instant());
            log.warn("Overage payment failed. tenantId={} recordId={} reason={}", record.tenantId(), recordId, reason);
            return BillingOutcome.ok(failed);
        });
    }

    /** Turns overage billing on and closes seat-limit grace periods, which no longer apply. */
    public BillingOutcome<Tenant> enableOverage(UUID tenantId, String actor) {
        return toggleOverage(tenantId, true, actor);
    }

    public BillingOutcome<Tenant> disableOverage(UUID tenantId, String actor) {
        return toggleOverage(tenantId, false, actor);
    }

    public List<OverageBillingRecord> history(UUID tenantId) {
        return records.findByTenant(tenantId);
    }

    private BillingOutcome<Tenant> toggleOverage(UUID tenantId, boolean enabled, String actor) {
        return unitOfWork.inTransaction(() -> {
            Optional<Tenant> tenant = tenants.findById(tenantId);
            if (tenant.isEmpty()) {
                return BillingOutcome.<Tenant>notFound("Tenant not found: " + tenantId);
            }
            if (tenant.get().overageEnabled() == enabled) {
                return BillingOutcome.ok(tenant.get());
            }
            tenants.setOverageEnabled(tenantId, enabled);
            if (enabled) {
                gracePeriods.resolveForReasons(tenantId,
                        EnumSet.of(GraceReason.limitExceeded(MemberRole.ATHLETE),
                                GraceReason.limitExceeded(MemberRole.COACH)),
                        RESOLUTION_OVERAGE_ENABLED, actor);
            }
            notifier.overageToggled(tenantId, enabled, clock.instant());
            log.info("Overage billing {}. tenantId={} actor={}", enabled ? "enabled" : "disabled", tenantId, actor);
            return BillingOutcome.ok(tenants.findById(tenantId).orElse(tenant.get()));
        });
    }

    private TenantOverageResult billTenant(Subscription sub, BillingPeriod period) {
        Tenant tenant = tenants.findById(sub.tenantId())
                .orElseThrow(() -> NotFoundException.of("tenant", sub.tenantId()));
        if (!tenant.overageEnabled()) {
            return TenantOverageResult.skipped(sub.tenantId(), sub.id(), NOT_ENABLED);
        }
        BillingOutcome<OverageCharge> outcome = createOverageOrder(sub.tenantId(), sub.id(), period);
        if (!outcome.isOk()) {
            return TenantOverageResult.failed(sub.tenantId(), sub.id(), outcome.message());
        }
        return TenantOverageResult.billed(sub.tenantId(), sub.id(), outcome.value());
    }

    private OverageCharge existingCharge(OverageBillingRecord record) {
        BillingOrder order = record.orderId() == null ? null : orders.findById(record.orderId()).orElse(null);
        return new OverageCharge(record, order, true);
    }

    private void updateOrder(UUID orderId, OrderStatus status, String invoiceId, Instant now) {
        if (orderId == null) return;
        orders.findById(orderId).ifPresent(o -> orders.save(o.withStatus(status, invoiceId, now)));
    }
}
