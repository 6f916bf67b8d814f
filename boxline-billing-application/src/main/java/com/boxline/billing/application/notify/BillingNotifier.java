package com.boxline.billing.application.notify;

import com.boxline.billing.application.ports.NotificationPort;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.application.ports.UnitOfWork;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.OverageBillingRecord;
import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.usage.RoleUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds billing notifications and hands them to {@link NotificationPort}.
 *
 * Rules:
 * - Sending happens after the surrounding unit of work commits.
 * - Failures are logged and swallowed; they never change a billing outcome.
 * - Deduplication keys are derived only from the logical event.
 */
public final class BillingNotifier {

    private static final Logger log = LoggerFactory.getLogger(BillingNotifier.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final List<String> IN_APP_AND_EMAIL = List.of("in_app", "email");
    private static final List<String> IN_APP = List.of("in_app");

    private final NotificationPort port;
    private final TenantStore tenants;
    private final UnitOfWork unitOfWork;
    private final String billingUrl;

    public BillingNotifier(NotificationPort port, TenantStore tenants, UnitOfWork unitOfWork, String billingUrl) {
        this.port = Objects.requireNonNull(port, "port");
        this.tenants = Objects.requireNonNull(tenants, "tenants");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork");
        this.billingUrl = billingUrl == null ? "/billing" : billingUrl;
    }

    public void limitExceeded(Tenant tenant, List<RoleUsage> exceeded) {
        if (exceeded.isEmpty()) return;
        String summary = exceeded.stream()
                .map(u -> u.count() + "/" + u.limit() + " " + plural(u))
                .collect(Collectors.joining(", "));
        String key = "limit_exceeded_" + tenant.id() + exceeded.stream()
                .map(u -> "_" + u.role().code() + "_" + u.overage())
                .collect(Collectors.joining());
        send(tenant.id(), "limit_exceeded", BillingNotification.Priority.HIGH,
                "Plan limit exceeded",
                "Your box is over its plan limit (" + summary + "). Upgrade or enable overage billing "
                        + "before the grace period ends.",
                IN_APP_AND_EMAIL, roleData(exceeded), key);
    }

    public void limitApproaching(Tenant tenant, List<RoleUsage> approaching) {
        if (approaching.isEmpty()) return;
        String summary = approaching.stream()
                .map(u -> u.percentage() + "% of " + plural(u))
                .collect(Collectors.joining(", "));
        String key = "limit_approaching_" + tenant.id() + approaching.stream()
                .map(u -> "_" + u.role().code() + "_" + u.count())
                .collect(Collectors.joining());
        send(tenant.id(), "limit_approaching", BillingNotification.Priority.NORMAL,
                "Approaching plan limit",
                "Your box is using " + summary + " included in its plan.",
                IN_APP, roleData(approaching), key);
    }

    public void gracePeriodOpened(GracePeriod gp) {
        String ends = DAY.format(gp.endsAt());
        send(gp.tenantId(), "grace_period_started", priorityOf(gp),
                "Action required: " + humanize(gp.reason().code()),
                "A grace period has started for your box (" + humanize(gp.reason().code())
                        + "). It ends on " + ends + ".",
                IN_APP_AND_EMAIL,
                data("gracePeriodId", gp.id().toString(), "reason", gp.reason().code(), "endsAt",
                        gp.endsAt().toString()),
                "grace_started_" + gp.id());
    }

    public void gracePeriodResolved(GracePeriod gp) {
        send(gp.tenantId(), "grace_period_resolved", BillingNotification.Priority.LOW,
                "Resolved: " + humanize(gp.reason().code()),
                "The " + humanize(gp.reason().code()) + " issue on your box has been resolved.",
                IN_APP,
                data("gracePeriodId", gp.id().toString(), "resolution", nullToEmpty(gp.resolution())),
                "grace_resolved_" + gp.id());
    }

    public void gracePeriodExpiring(GracePeriod gp, long daysRemaining) {
        send(gp.tenantId(), "grace_period_expiring", BillingNotification.Priority.HIGH,
                "Grace period ending soon",
                "Your grace period for " + humanize(gp.reason().code()) + " ends in " + daysRemaining
                        + (daysRemaining == 1 ? " day." : " days."),
                IN_APP_AND_EMAIL,
                data("gracePeriodId", gp.id().toString(), "daysRemaining", String.valueOf(daysRemaining)),
                "grace_expiring_" + gp.id() + "_" + daysRemaining);
    }

    public void paymentFailed(Subscription sub, String eventKey) {
        send(sub.tenantId(), "payment_failed", BillingNotification.Priority.URGENT,
                "Payment failed",
                "We could not process your latest payment. Update your payment method to keep access.",
                IN_APP_AND_EMAIL,
                data("subscriptionId", sub.id().toString()),
                "payment_failed_" + sub.id() + "_" + eventKey);
    }

    public void paymentReceived(Subscription sub, String eventKey) {
        send(sub.tenantId(), "payment_received", BillingNotification.Priority.LOW,
                "Payment received",
                "Thanks, your payment went through and your subscription is active.",
                IN_APP,
                data("subscriptionId", sub.id().toString()),
                "payment_received_" + sub.id() + "_" + eventKey);
    }

    public void subscriptionCanceled(Subscription sub, Instant effectiveDate) {
        boolean deferred = sub.hasPendingCancellation();
        String message = deferred
                ? "Your subscription will end on " + DAY.format(effectiveDate) + ". You can reactivate it any time before then."
                : "Your subscription has been canceled and access has been suspended.";
        send(sub.tenantId(), "subscription_canceled", BillingNotification.Priority.HIGH,
                "Subscription canceled", message, IN_APP_AND_EMAIL,
                data("subscriptionId", sub.id().toString(), "effectiveDate", effectiveDate.toString()),
                "subscription_canceled_" + sub.id() + "_" + effectiveDate.toEpochMilli());
    }

    public void subscriptionReactivated(Subscription sub, UUID changeId) {
        send(sub.tenantId(), "subscription_reactivated", BillingNotification.Priority.NORMAL,
                "Subscription reactivated",
                "Welcome back. Your subscription is active again.",
                IN_APP_AND_EMAIL,
                data("subscriptionId", sub.id().toString()),
                "subscription_reactivated_" + changeId);
    }

    public void planChanged(PlanChangeRequest request, String planName) {
        send(request.tenantId(), "plan_changed", BillingNotification.Priority.NORMAL,
                "Plan changed",
                "Your box is now on the " + planName + " plan.",
                IN_APP_AND_EMAIL,
                data("requestId", request.id().toString(), "changeType", request.changeType().code()),
                "plan_changed_" + request.id());
    }

    public void overageToggled(UUID tenantId, boolean enabled, Instant at) {
        send(tenantId, enabled ? "overage_enabled" : "overage_disabled", BillingNotification.Priority.NORMAL,
                enabled ? "Overage billing enabled" : "Overage billing disabled",
                enabled
                        ? "Members above your plan limit will be billed per seat at the end of each month."
                        : "Overage billing is off. New members above your plan limit will start a grace period.",
                IN_APP, Map.of(),
                (enabled ? "overage_enabled_" : "overage_disabled_") + tenantId + "_" + at.toEpochMilli());
    }

    public void overageBilled(OverageBillingRecord record) {
        send(record.tenantId(), "overage_billed", BillingNotification.Priority.NORMAL,
                "Overage invoice",
                "Your overage charge for " + DAY.format(record.period().start()) + " to "
                        + DAY.format(record.period().end()) + " is " + formatMoney(record.totalAmount(),
                        record.currency()) + ".",
                IN_APP_AND_EMAIL,
                data("overageBillingId", record.id().toString(), "amount", String.valueOf(record.totalAmount())),
                "overage_billed_" + record.id());
    }

    private void send(UUID tenantId, String type, BillingNotification.Priority priority, String title,
                      String message, List<String> channels, Map<String, String> data, String key) {
        unitOfWork.afterCommit(() -> {
            try {
                UUID owner = tenants.findById(tenantId).map(Tenant::ownerUserId).orElse(null);
                port.createNotification(new BillingNotification(tenantId, owner, type, BillingNotification.CATEGORY,
                        priority, title, message, billingUrl, channels, data, key));
            } catch (RuntimeException e) {
                log.warn("Billing notification failed (ignored). tenantId={} type={} key={} err={}",
                        tenantId, type, key, e.toString());
            }
        });
    }

    static String formatMoney(long minor, String currency) {
        String sign = minor < 0 ? "-" : "";
        long abs = Math.abs(minor);
        return String.format(Locale.ROOT, "%s%d.%02d %s", sign, abs / 100, abs % 100,
                currency == null ? "" : currency).trim();
    }

    private static BillingNotification.Priority priorityOf(GracePeriod gp) {
        switch (gp.severity()) {
            case BLOCKING:
                return BillingNotification.Priority.URGENT;
            case CRITICAL:
                return BillingNotification.Priority.HIGH;
            case WARNING:
                return BillingNotification.Priority.NORMAL;
            default:
                return BillingNotification.Priority.LOW;
        }
    }

    private static Map<String, String> roleData(List<RoleUsage> usages) {
        Map<String, String> m = new LinkedHashMap<>();
        for (RoleUsage u : usages) {
            m.put(u.role().code() + "Count", String.valueOf(u.count()));
            m.put(u.role().code() + "Limit", String.valueOf(u.limit()));
        }
        return m;
    }

    private static Map<String, String> data(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(kv[i], kv[i + 1]);
        }
        return m;
    }

    private static String plural(RoleUsage u) {
        return u.role().code() + "s";
    }

    private static String humanize(String code) {
        return code.replace('_', ' ');
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
