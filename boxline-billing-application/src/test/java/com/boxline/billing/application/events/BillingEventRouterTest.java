package com.boxline.billing.application.events;

import com.boxline.billing.application.support.BillingFixture;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.OverageStatus;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.UsageEventType;
import com.boxline.billing.application.overage.OverageCharge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingEventRouterTest {

    private BillingFixture f;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        f = new BillingFixture();
        tenant = f.tenant(PlanTier.SEED, false);
    }

    @Test
    void registersEveryLifecycleType() {
        assertThat(f.router.supportedTypes()).containsAll(Set.of(
                "subscription.created", "subscription.updated", "subscription.active", "subscription.canceled",
                "subscription.revoked", "subscription.uncanceled", "customer.updated", "checkout.completed",
                "order.paid", "invoice.paid", "invoice.payment_failed", "membership.changed", "trial.expired"));
    }

    @Test
    void subscriptionCreatedUsesDataMetadataTenant() {
        String body = "{\"id\":\"evt_s1\",\"type\":\"subscription.created\",\"data\":{"
                + "\"id\":\"sub_ext_1\",\"status\":\"trialing\",\"product_id\":\"prod_grow\","
                + "\"customer_id\":\"cus_9\",\"amount\":9900,\"currency\":\"USD\","
                + "\"current_period_start\":\"2025-03-01T00:00:00Z\",\"current_period_end\":\"2025-04-01T00:00:00Z\","
                + "\"metadata\":{\"boxId\":\"" + tenant.id() + "\"}}}";

        RouteResult r = f.router.route(parse(body));

        assertThat(r.handled()).isTrue();
        assertThat(r.tenantId()).isEqualTo(tenant.id());
        Subscription sub = f.subscriptions.findByExternalId("sub_ext_1").orElseThrow();
        assertThat(sub.status()).isEqualTo(SubscriptionStatus.TRIAL);
        assertThat(sub.planId()).isEqualTo(f.grow.id());
        assertThat(f.reload(tenant).externalCustomerId()).isEqualTo("cus_9");
    }

    @Test
    void revokedEventCancelsWhateverThePayloadStatus() {
        Subscription sub = f.subscription(tenant, f.seed, SubscriptionStatus.ACTIVE);
        String body = "{\"id\":\"evt_r\",\"type\":\"subscription.revoked\",\"data\":{\"id\":\""
                + sub.externalSubscriptionId() + "\",\"status\":\"active\",\"product_id\":\"prod_seed\"}}";

        f.router.route(parse(body));

        Subscription after = f.subscriptions.findById(sub.id()).orElseThrow();
        assertThat(after.status()).isEqualTo(SubscriptionStatus.CANCELED);
        assertThat(after.canceledAt()).isEqualTo(BillingFixture.START);
        assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.SUBSCRIPTION_CANCELED)).isTrue();
    }

    @Test
    void membershipChangeRecordsUsageAndEnforcesLimits() {
        f.subscription(tenant, f.seed, SubscriptionStatus.ACTIVE);
        f.seats(tenant, 76, 1);
        String body = "{\"id\":\"evt_m\",\"type\":\"membership.changed\",\"metadata\":{\"tenantId\":\""
                + tenant.id() + "\"},\"data\":{\"changes\":[{\"type\":\"athlete_added\",\"quantity\":1,"
                + "\"actor\":\"coach-7\"}]}}";

        f.router.route(parse(body));

        assertThat(f.usageEvents.all()).extracting(e -> e.type())
                .contains(UsageEventType.ATHLETE_ADDED, UsageEventType.GRACE_PERIOD_TRIGGERED);
        assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED)).isTrue();
    }

    @Test
    void overageOrderPaymentSettlesTheRecord() {
        f.tenants.setOverageEnabled(tenant.id(), true);
        Subscription sub = f.subscription(tenant, f.seed, SubscriptionStatus.ACTIVE);
        f.seats(tenant, 80, 3);
        OverageCharge charge = f.overage.createOverageOrder(tenant.id(), sub.id(),
                BillingPeriod.ofMonth(YearMonth.of(2025, 2))).orElseThrow();
        String body = "{\"id\":\"evt_o\",\"type\":\"order.paid\",\"data\":{\"id\":\"ord_1\",\"invoice_id\":\"inv_7\","
                + "\"metadata\":{\"overageBillingId\":\"" + charge.record().id() + "\"}}}";

        f.router.route(parse(body));

        assertThat(f.overageRecords.findById(charge.record().id()).orElseThrow().status())
                .isEqualTo(OverageStatus.PAID);
        assertThat(f.subscriptions.findById(sub.id()).orElseThrow().status()).isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void paymentForUnknownTenantFails() {
        String body = "{\"id\":\"evt_x\",\"type\":\"order.paid\",\"data\":{\"customer_id\":\"cus_nobody\"}}";

        assertThatThrownBy(() -> f.router.route(parse(body))).isInstanceOf(NotFoundException.class);
    }

    @Test
    void staleTrialExpiryIsIgnored() {
        f.subscription(tenant, f.seed, SubscriptionStatus.ACTIVE);
        String body = "{\"id\":\"evt_t\",\"type\":\"trial.expired\",\"metadata\":{\"tenantId\":\"" + tenant.id()
                + "\"},\"data\":{}}";

        RouteResult r = f.router.route(parse(body));

        assertThat(r.handled()).isTrue();
        assertThat(f.subscriptions.findLatestByTenant(tenant.id()).orElseThrow().status())
                .isEqualTo(SubscriptionStatus.ACTIVE);
    }

    @Test
    void customerUpdateLinksCustomerId() {
        String body = "{\"id\":\"evt_c\",\"type\":\"customer.updated\",\"data\":{\"id\":\"cus_new\","
                + "\"metadata\":{\"tenantId\":\"" + tenant.id() + "\"}}}";

        f.router.route(parse(body));

        assertThat(f.reload(tenant).externalCustomerId()).isEqualTo("cus_new");
    }

    @Test
    void envelopeWithoutIdUsesDeliveryId() {
        InboundEvent e = InboundEvent.parse(f.mapper, "{\"type\":\"x.y\",\"data\":{}}", "msg_123");

        assertThat(e.id()).isEqualTo("msg_123");
        assertThat(e.metadataTenantId()).isNull();
        assertThatThrownBy(() -> InboundEvent.parse(f.mapper, "not json", "msg"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InboundEvent.parse(f.mapper, "{\"type\":\"x\"}", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private InboundEvent parse(String body) {
        return InboundEvent.parse(f.mapper, body, null);
    }
}
