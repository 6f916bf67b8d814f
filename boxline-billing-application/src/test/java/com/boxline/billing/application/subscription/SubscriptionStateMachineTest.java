package com.boxline.billing.application.subscription;

import com.boxline.billing.application.support.BillingFixture;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.ExternalServiceException;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.GraceSeverity;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionChangeType;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.TenantStatus;
import com.boxline.billing.domain.model.UsageEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SubscriptionStateMachine")
class SubscriptionStateMachineTest {

    private BillingFixture f;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        f = new BillingFixture();
        tenant = f.tenant(PlanTier.GROW, false);
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("past_due opens a payment grace period and keeps the tenant active while it is open")
        void pastDue() {
            f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);

            TransitionResult r = f.stateMachine.transition(tenant.id(), SubscriptionStatus.PAST_DUE,
                    TransitionContext.ofEvent("evt_1", "invoice.payment_failed"));

            assertThat(r.outcome()).isEqualTo(TransitionResult.Outcome.APPLIED);
            assertThat(r.previousStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(r.tenantStatus()).isEqualTo(TenantStatus.ACTIVE);

            GracePeriod gp = f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.PAYMENT_FAILED).orElseThrow();
            assertThat(gp.severity()).isEqualTo(GraceSeverity.CRITICAL);
            assertThat(gp.endsAt()).isEqualTo(BillingFixture.START.plus(Duration.ofDays(3)));
            assertThat(f.notifications.ofType("payment_failed")).singleElement()
                    .satisfies(n -> assertThat(n.deduplicationKey()).endsWith("_evt_1"));
            assertThat(f.usageEvents.all()).extracting(e -> e.type()).contains(UsageEventType.PAYMENT_FAILED);
            assertThat(f.changeLog.all()).singleElement()
                    .satisfies(c -> assertThat(c.changeType()).isEqualTo(SubscriptionChangeType.STATUS_CHANGED));
        }

        @Test
        @DisplayName("active after past_due resolves payment grace periods")
        void recovery() {
            f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
            f.stateMachine.transition(tenant.id(), SubscriptionStatus.PAST_DUE, null);

            f.clock.advance(Duration.ofHours(5));
            TransitionResult r = f.stateMachine.transition(tenant.id(), SubscriptionStatus.ACTIVE,
                    TransitionContext.ofEvent("evt_2", "order.paid"));

            assertThat(r.outcome()).isEqualTo(TransitionResult.Outcome.APPLIED);
            assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.PAYMENT_FAILED)).isFalse();
            assertThat(f.gracePeriodStore.findByTenant(tenant.id())).singleElement()
                    .satisfies(gp -> assertThat(gp.resolution()).isEqualTo("payment_received"));
            assertThat(f.notifications.ofType("payment_received")).hasSize(1);
            assertThat(f.reload(tenant).status()).isEqualTo(TenantStatus.ACTIVE);
        }

        @Test
        @DisplayName("re-applying past_due after the grace period ended writes nothing new")
        void pastDueAfterGraceExpired() {
            f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
            f.stateMachine.transition(tenant.id(), SubscriptionStatus.PAST_DUE, null);
            f.clock.advance(Duration.ofDays(4));

            TransitionResult r = f.stateMachine.transition(tenant.id(), SubscriptionStatus.PAST_DUE, null);

            assertThat(r.outcome()).isEqualTo(TransitionResult.Outcome.UNCHANGED);
            assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.PAYMENT_FAILED)).isFalse();
        }

        @Test
        @DisplayName("same status only refreshes the sync time")
        void sameStatus() {
            Subscription sub = f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
            f.clock.advance(Duration.ofMinutes(1));

            TransitionResult r = f.stateMachine.transition(tenant.id(), SubscriptionStatus.ACTIVE, null);

            assertThat(r.outcome()).isEqualTo(TransitionResult.Outcome.UNCHANGED);
            assertThat(f.subscriptions.findById(sub.id()).orElseThrow().lastSyncedAt()).isEqualTo(f.clock.instant());
            assertThat(f.changeLog.all()).isEmpty();
            assertThat(f.notifications.sent()).isEmpty();
        }

        @Test
        @DisplayName("without a live subscription nothing is written")
        void noSubscription() {
            TransitionResult r = f.stateMachine.transition(tenant.id(), SubscriptionStatus.ACTIVE, null);

            assertThat(r.success()).isFalse();
            assertThat(r.outcome()).isEqualTo(TransitionResult.Outcome.NO_ACTIVE_SUBSCRIPTION);
            assertThat(f.changeLog.all()).isEmpty();
        }
    }

    @Nested
    @DisplayName("syncFromGateway")
    class Sync {

        @Test
        @DisplayName("creates the subscription and moves the tenant to the product's plan")
        void createsSubscription() {
            Instant periodEnd = Instant.parse("2025-04-10T00:00:00Z");
            Subscription sub = f.stateMachine.syncFromGateway(snapshot("sub_new", "prod_scale",
                    SubscriptionStatus.ACTIVE, periodEnd), TransitionContext.ofEvent("evt_c", "subscription.created"));

            assertThat(sub.planId()).isEqualTo(f.scale.id());
            Tenant t = f.reload(tenant);
            assertThat(t.tier()).isEqualTo(PlanTier.SCALE);
            assertThat(t.athleteLimit()).isEqualTo(400);
            assertThat(t.nextBillingDate()).isEqualTo(periodEnd);
            assertThat(f.usageEvents.all()).extracting(e -> e.type()).contains(UsageEventType.SUBSCRIPTION_CREATED);
        }

        @Test
        @DisplayName("a second active subscription supersedes the first")
        void oneActivePerTenant() {
            Subscription old = f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);

            f.clock.advance(Duration.ofMinutes(1));
            Subscription fresh = f.stateMachine.syncFromGateway(snapshot("sub_second", "prod_grow",
                    SubscriptionStatus.ACTIVE, null), null);

            List<Subscription> active = f.subscriptions.findByTenantAndStatus(tenant.id(), SubscriptionStatus.ACTIVE);
            assertThat(active).extracting(Subscription::id).containsExactly(fresh.id());
            Subscription closed = f.subscriptions.findById(old.id()).orElseThrow();
            assertThat(closed.status()).isEqualTo(SubscriptionStatus.CANCELED);
            assertThat(closed.cancelReason()).isEqualTo("superseded");
        }

        @Test
        @DisplayName("unknown product is rejected")
        void unknownProduct() {
            assertThatThrownBy(() -> f.stateMachine.syncFromGateway(snapshot("sub_x", "prod_missing",
                    SubscriptionStatus.ACTIVE, null), null))
                    .isInstanceOf(NotFoundException.class);
            assertThat(f.subscriptions.findLatestByTenant(tenant.id())).isEmpty();
        }

        private GatewaySubscription snapshot(String id, String product, SubscriptionStatus status, Instant periodEnd) {
            return new GatewaySubscription(id, tenant.externalCustomerId(), product, tenant.id(), status,
                    BillingFixture.START, periodEnd, false, null, 9900, "USD");
        }
    }

    @Nested
    @DisplayName("cancel and reactivate")
    class CancelReactivate {

        @Test
        @DisplayName("cancel at period end keeps the subscription active")
        void deferred() {
            Subscription sub = f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);

            BillingOutcome<Subscription> r = f.stateMachine.cancel(tenant.id(), true, "too expensive", "owner");

            assertThat(r.isOk()).isTrue();
            assertThat(r.value().status()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(r.value().cancelAtPeriodEnd()).isTrue();
            assertThat(f.gateway.calls()).containsExactly("cancel:" + sub.externalSubscriptionId() + ":true");
            assertThat(f.changeLog.all()).singleElement()
                    .satisfies(c -> assertThat(c.effectiveDate()).isEqualTo(sub.currentPeriodEnd()));
            assertThat(f.notifications.ofType("subscription_canceled")).hasSize(1);
        }

        @Test
        @DisplayName("immediate cancel suspends the tenant and opens a blocking grace period")
        void immediate() {
            f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);

            BillingOutcome<Subscription> r = f.stateMachine.cancel(tenant.id(), false, null, "owner");

            assertThat(r.value().status()).isEqualTo(SubscriptionStatus.CANCELED);
            assertThat(f.reload(tenant).status()).isEqualTo(TenantStatus.SUSPENDED);
            assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.SUBSCRIPTION_CANCELED))
                    .hasValueSatisfying(gp -> assertThat(gp.severity()).isEqualTo(GraceSeverity.BLOCKING));
        }

        @Test
        @DisplayName("gateway failure leaves local state untouched")
        void gatewayFailure() {
            Subscription sub = f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
            f.gateway.failAll(true);

            assertThatThrownBy(() -> f.stateMachine.cancel(tenant.id(), false, null, "owner"))
                    .isInstanceOf(ExternalServiceException.class);

            assertThat(f.subscriptions.findById(sub.id()).orElseThrow()).isEqualTo(sub);
            assertThat(f.changeLog.all()).isEmpty();
        }

        @Test
        @DisplayName("cancel without active subscription is not found")
        void nothingToCancel() {
            BillingOutcome<Subscription> r = f.stateMachine.cancel(tenant.id(), true, null, "owner");

            assertThat(r.kind()).isEqualTo(BillingOutcome.Kind.NOT_FOUND);
            assertThat(f.gateway.calls()).isEmpty();
        }

        @Test
        @DisplayName("reactivate withdraws a pending cancellation at the gateway")
        void reactivatePending() {
            Subscription sub = f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
            f.stateMachine.cancel(tenant.id(), true, null, "owner");

            BillingOutcome<Subscription> r = f.stateMachine.reactivate(tenant.id(), "owner");

            assertThat(r.isOk()).isTrue();
            assertThat(r.value().cancelAtPeriodEnd()).isFalse();
            assertThat(f.gateway.calls()).contains("resume:" + sub.externalSubscriptionId());
            assertThat(f.changeLog.all()).extracting(c -> c.changeType())
                    .containsExactly(SubscriptionChangeType.CANCELED, SubscriptionChangeType.REACTIVATED);
        }

        @Test
        @DisplayName("reactivate after immediate cancel resolves the cancellation grace period")
        void reactivateCanceled() {
            f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
            f.stateMachine.cancel(tenant.id(), false, null, "owner");
            f.clock.advance(Duration.ofMinutes(1));

            BillingOutcome<Subscription> r = f.stateMachine.reactivate(tenant.id(), "owner");

            assertThat(r.value().status()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(f.reload(tenant).status()).isEqualTo(TenantStatus.ACTIVE);
            assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.SUBSCRIPTION_CANCELED)).isEmpty();
        }

        @Test
        @DisplayName("reactivate is rejected while another subscription is active")
        void reactivateRejected() {
            f.subscription(tenant, f.grow, SubscriptionStatus.CANCELED);
            f.clock.advance(Duration.ofMinutes(1));
            f.subscription(tenant, f.seed, SubscriptionStatus.ACTIVE);
            f.clock.advance(Duration.ofMinutes(1));
            f.subscription(tenant, f.grow, SubscriptionStatus.CANCELED);

            BillingOutcome<Subscription> r = f.stateMachine.reactivate(tenant.id(), "owner");

            assertThat(r.kind()).isEqualTo(BillingOutcome.Kind.INVALID_STATE);
        }
    }

    @Test
    @DisplayName("expireTrial moves a trial to incomplete and opens trial_ending")
    void expireTrial() {
        f.subscription(tenant, f.seed, SubscriptionStatus.TRIAL);

        BillingOutcome<Subscription> r = f.stateMachine.expireTrial(tenant.id());

        assertThat(r.value().status()).isEqualTo(SubscriptionStatus.INCOMPLETE);
        assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.TRIAL_ENDING)).isTrue();
        assertThat(f.stateMachine.expireTrial(tenant.id()).kind()).isEqualTo(BillingOutcome.Kind.NOT_FOUND);
    }
}
