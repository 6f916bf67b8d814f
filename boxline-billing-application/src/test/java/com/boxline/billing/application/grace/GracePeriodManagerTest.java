package com.boxline.billing.application.grace;

import com.boxline.billing.application.support.BillingFixture;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.grace.GraceOverrides;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.GraceSeverity;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.Tenant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GracePeriodManagerTest {

    private BillingFixture f;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        f = new BillingFixture();
        tenant = f.tenant(PlanTier.SEED, false);
    }

    @Test
    void openingTwiceReturnsTheExistingPeriod() {
        GraceOpenResult first = f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED);
        GraceOpenResult second = f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED);

        assertThat(first.wasExisting()).isFalse();
        assertThat(second.wasExisting()).isTrue();
        assertThat(second.gracePeriod().id()).isEqualTo(first.gracePeriod().id());
        assertThat(f.gracePeriodStore.all()).hasSize(1);
        assertThat(f.notifications.ofType("grace_period_started")).hasSize(1);
    }

    @Test
    void policyTermsApply() {
        GracePeriod gp = f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED).gracePeriod();

        assertThat(gp.severity()).isEqualTo(GraceSeverity.WARNING);
        assertThat(gp.endsAt()).isEqualTo(BillingFixture.START.plus(Duration.ofDays(14)));
        assertThat(gp.autoResolve()).isFalse();
        assertThat(gp.context().get(Attributes.DAYS_REMAINING)).contains(14L);
    }

    @Test
    void overridesReplacePolicyTerms() {
        GraceOverrides o = new GraceOverrides(GraceSeverity.BLOCKING, Duration.ofDays(1), true,
                Attributes.empty().with(Attributes.SOURCE, "admin"));

        GracePeriod gp = f.gracePeriods.open(tenant.id(), GraceReason.BILLING_ISSUE, o).gracePeriod();

        assertThat(gp.severity()).isEqualTo(GraceSeverity.BLOCKING);
        assertThat(gp.endsAt()).isEqualTo(BillingFixture.START.plus(Duration.ofDays(1)));
        assertThat(gp.autoResolve()).isTrue();
        assertThat(gp.context().get(Attributes.SOURCE)).contains("admin");
    }

    @Test
    void expiredUnresolvedPeriodIsClosedBeforeReopening() {
        GracePeriod old = f.gracePeriods.open(tenant.id(), GraceReason.PAYMENT_FAILED).gracePeriod();
        f.clock.advance(Duration.ofDays(4));

        GraceOpenResult reopened = f.gracePeriods.open(tenant.id(), GraceReason.PAYMENT_FAILED);

        assertThat(reopened.wasExisting()).isFalse();
        assertThat(reopened.gracePeriod().id()).isNotEqualTo(old.id());
        GracePeriod closed = f.gracePeriodStore.findById(old.id()).orElseThrow();
        assertThat(closed.resolved()).isTrue();
        assertThat(closed.resolution()).isEqualTo(GracePeriodManager.RESOLUTION_EXPIRED);
        assertThat(closed.autoResolved()).isTrue();
    }

    @Test
    void resolveIsIdempotent() {
        GracePeriod gp = f.gracePeriods.open(tenant.id(), GraceReason.BILLING_ISSUE).gracePeriod();

        BillingOutcome<GracePeriod> first = f.gracePeriods.resolve(gp.id(), "fixed", "admin", false);
        f.clock.advance(Duration.ofHours(1));
        BillingOutcome<GracePeriod> second = f.gracePeriods.resolve(gp.id(), "again", "admin", false);

        assertThat(first.value().resolution()).isEqualTo("fixed");
        assertThat(second.value().resolution()).isEqualTo("fixed");
        assertThat(second.value().resolvedAt()).isEqualTo(BillingFixture.START);
        assertThat(f.notifications.ofType("grace_period_resolved")).hasSize(1);
    }

    @Test
    void resolveUnknownIsNotFound() {
        assertThat(f.gracePeriods.resolve(UUID.randomUUID(), "x", "admin", false).kind())
                .isEqualTo(BillingOutcome.Kind.NOT_FOUND);
    }

    @Test
    void resolveForReasonsOnlyTouchesThoseReasons() {
        f.gracePeriods.open(tenant.id(), GraceReason.PAYMENT_FAILED);
        f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED);

        int n = f.gracePeriods.resolveForReasons(tenant.id(),
                EnumSet.of(GraceReason.PAYMENT_FAILED, GraceReason.BILLING_ISSUE), "payment_received", "gateway");

        assertThat(n).isEqualTo(1);
        assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED)).isTrue();
        assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.PAYMENT_FAILED)).isFalse();
    }

    @Test
    void sweepFindsPeriodsEndingSoon() {
        f.gracePeriods.open(tenant.id(), GraceReason.PAYMENT_FAILED);
        f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED);

        List<GracePeriod> expiring = f.gracePeriods.sweepExpiring(3);

        assertThat(expiring).extracting(GracePeriod::reason).containsExactly(GraceReason.PAYMENT_FAILED);
        assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.PAYMENT_FAILED)).isPresent();
    }

    @Test
    void autoResolveClosesOnlyExpiredPeriodsThatOptedIn() {
        f.gracePeriods.open(tenant.id(), GraceReason.PAYMENT_FAILED);
        f.gracePeriods.open(tenant.id(), GraceReason.BILLING_ISSUE,
                new GraceOverrides(null, Duration.ofDays(1), true, null));
        f.gracePeriods.open(tenant.id(), GraceReason.TRIAL_ENDING,
                new GraceOverrides(null, Duration.ofDays(30), true, null));
        f.clock.advance(Duration.ofDays(5));

        int n = f.gracePeriods.autoResolveExpired(100);

        assertThat(n).isEqualTo(1);
        assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.BILLING_ISSUE)).isEmpty();
        assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.PAYMENT_FAILED)).isPresent();
        assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.TRIAL_ENDING)).isPresent();
        assertThat(f.notifications.ofType("grace_period_resolved")).hasSize(1);
    }

    @Test
    void blockingCancelGraceSurvivesTheExpirySweep() {
        f.subscription(tenant, f.grow, SubscriptionStatus.ACTIVE);
        f.stateMachine.cancel(tenant.id(), false, null, "owner");
        f.clock.advance(Duration.ofHours(1));

        int n = f.gracePeriods.autoResolveExpired(100);

        assertThat(n).isZero();
        assertThat(f.gracePeriodStore.findUnresolved(tenant.id(), GraceReason.SUBSCRIPTION_CANCELED))
                .hasValueSatisfying(gp -> {
                    assertThat(gp.autoResolve()).isFalse();
                    assertThat(gp.resolved()).isFalse();
                });
        assertThat(f.notifications.ofType("grace_period_resolved")).isEmpty();
    }
}
