package com.boxline.billing.application.planchange;

import com.boxline.billing.application.support.BillingFixture;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.ExternalServiceException;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.PlanChangeStatus;
import com.boxline.billing.domain.model.PlanChangeType;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.ProrationType;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionChangeType;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.model.UsageEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanChangeWorkflowTest {

    private BillingFixture f;
    private Tenant tenant;
    private Subscription sub;

    @BeforeEach
    void setUp() {
        f = new BillingFixture();
        tenant = f.tenant(PlanTier.SEED, false);
        sub = f.subscription(tenant, f.seed, SubscriptionStatus.ACTIVE);
    }

    @Test
    void requestIsClassifiedByPrice() {
        PlanChangeRequest up = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null, null).orElseThrow();

        assertThat(up.changeType()).isEqualTo(PlanChangeType.UPGRADE);
        assertThat(up.prorationType()).isEqualTo(ProrationType.IMMEDIATE);
        assertThat(up.status()).isEqualTo(PlanChangeStatus.PENDING);
        assertThat(f.planChanges.pendingRequests(tenant.id())).extracting(PlanChangeRequest::id).containsExactly(up.id());
    }

    @Test
    void requestForCurrentPlanIsRejected() {
        assertThat(f.planChanges.requestChange(tenant.id(), f.seed.id(), "owner", null, null).kind())
                .isEqualTo(BillingOutcome.Kind.INVALID_STATE);
    }

    @Test
    void requestWithoutSubscriptionOrPlanIsNotFound() {
        Tenant bare = f.tenant(PlanTier.SEED, false);

        assertThat(f.planChanges.requestChange(bare.id(), f.grow.id(), "owner", null, null).kind())
                .isEqualTo(BillingOutcome.Kind.NOT_FOUND);
        assertThat(f.planChanges.requestChange(tenant.id(), UUID.randomUUID(), "owner", null, null).kind())
                .isEqualTo(BillingOutcome.Kind.NOT_FOUND);
    }

    @Test
    void approvalAppliesTheChange() {
        f.seats(tenant, 90, 2);
        f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED);
        PlanChangeRequest request = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null, null)
                .orElseThrow();

        PlanChangeResult result = f.planChanges.processRequest(request.id(), "admin").orElseThrow();

        // 5000 price difference, 21 of 30 days left
        assertThat(result.proration().amount()).isEqualTo(3500);
        assertThat(result.request().status()).isEqualTo(PlanChangeStatus.APPROVED);
        assertThat(result.request().proratedAmount()).isEqualTo(3500L);
        assertThat(result.subscription().planId()).isEqualTo(f.grow.id());
        assertThat(result.subscription().amount()).isEqualTo(9900);
        assertThat(result.change().changeType()).isEqualTo(SubscriptionChangeType.UPGRADE);

        Tenant t = f.reload(tenant);
        assertThat(t.tier()).isEqualTo(PlanTier.GROW);
        assertThat(t.athleteLimit()).isEqualTo(150);
        assertThat(f.gracePeriods.hasOpen(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED)).isFalse();
        assertThat(f.usageEvents.all()).extracting(e -> e.type()).contains(UsageEventType.PLAN_UPGRADED);
        assertThat(f.gateway.calls()).containsExactly("update:" + sub.externalSubscriptionId() + ":prod_grow");
        assertThat(f.notifications.ofType("plan_changed")).hasSize(1);
    }

    @Test
    void secondApprovalIsRejected() {
        PlanChangeRequest request = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null, null)
                .orElseThrow();
        f.planChanges.processRequest(request.id(), "admin").orElseThrow();

        BillingOutcome<PlanChangeResult> again = f.planChanges.processRequest(request.id(), "admin");

        assertThat(again.kind()).isEqualTo(BillingOutcome.Kind.INVALID_STATE);
        assertThat(f.changeLog.all()).hasSize(1);
    }

    @Test
    void downgradeToCheaperPlan() {
        Subscription scaleSub = f.subscriptions.save(sub.withPlan(f.scale.id(), f.scale.monthlyPrice(),
                f.clock.instant()));
        PlanChangeRequest request = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null,
                ProrationType.NEXT_BILLING_CYCLE).orElseThrow();

        PlanChangeResult result = f.planChanges.processRequest(request.id(), "admin").orElseThrow();

        assertThat(request.changeType()).isEqualTo(PlanChangeType.DOWNGRADE);
        assertThat(result.proration().amount()).isZero();
        assertThat(result.subscription().id()).isEqualTo(scaleSub.id());
        assertThat(f.usageEvents.all()).extracting(e -> e.type()).contains(UsageEventType.PLAN_DOWNGRADED);
    }

    @Test
    void downgradeLabelsCoveredLimitResolutionAsDowngrade() {
        f.subscriptions.save(sub.withPlan(f.scale.id(), f.scale.monthlyPrice(), f.clock.instant()));
        f.seats(tenant, 100, 2);
        GracePeriod gp = f.gracePeriods.open(tenant.id(), GraceReason.ATHLETE_LIMIT_EXCEEDED).gracePeriod();
        PlanChangeRequest request = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null,
                ProrationType.NEXT_BILLING_CYCLE).orElseThrow();

        f.planChanges.processRequest(request.id(), "admin").orElseThrow();

        GracePeriod closed = f.gracePeriodStore.findById(gp.id()).orElseThrow();
        assertThat(closed.resolved()).isTrue();
        assertThat(closed.resolution()).isEqualTo("plan_downgraded");
        assertThat(closed.resolvedBy()).isEqualTo("admin");
    }

    @Test
    void resolutionLabelFollowsChangeDirection() {
        assertThat(PlanChangeWorkflow.resolutionFor(PlanChangeType.UPGRADE)).isEqualTo("plan_upgraded");
        assertThat(PlanChangeWorkflow.resolutionFor(PlanChangeType.DOWNGRADE)).isEqualTo("plan_downgraded");
        assertThat(PlanChangeWorkflow.resolutionFor(PlanChangeType.LATERAL)).isEqualTo("plan_changed");
    }

    @Test
    void gatewayFailureLeavesRequestPending() {
        PlanChangeRequest request = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null, null)
                .orElseThrow();
        f.gateway.failAll(true);

        assertThatThrownBy(() -> f.planChanges.processRequest(request.id(), "admin"))
                .isInstanceOf(ExternalServiceException.class);

        assertThat(f.planChangeRequests.findById(request.id()).orElseThrow().isPending()).isTrue();
        assertThat(f.subscriptions.findById(sub.id()).orElseThrow().planId()).isEqualTo(f.seed.id());
    }

    @Test
    void canceledRequestCannotBeApproved() {
        PlanChangeRequest request = f.planChanges.requestChange(tenant.id(), f.grow.id(), "owner", null, null)
                .orElseThrow();

        PlanChangeRequest canceled = f.planChanges.cancelRequest(request.id(), "owner", "changed my mind")
                .orElseThrow();

        assertThat(canceled.status()).isEqualTo(PlanChangeStatus.CANCELED);
        assertThat(f.planChanges.processRequest(request.id(), "admin").kind())
                .isEqualTo(BillingOutcome.Kind.INVALID_STATE);
        assertThat(f.planChanges.cancelRequest(request.id(), "owner", null).kind())
                .isEqualTo(BillingOutcome.Kind.INVALID_STATE);
        assertThat(f.planChanges.pendingRequests(tenant.id())).isEqualTo(List.of());
    }
}
