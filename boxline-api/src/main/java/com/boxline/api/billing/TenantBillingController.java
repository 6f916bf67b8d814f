package com.boxline.api.billing;

import com.boxline.api.security.TenantAccess;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.planchange.PlanChangeWorkflow;
import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.subscription.SubscriptionStateMachine;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.OverageBillingRecord;
import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.ProrationType;
import com.boxline.billing.domain.model.SubscriptionChange;
import com.boxline.billing.domain.model.Tenant;
import com.boxline.billing.domain.usage.UsageSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant-facing billing endpoints. Every call is scoped to the tenant named in the path.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/billing")
public class TenantBillingController {

  private static final int MAX_USAGE_EVENTS = 200;

  private final TenantAccess access;
  private final SubscriptionStore subscriptions;
  private final SubscriptionStateMachine stateMachine;
  private final PlanChangeWorkflow planChanges;
  private final UsageLedger usage;
  private final GracePeriodManager gracePeriods;
  private final OverageBillingEngine overage;
  private final CheckoutService checkout;

  public TenantBillingController(
      TenantAccess access,
      SubscriptionStore subscriptions,
      SubscriptionStateMachine stateMachine,
      PlanChangeWorkflow planChanges,
      UsageLedger usage,
      GracePeriodManager gracePeriods,
      OverageBillingEngine overage,
      CheckoutService checkout
  ) {
    this.access = access;
    this.subscriptions = subscriptions;
    this.stateMachine = stateMachine;
    this.planChanges = planChanges;
    this.usage = usage;
    this.gracePeriods = gracePeriods;
    this.overage = overage;
    this.checkout = checkout;
  }

  public record CancelRequest(Boolean cancelAtPeriodEnd, @Size(max = 500) String reason) {}

  public record PlanChangeBody(
      @NotNull UUID toPlanId,
      @NotBlank String prorationType,
      Instant effectiveDate
  ) {}

  public record CancelPlanChangeBody(@Size(max = 500) String reason) {}

  public record CheckoutBody(@NotBlank String tier, String customerEmail, String successUrl) {}

  @GetMapping("/subscription")
  public Map<String, Object> subscription(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return subscriptions.findLatestByTenant(tenantId)
        .map(BillingViews::subscription)
        .orElseThrow(() -> new NotFoundException("No subscription for tenant " + tenantId));
  }

  @PostMapping("/subscription/cancel")
  public Map<String, Object> cancel(@PathVariable UUID tenantId, @Valid @RequestBody(required = false) CancelRequest body) {
    String actor = access.requireTenant(tenantId);
    boolean atPeriodEnd = body == null || body.cancelAtPeriodEnd() == null || body.cancelAtPeriodEnd();
    String reason = body == null ? null : body.reason();
    return BillingViews.subscription(stateMachine.cancel(tenantId, atPeriodEnd, reason, actor).orElseThrow());
  }

  @PostMapping("/subscription/reactivate")
  public Map<String, Object> reactivate(@PathVariable UUID tenantId) {
    String actor = access.requireTenant(tenantId);
    return BillingViews.subscription(stateMachine.reactivate(tenantId, actor).orElseThrow());
  }

  @GetMapping("/subscription/history")
  public List<SubscriptionChange> history(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return stateMachine.history(tenantId);
  }

  @GetMapping("/usage")
  public UsageSnapshot usage(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return usage.computeUsage(tenantId);
  }

  @GetMapping("/usage/events")
  public List<Map<String, Object>> usageEvents(@PathVariable UUID tenantId,
                                               @RequestParam(defaultValue = "50") int limit) {
    access.requireTenant(tenantId);
    int capped = Math.max(1, Math.min(limit, MAX_USAGE_EVENTS));
    return usage.recentEvents(tenantId, capped).stream().map(BillingViews::usageEvent).toList();
  }

  @GetMapping("/grace-periods")
  public List<Map<String, Object>> gracePeriods(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return gracePeriods.findByTenant(tenantId).stream().map(BillingViews::gracePeriod).toList();
  }

  @PostMapping("/plan-changes")
  @ResponseStatus(HttpStatus.CREATED)
  public PlanChangeRequest requestPlanChange(@PathVariable UUID tenantId, @Valid @RequestBody PlanChangeBody body) {
    String actor = access.requireTenant(tenantId);
    ProrationType type = ProrationType.fromCode(body.prorationType());
    return planChanges.requestChange(tenantId, body.toPlanId(), actor, body.effectiveDate(), type).orElseThrow();
  }

  @GetMapping("/plan-changes")
  public List<PlanChangeRequest> pendingPlanChanges(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return planChanges.pendingRequests(tenantId);
  }

  @PostMapping("/plan-changes/{requestId}/cancel")
  public PlanChangeRequest cancelPlanChange(@PathVariable UUID tenantId, @PathVariable UUID requestId,
                                            @Valid @RequestBody(required = false) CancelPlanChangeBody body) {
    String actor = access.requireTenant(tenantId);
    boolean owned = planChanges.pendingRequests(tenantId).stream().anyMatch(r -> r.id().equals(requestId));
    if (!owned) {
      throw new NotFoundException("No pending plan change request " + requestId + " for tenant " + tenantId);
    }
    return planChanges.cancelRequest(requestId, actor, body == null ? null : body.reason()).orElseThrow();
  }

  @PostMapping("/overage/enable")
  public Tenant enableOverage(@PathVariable UUID tenantId) {
    String actor = access.requireTenant(tenantId);
    return overage.enableOverage(tenantId, actor).orElseThrow();
  }

  @PostMapping("/overage/disable")
  public Tenant disableOverage(@PathVariable UUID tenantId) {
    String actor = access.requireTenant(tenantId);
    return overage.disableOverage(tenantId, actor).orElseThrow();
  }

  @GetMapping("/overage/history")
  public List<OverageBillingRecord> overageHistory(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return overage.history(tenantId);
  }

  @PostMapping("/checkout")
  public PaymentGatewayPort.CheckoutSession checkout(@PathVariable UUID tenantId, @Valid @RequestBody CheckoutBody body) {
    access.requireTenant(tenantId);
    return checkout.createCheckout(tenantId, PlanTier.fromCode(body.tier()), body.customerEmail(), body.successUrl());
  }

  @GetMapping("/portal")
  public Map<String, Object> portal(@PathVariable UUID tenantId) {
    access.requireTenant(tenantId);
    return Map.of("url", checkout.portalUrl(tenantId));
  }
}
