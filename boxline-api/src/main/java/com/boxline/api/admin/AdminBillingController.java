package com.boxline.api.admin;

import com.boxline.api.security.TenantAccess;
import com.boxline.billing.application.events.BillingEventService;
import com.boxline.billing.application.events.RetryResult;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.overage.OverageRunSummary;
import com.boxline.billing.application.planchange.PlanChangeResult;
import com.boxline.billing.application.planchange.PlanChangeWorkflow;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.OverageBillingRecord;
import com.boxline.billing.domain.model.PlanChangeRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/billing")
public class AdminBillingController {

  private static final Logger log = LoggerFactory.getLogger(AdminBillingController.class);

  private final TenantAccess access;
  private final PlanChangeWorkflow planChanges;
  private final OverageBillingEngine overage;
  private final BillingEventService events;
  private final GracePeriodManager gracePeriods;

  public AdminBillingController(
      TenantAccess access,
      PlanChangeWorkflow planChanges,
      OverageBillingEngine overage,
      BillingEventService events,
      GracePeriodManager gracePeriods
  ) {
    this.access = access;
    this.planChanges = planChanges;
    this.overage = overage;
    this.events = events;
    this.gracePeriods = gracePeriods;
  }

  public record ReasonBody(@Size(max = 500) String reason) {}

  public record OverageRunBody(String month) {}

  public record ResolveBody(@NotBlank @Size(max = 100) String resolution) {}

  public record PaidBody(@NotBlank String externalInvoiceId) {}

  @PostMapping("/plan-changes/{requestId}/approve")
  public PlanChangeResult approvePlanChange(@PathVariable UUID requestId) {
    String actor = access.currentActor();
    log.info("Admin approving plan change. requestId={} actor={}", requestId, actor);
    return planChanges.processRequest(requestId, actor).orElseThrow();
  }

  @PostMapping("/plan-changes/{requestId}/cancel")
  public PlanChangeRequest cancelPlanChange(@PathVariable UUID requestId,
                                            @Valid @RequestBody(required = false) ReasonBody body) {
    return planChanges.cancelRequest(requestId, access.currentActor(), body == null ? null : body.reason())
        .orElseThrow();
  }

  /** Bills one month, the previous calendar month when none is given. Safe to repeat. */
  @PostMapping("/overage/run")
  public OverageRunSummary runOverage(@RequestBody(required = false) OverageRunBody body) {
    String month = body == null ? null : body.month();
    if (month == null || month.isBlank()) {
      return overage.processMonthlyOverageBilling();
    }
    YearMonth ym;
    try {
      ym = YearMonth.parse(month.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("month must be yyyy-MM: " + month);
    }
    return overage.processMonthlyOverageBilling(BillingPeriod.ofMonth(ym));
  }

  @PostMapping("/overage/{recordId}/paid")
  public OverageBillingRecord overagePaid(@PathVariable UUID recordId, @Valid @RequestBody PaidBody body) {
    return overage.markOverageAsPaid(recordId, body.externalInvoiceId()).orElseThrow();
  }

  @PostMapping("/overage/{recordId}/failed")
  public OverageBillingRecord overageFailed(@PathVariable UUID recordId,
                                            @Valid @RequestBody(required = false) ReasonBody body) {
    String reason = body == null || body.reason() == null ? "marked failed by admin" : body.reason();
    return overage.markOverageAsFailed(recordId, reason).orElseThrow();
  }

  @PostMapping("/events/retry")
  public Map<String, Object> retryFailedEvents() {
    List<RetryResult> results = events.retryFailed(events.maxRetries());
    long ok = results.stream().filter(RetryResult::success).count();
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("attempted", results.size());
    out.put("succeeded", ok);
    out.put("failed", results.size() - ok);
    out.put("results", results);
    return out;
  }

  @PostMapping("/grace-periods/{gracePeriodId}/resolve")
  public Map<String, Object> resolveGracePeriod(@PathVariable UUID gracePeriodId, @Valid @RequestBody ResolveBody body) {
    GracePeriod gp = gracePeriods.resolve(gracePeriodId, body.resolution(), access.currentActor(), false)
        .orElseThrow();
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", gp.id());
    out.put("tenantId", gp.tenantId());
    out.put("reason", gp.reason().code());
    out.put("resolved", gp.resolved());
    out.put("resolution", gp.resolution());
    out.put("resolvedBy", gp.resolvedBy());
    return out;
  }
}
