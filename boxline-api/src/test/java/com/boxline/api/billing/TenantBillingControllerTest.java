package com.boxline.api.billing;

import com.boxline.api.common.ApiExceptionHandler;
import com.boxline.api.security.JwtBeans;
import com.boxline.api.security.SecurityConfig;
import com.boxline.api.security.TenantAccess;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.planchange.PlanChangeWorkflow;
import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.subscription.SubscriptionStateMachine;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.BillingOutcome;
import com.boxline.billing.domain.ExternalServiceException;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.GraceSeverity;
import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.PlanChangeStatus;
import com.boxline.billing.domain.model.PlanChangeType;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.ProrationType;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionStatus;
import com.boxline.billing.domain.pricing.OverageRates;
import com.boxline.billing.domain.usage.SeatCounts;
import com.boxline.billing.domain.usage.SeatLimits;
import com.boxline.billing.domain.usage.UsageSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TenantBillingController.class)
@Import({SecurityConfig.class, JwtBeans.class, TenantAccess.class, ApiExceptionHandler.class})
@ActiveProfiles("test")
class TenantBillingControllerTest {

  private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");
  private static final UUID TENANT = UUID.fromString("0b6f0f5e-4e59-4c3b-9c1e-1f4c2f9a0001");
  private static final UUID OTHER = UUID.fromString("0b6f0f5e-4e59-4c3b-9c1e-1f4c2f9a0002");

  @Autowired
  private MockMvc mvc;

  @MockBean private SubscriptionStore subscriptions;
  @MockBean private SubscriptionStateMachine stateMachine;
  @MockBean private PlanChangeWorkflow planChanges;
  @MockBean private UsageLedger usage;
  @MockBean private GracePeriodManager gracePeriods;
  @MockBean private OverageBillingEngine overage;
  @MockBean private CheckoutService checkout;

  private static RequestPostProcessor owner(UUID tenantId) {
    return jwt()
        .jwt(j -> j.subject("user-1").claim("tenantId", tenantId.toString()))
        .authorities(new SimpleGrantedAuthority("ROLE_OWNER"));
  }

  private static RequestPostProcessor admin() {
    return jwt()
        .jwt(j -> j.subject("admin-1"))
        .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
  }

  private static Subscription active() {
    return new Subscription(UUID.randomUUID(), TENANT, UUID.randomUUID(), SubscriptionStatus.ACTIVE,
        NOW.minusSeconds(86_400), NOW.plusSeconds(86_400 * 20), false, null, null, 4900, "USD",
        "sub_1", "cus_1", NOW, NOW);
  }

  @Nested
  @DisplayName("tenant scoping")
  class Scoping {

    @Test
    void tokenForAnotherTenantIsForbidden() throws Exception {
      mvc.perform(get("/api/v1/tenants/{t}/billing/usage", TENANT).with(owner(OTHER)))
          .andExpect(status().isForbidden())
          .andExpect(jsonPath("$.reason").value("forbidden"));
      verify(usage, never()).computeUsage(any(UUID.class));
    }

    @Test
    void adminMayReadAnyTenant() throws Exception {
      when(usage.computeUsage(TENANT)).thenReturn(UsageSnapshot.compute(TENANT, new SeatCounts(80, 2),
          new SeatLimits(75, 3), OverageRates.DEFAULT, true, null));

      mvc.perform(get("/api/v1/tenants/{t}/billing/usage", TENANT).with(admin()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.athletes.overage").value(5))
          .andExpect(jsonPath("$.estimatedOverageAmount").value(500));
    }

    @Test
    void noTokenIsUnauthorized() throws Exception {
      mvc.perform(get("/api/v1/tenants/{t}/billing/subscription", TENANT))
          .andExpect(status().isUnauthorized());
    }
  }

  @Nested
  @DisplayName("subscription")
  class Subscriptions {

    @Test
    void currentSubscriptionUsesLowerCaseStatus() throws Exception {
      when(subscriptions.findLatestByTenant(TENANT)).thenReturn(Optional.of(active()));

      mvc.perform(get("/api/v1/tenants/{t}/billing/subscription", TENANT).with(owner(TENANT)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("active"))
          .andExpect(jsonPath("$.externalSubscriptionId").value("sub_1"));
    }

    @Test
    void missingSubscriptionIs404() throws Exception {
      when(subscriptions.findLatestByTenant(TENANT)).thenReturn(Optional.empty());

      mvc.perform(get("/api/v1/tenants/{t}/billing/subscription", TENANT).with(owner(TENANT)))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.reason").value("not_found"));
    }

    @Test
    void cancelDefaultsToPeriodEndAndRecordsTheCaller() throws Exception {
      Subscription scheduled = active().scheduleCancellation("too expensive", NOW);
      when(stateMachine.cancel(eq(TENANT), eq(true), eq("too expensive"), eq("user:user-1")))
          .thenReturn(BillingOutcome.ok(scheduled));

      mvc.perform(post("/api/v1/tenants/{t}/billing/subscription/cancel", TENANT).with(owner(TENANT))
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"reason\":\"too expensive\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.cancelAtPeriodEnd").value(true));
    }

    @Test
    void cancelWithoutActiveSubscriptionIsAConflict() throws Exception {
      when(stateMachine.cancel(eq(TENANT), anyBoolean(), isNull(), anyString()))
          .thenReturn(BillingOutcome.invalidState("No active subscription"));

      mvc.perform(post("/api/v1/tenants/{t}/billing/subscription/cancel", TENANT).with(owner(TENANT)))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.reason").value("invalid_state"));
    }
  }

  @Nested
  @DisplayName("plan changes")
  class PlanChanges {

    @Test
    void requestIsCreatedPending() throws Exception {
      UUID toPlan = UUID.randomUUID();
      PlanChangeRequest pending = new PlanChangeRequest(UUID.randomUUID(), TENANT, UUID.randomUUID(),
          UUID.randomUUID(), toPlan, PlanChangeType.UPGRADE, ProrationType.IMMEDIATE, PlanChangeStatus.PENDING,
          NOW, "user:user-1", NOW, null, null, null, null);
      when(planChanges.requestChange(eq(TENANT), eq(toPlan), eq("user:user-1"), isNull(),
          eq(ProrationType.IMMEDIATE))).thenReturn(BillingOutcome.ok(pending));

      mvc.perform(post("/api/v1/tenants/{t}/billing/plan-changes", TENANT).with(owner(TENANT))
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"toPlanId\":\"" + toPlan + "\",\"prorationType\":\"immediate\"}"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void missingTargetPlanFailsValidation() throws Exception {
      mvc.perform(post("/api/v1/tenants/{t}/billing/plan-changes", TENANT).with(owner(TENANT))
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"prorationType\":\"immediate\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.reason").value("validation_error"));
    }

    @Test
    void unknownProrationTypeIsABadRequest() throws Exception {
      mvc.perform(post("/api/v1/tenants/{t}/billing/plan-changes", TENANT).with(owner(TENANT))
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"toPlanId\":\"" + UUID.randomUUID() + "\",\"prorationType\":\"someday\"}"))
          .andExpect(status().isBadRequest());
    }

    @Test
    void cancellingAnotherTenantsRequestIs404() throws Exception {
      when(planChanges.pendingRequests(TENANT)).thenReturn(List.of());

      mvc.perform(post("/api/v1/tenants/{t}/billing/plan-changes/{r}/cancel", TENANT, UUID.randomUUID())
              .with(owner(TENANT)))
          .andExpect(status().isNotFound());
      verify(planChanges, never()).cancelRequest(any(), any(), any());
    }
  }

  @Nested
  @DisplayName("grace periods, checkout and portal")
  class Other {

    @Test
    void gracePeriodsRenderContextAsPlainMap() throws Exception {
      GracePeriod gp = new GracePeriod(UUID.randomUUID(), TENANT, GraceReason.ATHLETE_LIMIT_EXCEEDED,
          GraceSeverity.WARNING, NOW, NOW.plusSeconds(14 * 86_400), true,
          Attributes.empty().with(Attributes.COUNT, 81L).with(Attributes.LIMIT, 75L),
          false, null, null, null, false);
      when(gracePeriods.findByTenant(TENANT)).thenReturn(List.of(gp));

      mvc.perform(get("/api/v1/tenants/{t}/billing/grace-periods", TENANT).with(owner(TENANT)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].reason").value("athlete_limit_exceeded"))
          .andExpect(jsonPath("$[0].context.count").value("81"));
    }

    @Test
    void checkoutReturnsTheHostedSession() throws Exception {
      when(checkout.createCheckout(TENANT, PlanTier.GROW, null, "https://app/ok"))
          .thenReturn(new PaymentGatewayPort.CheckoutSession("co_1", "https://pay/co_1", null));

      mvc.perform(post("/api/v1/tenants/{t}/billing/checkout", TENANT).with(owner(TENANT))
              .contentType(MediaType.APPLICATION_JSON)
              .content("{\"tier\":\"grow\",\"successUrl\":\"https://app/ok\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.url").value("https://pay/co_1"));
    }

    @Test
    void gatewayOutageIs503() throws Exception {
      when(checkout.portalUrl(TENANT)).thenThrow(new ExternalServiceException("gateway", "HTTP 502"));

      mvc.perform(get("/api/v1/tenants/{t}/billing/portal", TENANT).with(owner(TENANT)))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.reason").value("external_service_error"));
    }
  }
}
