package com.boxline.api.billing;

import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.application.ports.PlanCatalog;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.domain.InvalidStateException;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.PlanTier;
import com.boxline.billing.domain.model.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Hosted checkout and customer portal links.
 *
 * The portal needs a gateway customer; a tenant without one is synced first and the new customer
 * id is stored on the tenant.
 */
@Service
public class CheckoutService {

  private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

  private final TenantStore tenants;
  private final PlanCatalog plans;
  private final PaymentGatewayPort gateway;

  public CheckoutService(TenantStore tenants, PlanCatalog plans, PaymentGatewayPort gateway) {
    this.tenants = tenants;
    this.plans = plans;
    this.gateway = gateway;
  }

  public PaymentGatewayPort.CheckoutSession createCheckout(UUID tenantId, PlanTier tier, String customerEmail,
                                                           String successUrl) {
    Tenant tenant = tenants.findById(tenantId).orElseThrow(() -> NotFoundException.of("tenant", tenantId));
    Plan plan = plans.findCurrentByTier(tier)
        .orElseThrow(() -> new NotFoundException("No current plan for tier " + tier.code()));
    if (plan.externalProductId() == null || plan.externalProductId().isBlank()) {
      throw new InvalidStateException("Plan " + plan.name() + " is not sold through the gateway");
    }
    PaymentGatewayPort.CheckoutSession session =
        gateway.createCheckoutSession(tenant.id(), plan.externalProductId(), customerEmail, successUrl);
    log.info("Checkout session created. tenantId={} tier={} sessionId={}", tenantId, tier.code(), session.id());
    return session;
  }

  public String portalUrl(UUID tenantId) {
    Tenant tenant = tenants.findById(tenantId).orElseThrow(() -> NotFoundException.of("tenant", tenantId));
    String customerId = tenant.externalCustomerId();
    if (customerId == null || customerId.isBlank()) {
      customerId = gateway.syncCustomer(tenant.id(), null, tenant.name());
      tenants.setExternalCustomerId(tenant.id(), customerId);
    }
    return gateway.billingPortalUrl(customerId);
  }
}
