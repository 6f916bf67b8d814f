package com.boxline.billing.infrastructure.gateway;

import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.domain.ExternalServiceException;

import java.util.UUID;

/**
 * Stands in when no gateway access token is configured. Every call fails the way an unreachable
 * gateway would, so callers keep their error paths.
 */
public class UnconfiguredPaymentGateway implements PaymentGatewayPort {

  private static ExternalServiceException unavailable() {
    return new ExternalServiceException("gateway", "payment gateway is not configured (boxline.gateway.access-token)");
  }

  @Override
  public CheckoutSession createCheckoutSession(UUID tenantId, String externalProductId, String customerEmail,
                                               String successUrl) {
    throw unavailable();
  }

  @Override
  public String billingPortalUrl(String externalCustomerId) {
    throw unavailable();
  }

  @Override
  public void updateSubscription(String externalSubscriptionId, String externalProductId, boolean prorateNow) {
    throw unavailable();
  }

  @Override
  public void cancelSubscription(String externalSubscriptionId, boolean atPeriodEnd) {
    throw unavailable();
  }

  @Override
  public void resumeSubscription(String externalSubscriptionId) {
    throw unavailable();
  }

  @Override
  public void revokeSubscription(String externalSubscriptionId) {
    throw unavailable();
  }

  @Override
  public String syncCustomer(UUID tenantId, String email, String name) {
    throw unavailable();
  }

  @Override
  public Invoice fetchInvoice(String externalInvoiceId) {
    throw unavailable();
  }
}
