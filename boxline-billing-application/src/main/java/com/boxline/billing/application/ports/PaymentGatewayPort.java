package com.boxline.billing.application.ports;

import com.boxline.billing.domain.ExternalServiceException;

import java.time.Instant;
import java.util.UUID;

/**
 * Narrow view of the payment gateway. Every method may throw {@link ExternalServiceException}.
 */
public interface PaymentGatewayPort {

    CheckoutSession createCheckoutSession(UUID tenantId, String externalProductId, String customerEmail,
                                          String successUrl);

    String billingPortalUrl(String externalCustomerId);

    /** Switches the subscription to another product. */
    void updateSubscription(String externalSubscriptionId, String externalProductId, boolean prorateNow);

    void cancelSubscription(String externalSubscriptionId, boolean atPeriodEnd);

    /** Withdraws a pending end-of-period cancellation. */
    void resumeSubscription(String externalSubscriptionId);

    /** Ends the subscription and access immediately. */
    void revokeSubscription(String externalSubscriptionId);

    /** Creates or updates the gateway customer for a tenant and returns its id. */
    String syncCustomer(UUID tenantId, String email, String name);

    Invoice fetchInvoice(String externalInvoiceId);

    record CheckoutSession(String id, String url, Instant expiresAt) {
    }

    record Invoice(String id, String status, long amount, String currency, Instant paidAt) {
    }
}
