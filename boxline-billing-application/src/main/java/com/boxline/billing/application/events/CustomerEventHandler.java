package com.boxline.billing.application.events;

import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.domain.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/** Links the gateway customer to the tenant on customer.updated and checkout.completed. */
public final class CustomerEventHandler implements BillingEventHandler {

    private static final Logger log = LoggerFactory.getLogger(CustomerEventHandler.class);

    static final String CUSTOMER_UPDATED = "customer.updated";
    static final String CHECKOUT_COMPLETED = "checkout.completed";

    private final TenantStore tenants;

    public CustomerEventHandler(TenantStore tenants) {
        this.tenants = Objects.requireNonNull(tenants, "tenants");
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(CUSTOMER_UPDATED, CHECKOUT_COMPLETED);
    }

    @Override
    public void handle(InboundEvent event, UUID tenantId) {
        if (tenantId == null) {
            throw NotFoundException.of("tenant for event", event.id());
        }
        String customerId = CUSTOMER_UPDATED.equals(event.type())
                ? JsonFields.firstText(event.data(), "id", "customer_id")
                : JsonFields.text(event.data(), "customer_id");
        if (customerId == null) {
            log.info("Customer event without customer id. eventId={} type={}", event.id(), event.type());
            return;
        }
        tenants.setExternalCustomerId(tenantId, customerId);
        log.info("Gateway customer linked. tenantId={} customerId={} eventId={}", tenantId, customerId, event.id());
    }
}
