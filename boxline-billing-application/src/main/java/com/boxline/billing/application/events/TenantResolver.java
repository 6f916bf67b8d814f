package com.boxline.billing.application.events;

import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.Tenant;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives the tenant of an event.
 *
 * Order:
 * 1. envelope metadata.tenantId
 * 2. data.metadata.tenantId or data.metadata.boxId
 * 3. local subscription by external subscription id
 * 4. tenant by external customer id
 */
public final class TenantResolver {

    private final SubscriptionStore subscriptions;
    private final TenantStore tenants;

    public TenantResolver(SubscriptionStore subscriptions, TenantStore tenants) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.tenants = Objects.requireNonNull(tenants, "tenants");
    }

    public Optional<UUID> resolve(InboundEvent event) {
        if (event.metadataTenantId() != null) {
            return Optional.of(event.metadataTenantId());
        }
        JsonNode data = event.data();

        JsonNode meta = JsonFields.object(data, "metadata");
        UUID fromMeta = JsonFields.uuid(meta, "tenantId");
        if (fromMeta == null) fromMeta = JsonFields.uuid(meta, "boxId");
        if (fromMeta != null) {
            return Optional.of(fromMeta);
        }

        String subscriptionId = event.type().startsWith("subscription.")
                ? JsonFields.firstText(data, "id", "subscription_id")
                : JsonFields.text(data, "subscription_id");
        if (subscriptionId != null) {
            Optional<UUID> bySub = subscriptions.findByExternalId(subscriptionId).map(Subscription::tenantId);
            if (bySub.isPresent()) {
                return bySub;
            }
        }

        String customerId = event.type().startsWith("customer.")
                ? JsonFields.firstText(data, "id", "customer_id")
                : JsonFields.text(data, "customer_id");
        if (customerId != null) {
            return tenants.findByExternalCustomerId(customerId).map(Tenant::id);
        }
        return Optional.empty();
    }
}
