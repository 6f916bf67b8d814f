package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionStore {

    Optional<Subscription> findById(UUID id);

    Optional<Subscription> findByExternalId(String externalSubscriptionId);

    /** The tenant's subscription with status active, if any. */
    Optional<Subscription> findActiveByTenant(UUID tenantId);

    /** Most recently updated non-terminal subscription (trial, active, past_due, paused). */
    Optional<Subscription> findCurrentByTenant(UUID tenantId);

    /** Most recently updated subscription regardless of status. */
    Optional<Subscription> findLatestByTenant(UUID tenantId);

    List<Subscription> findByTenantAndStatus(UUID tenantId, SubscriptionStatus status);

    List<Subscription> findAllActive();

    Subscription save(Subscription subscription);
}
