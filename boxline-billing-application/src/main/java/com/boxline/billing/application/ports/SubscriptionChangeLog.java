package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.SubscriptionChange;

import java.util.List;
import java.util.UUID;

public interface SubscriptionChangeLog {

    void append(SubscriptionChange change);

    List<SubscriptionChange> findByTenant(UUID tenantId);
}
