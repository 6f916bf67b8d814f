package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.PlanTier;

import java.util.Optional;
import java.util.UUID;

public interface PlanCatalog {

    Optional<Plan> findById(UUID id);

    Optional<Plan> findCurrentByTier(PlanTier tier);

    /** Current plan version sold under the gateway product id. */
    Optional<Plan> findCurrentByExternalProductId(String externalProductId);
}
