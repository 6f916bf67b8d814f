package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.PlanChangeStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PlanChangeRequestStore {

    PlanChangeRequest insert(PlanChangeRequest request);

    Optional<PlanChangeRequest> findById(UUID id);

    List<PlanChangeRequest> findPendingByTenant(UUID tenantId);

    /**
     * Compare-and-set: writes {@code updated} only if the stored status is still {@code expected}.
     */
    boolean transition(PlanChangeStatus expected, PlanChangeRequest updated);
}
