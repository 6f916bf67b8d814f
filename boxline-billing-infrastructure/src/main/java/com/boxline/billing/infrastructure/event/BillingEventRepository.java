package com.boxline.billing.infrastructure.event;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface BillingEventRepository
    extends JpaRepository<BillingEventEntity, UUID>, BillingEventRepositoryCustom {

  Optional<BillingEventEntity> findByExternalId(String externalId);
}
