package com.boxline.billing.infrastructure.plan;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface PlanRepository extends JpaRepository<PlanEntity, UUID> {

  Optional<PlanEntity> findFirstByTierAndCurrentTrueOrderByVersionDesc(String tier);

  Optional<PlanEntity> findFirstByExternalProductIdAndCurrentTrueOrderByVersionDesc(String externalProductId);
}
