package com.boxline.billing.infrastructure.subscription;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SubscriptionChangeRepository extends JpaRepository<SubscriptionChangeEntity, UUID> {

  List<SubscriptionChangeEntity> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);
}
