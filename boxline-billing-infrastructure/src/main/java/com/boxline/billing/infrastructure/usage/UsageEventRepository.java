package com.boxline.billing.infrastructure.usage;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface UsageEventRepository extends JpaRepository<UsageEventEntity, UUID> {

  List<UsageEventEntity> findByTenantIdOrderByCreatedAtDesc(UUID tenantId, Pageable page);
}
