package com.boxline.billing.infrastructure.subscription;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, UUID> {

  Optional<SubscriptionEntity> findByExternalSubscriptionId(String externalSubscriptionId);

  Optional<SubscriptionEntity> findFirstByTenantIdAndStatusOrderByLastSyncedAtDesc(UUID tenantId, String status);

  Optional<SubscriptionEntity> findFirstByTenantIdAndStatusInOrderByLastSyncedAtDesc(UUID tenantId,
                                                                                    Collection<String> statuses);

  Optional<SubscriptionEntity> findFirstByTenantIdOrderByLastSyncedAtDesc(UUID tenantId);

  List<SubscriptionEntity> findByTenantIdAndStatusOrderByLastSyncedAtDesc(UUID tenantId, String status);

  List<SubscriptionEntity> findByStatusOrderByCreatedAtAsc(String status);
}
