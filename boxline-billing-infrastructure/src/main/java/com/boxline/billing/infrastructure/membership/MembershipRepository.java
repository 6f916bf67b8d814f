package com.boxline.billing.infrastructure.membership;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface MembershipRepository extends JpaRepository<MembershipEntity, UUID> {

  long countByTenantIdAndRoleAndActiveTrue(UUID tenantId, String role);
}
