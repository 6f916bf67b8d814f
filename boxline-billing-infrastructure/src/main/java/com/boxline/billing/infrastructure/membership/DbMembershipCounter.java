package com.boxline.billing.infrastructure.membership;

import com.boxline.billing.application.ports.MembershipCounter;
import com.boxline.billing.domain.model.MemberRole;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class DbMembershipCounter implements MembershipCounter {

  private final MembershipRepository memberships;

  public DbMembershipCounter(MembershipRepository memberships) {
    this.memberships = memberships;
  }

  @Override
  public int countActive(UUID tenantId, MemberRole role) {
    return Math.toIntExact(memberships.countByTenantIdAndRoleAndActiveTrue(tenantId, role.code()));
  }
}
