package com.boxline.billing.infrastructure.planchange;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface PlanChangeRequestRepository extends JpaRepository<PlanChangeRequestEntity, UUID> {

  List<PlanChangeRequestEntity> findByTenantIdAndStatusOrderByRequestedAtAsc(UUID tenantId, String status);

  /**
   * Moves a request out of {@code expected}. Zero rows means someone else decided it first.
   */
  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("""
      UPDATE PlanChangeRequestEntity r
      SET r.status = :status,
          r.decidedBy = :decidedBy,
          r.decidedAt = :decidedAt,
          r.proratedAmount = :proratedAmount,
          r.cancelReason = :cancelReason
      WHERE r.id = :id
        AND r.status = :expected
      """)
  int transition(@Param("id") UUID id,
                 @Param("expected") String expected,
                 @Param("status") String status,
                 @Param("decidedBy") String decidedBy,
                 @Param("decidedAt") Instant decidedAt,
                 @Param("proratedAmount") Long proratedAmount,
                 @Param("cancelReason") String cancelReason);
}
