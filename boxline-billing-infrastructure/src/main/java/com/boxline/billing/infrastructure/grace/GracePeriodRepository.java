package com.boxline.billing.infrastructure.grace;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface GracePeriodRepository
    extends JpaRepository<GracePeriodEntity, UUID>, GracePeriodRepositoryCustom {

  Optional<GracePeriodEntity> findFirstByTenantIdAndReasonAndResolvedFalseOrderByOpenedAtDesc(UUID tenantId,
                                                                                             String reason);

  List<GracePeriodEntity> findByTenantIdAndResolvedFalseAndReasonIn(UUID tenantId, Collection<String> reasons);

  List<GracePeriodEntity> findByResolvedFalseAndEndsAtBetweenOrderByEndsAtAsc(Instant from, Instant to);

  List<GracePeriodEntity> findByResolvedFalseAndAutoResolveTrueAndEndsAtBeforeOrderByEndsAtAsc(Instant now,
                                                                                              Pageable page);

  List<GracePeriodEntity> findByTenantIdOrderByOpenedAtDesc(UUID tenantId);

  /** Compare-and-set on {@code resolved = false}; a second resolver updates nothing. */
  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("""
      UPDATE GracePeriodEntity g
      SET g.resolved = true,
          g.resolvedAt = :resolvedAt,
          g.resolution = :resolution,
          g.resolvedBy = :resolvedBy,
          g.autoResolved = :autoResolved
      WHERE g.id = :id
        AND g.resolved = false
      """)
  int markResolved(@Param("id") UUID id,
                   @Param("resolvedAt") Instant resolvedAt,
                   @Param("resolution") String resolution,
                   @Param("resolvedBy") String resolvedBy,
                   @Param("autoResolved") boolean autoResolved);
}
