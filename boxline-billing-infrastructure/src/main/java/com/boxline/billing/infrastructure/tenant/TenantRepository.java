package com.boxline.billing.infrastructure.tenant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Billing writes touch only their own columns so that a webhook updating the plan and a
 * toggle of overage protection never overwrite each other.
 */
public interface TenantRepository extends JpaRepository<TenantEntity, UUID> {

  Optional<TenantEntity> findByExternalCustomerId(String externalCustomerId);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("""
      UPDATE TenantEntity t
      SET t.status = :status,
          t.subscriptionStatus = :subscriptionStatus,
          t.updatedAt = :now
      WHERE t.id = :id
      """)
  int updateBillingStatus(@Param("id") UUID id,
                          @Param("status") String status,
                          @Param("subscriptionStatus") String subscriptionStatus,
                          @Param("now") Instant now);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("""
      UPDATE TenantEntity t
      SET t.tier = :tier,
          t.athleteLimit = :athleteLimit,
          t.coachLimit = :coachLimit,
          t.updatedAt = :now
      WHERE t.id = :id
      """)
  int updatePlan(@Param("id") UUID id,
                 @Param("tier") String tier,
                 @Param("athleteLimit") int athleteLimit,
                 @Param("coachLimit") int coachLimit,
                 @Param("now") Instant now);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE TenantEntity t SET t.overageEnabled = :enabled, t.updatedAt = :now WHERE t.id = :id")
  int updateOverageEnabled(@Param("id") UUID id, @Param("enabled") boolean enabled, @Param("now") Instant now);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE TenantEntity t SET t.externalCustomerId = :customerId, t.updatedAt = :now WHERE t.id = :id")
  int updateExternalCustomerId(@Param("id") UUID id, @Param("customerId") String customerId,
                               @Param("now") Instant now);

  @Transactional
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE TenantEntity t SET t.nextBillingDate = :date, t.updatedAt = :now WHERE t.id = :id")
  int updateNextBillingDate(@Param("id") UUID id, @Param("date") Instant date, @Param("now") Instant now);
}
