package com.boxline.billing.infrastructure.overage;

import com.boxline.billing.infrastructure.persistence.NativeParams;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class OverageBillingRepositoryImpl implements OverageBillingRepositoryCustom {

  @PersistenceContext
  private EntityManager em;

  @Override
  @Transactional
  public boolean insertIfAbsent(OverageBillingEntity e) {
    // Order, invoice and payment columns are filled in by later updates.
    Query q = em.createNativeQuery(
        "INSERT INTO overage_billing " +
            "(id, tenant_id, subscription_id, period_start, period_end, " +
            " athlete_count, athlete_limit, athlete_overage, athlete_rate, athlete_amount, " +
            " coach_count, coach_limit, coach_overage, coach_rate, coach_amount, " +
            " total_amount, currency, status, created_at) " +
            "VALUES (:id, :tenantId, " + NativeParams.ref("subscriptionId", e.getSubscriptionId()) +
            ", :periodStart, :periodEnd, " +
            " :athleteCount, :athleteLimit, :athleteOverage, :athleteRate, :athleteAmount, " +
            " :coachCount, :coachLimit, :coachOverage, :coachRate, :coachAmount, " +
            " :totalAmount, :currency, :status, :createdAt) " +
            "ON CONFLICT DO NOTHING"
    )
        .setParameter("id", e.getId())
        .setParameter("tenantId", e.getTenantId())
        .setParameter("periodStart", e.getPeriodStart())
        .setParameter("periodEnd", e.getPeriodEnd())
        .setParameter("athleteCount", e.getAthleteCount())
        .setParameter("athleteLimit", e.getAthleteLimit())
        .setParameter("athleteOverage", e.getAthleteOverage())
        .setParameter("athleteRate", e.getAthleteRate())
        .setParameter("athleteAmount", e.getAthleteAmount())
        .setParameter("coachCount", e.getCoachCount())
        .setParameter("coachLimit", e.getCoachLimit())
        .setParameter("coachOverage", e.getCoachOverage())
        .setParameter("coachRate", e.getCoachRate())
        .setParameter("coachAmount", e.getCoachAmount())
        .setParameter("totalAmount", e.getTotalAmount())
        .setParameter("currency", e.getCurrency())
        .setParameter("status", e.getStatus())
        .setParameter("createdAt", e.getCreatedAt());
    NativeParams.bind(q, "subscriptionId", e.getSubscriptionId());
    return q.executeUpdate() == 1;
  }
}
