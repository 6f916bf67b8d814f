package com.boxline.billing.infrastructure.plan;

import com.boxline.billing.application.ports.PlanCatalog;
import com.boxline.billing.domain.model.Plan;
import com.boxline.billing.domain.model.PlanTier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class DbPlanCatalog implements PlanCatalog {

  private final PlanRepository plans;

  public DbPlanCatalog(PlanRepository plans) {
    this.plans = plans;
  }

  @Override
  public Optional<Plan> findById(UUID id) {
    return plans.findById(id).map(DbPlanCatalog::toDomain);
  }

  @Override
  public Optional<Plan> findCurrentByTier(PlanTier tier) {
    return plans.findFirstByTierAndCurrentTrueOrderByVersionDesc(tier.code()).map(DbPlanCatalog::toDomain);
  }

  @Override
  public Optional<Plan> findCurrentByExternalProductId(String externalProductId) {
    if (externalProductId == null || externalProductId.isBlank()) return Optional.empty();
    return plans.findFirstByExternalProductIdAndCurrentTrueOrderByVersionDesc(externalProductId)
        .map(DbPlanCatalog::toDomain);
  }

  static Plan toDomain(PlanEntity e) {
    return new Plan(
        e.getId(),
        PlanTier.fromCode(e.getTier()),
        e.getName(),
        e.getVersion(),
        e.isCurrent(),
        e.getAthleteLimit(),
        e.getCoachLimit(),
        e.getMonthlyPrice(),
        e.getAthleteOverageRate(),
        e.getCoachOverageRate(),
        e.getExternalProductId()
    );
  }
}
