package com.boxline.billing.infrastructure.planchange;

import com.boxline.billing.application.ports.PlanChangeRequestStore;
import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.PlanChangeStatus;
import com.boxline.billing.domain.model.PlanChangeType;
import com.boxline.billing.domain.model.ProrationType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class DbPlanChangeRequestStore implements PlanChangeRequestStore {

  private final PlanChangeRequestRepository requests;

  public DbPlanChangeRequestStore(PlanChangeRequestRepository requests) {
    this.requests = requests;
  }

  @Override
  public PlanChangeRequest insert(PlanChangeRequest r) {
    PlanChangeRequestEntity e = new PlanChangeRequestEntity();
    e.setId(r.id());
    e.setTenantId(r.tenantId());
    e.setSubscriptionId(r.subscriptionId());
    e.setFromPlanId(r.fromPlanId());
    e.setToPlanId(r.toPlanId());
    e.setChangeType(r.changeType().code());
    e.setProrationType(r.prorationType().code());
    e.setStatus(r.status().code());
    e.setRequestedEffectiveDate(r.requestedEffectiveDate());
    e.setRequestedBy(r.requestedBy());
    e.setRequestedAt(r.requestedAt());
    e.setDecidedBy(r.decidedBy());
    e.setDecidedAt(r.decidedAt());
    e.setProratedAmount(r.proratedAmount());
    e.setCancelReason(r.cancelReason());
    return toDomain(requests.saveAndFlush(e));
  }

  @Override
  public Optional<PlanChangeRequest> findById(UUID id) {
    return requests.findById(id).map(DbPlanChangeRequestStore::toDomain);
  }

  @Override
  public List<PlanChangeRequest> findPendingByTenant(UUID tenantId) {
    return requests.findByTenantIdAndStatusOrderByRequestedAtAsc(tenantId, PlanChangeStatus.PENDING.code())
        .stream()
        .map(DbPlanChangeRequestStore::toDomain)
        .toList();
  }

  @Override
  public boolean transition(PlanChangeStatus expected, PlanChangeRequest updated) {
    return requests.transition(updated.id(), expected.code(), updated.status().code(), updated.decidedBy(),
        updated.decidedAt(), updated.proratedAmount(), updated.cancelReason()) == 1;
  }

  static PlanChangeRequest toDomain(PlanChangeRequestEntity e) {
    return new PlanChangeRequest(
        e.getId(),
        e.getTenantId(),
        e.getSubscriptionId(),
        e.getFromPlanId(),
        e.getToPlanId(),
        PlanChangeType.fromCode(e.getChangeType()),
        ProrationType.fromCode(e.getProrationType()),
        PlanChangeStatus.fromCode(e.getStatus()),
        e.getRequestedEffectiveDate(),
        e.getRequestedBy(),
        e.getRequestedAt(),
        e.getDecidedBy(),
        e.getDecidedAt(),
        e.getProratedAmount(),
        e.getCancelReason()
    );
  }
}
