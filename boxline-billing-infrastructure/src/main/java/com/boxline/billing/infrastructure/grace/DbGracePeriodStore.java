package com.boxline.billing.infrastructure.grace;

import com.boxline.billing.application.ports.GracePeriodStore;
import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.GraceSeverity;
import com.boxline.billing.infrastructure.json.AttributesJson;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: grace_periods table behind {@link GracePeriodStore}.
 */
@Component
public class DbGracePeriodStore implements GracePeriodStore {

  private final GracePeriodRepository periods;
  private final AttributesJson json;

  public DbGracePeriodStore(GracePeriodRepository periods, AttributesJson json) {
    this.periods = periods;
    this.json = json;
  }

  @Override
  public Optional<GracePeriod> findById(UUID id) {
    return periods.findById(id).map(this::toDomain);
  }

  @Override
  public Optional<GracePeriod> findUnresolved(UUID tenantId, GraceReason reason) {
    return periods.findFirstByTenantIdAndReasonAndResolvedFalseOrderByOpenedAtDesc(tenantId, reason.code())
        .map(this::toDomain);
  }

  @Override
  public InsertResult<GracePeriod> insertIfNoneUnresolved(GracePeriod gracePeriod) {
    if (periods.insertIfNoneUnresolved(toEntity(gracePeriod))) {
      return InsertResult.inserted(gracePeriod);
    }
    GracePeriod existing = findUnresolved(gracePeriod.tenantId(), gracePeriod.reason())
        .orElseThrow(() -> new IllegalStateException("grace period conflict without an unresolved row: tenantId="
            + gracePeriod.tenantId() + " reason=" + gracePeriod.reason().code()));
    return InsertResult.existing(existing);
  }

  @Override
  public boolean markResolved(GracePeriod resolved) {
    return periods.markResolved(resolved.id(), resolved.resolvedAt(), resolved.resolution(),
        resolved.resolvedBy(), resolved.autoResolved()) == 1;
  }

  @Override
  public List<GracePeriod> findUnresolvedByTenant(UUID tenantId, Collection<GraceReason> reasons) {
    if (reasons == null || reasons.isEmpty()) return List.of();
    List<String> codes = reasons.stream().map(GraceReason::code).toList();
    return periods.findByTenantIdAndResolvedFalseAndReasonIn(tenantId, codes).stream()
        .map(this::toDomain)
        .toList();
  }

  @Override
  public List<GracePeriod> findUnresolvedEndingBetween(Instant from, Instant to) {
    return periods.findByResolvedFalseAndEndsAtBetweenOrderByEndsAtAsc(from, to).stream()
        .map(this::toDomain)
        .toList();
  }

  @Override
  public List<GracePeriod> findExpiredAutoResolvable(Instant now, int limit) {
    return periods.findByResolvedFalseAndAutoResolveTrueAndEndsAtBeforeOrderByEndsAtAsc(now,
            PageRequest.of(0, Math.max(1, limit))).stream()
        .map(this::toDomain)
        .toList();
  }

  @Override
  public List<GracePeriod> findByTenant(UUID tenantId) {
    return periods.findByTenantIdOrderByOpenedAtDesc(tenantId).stream()
        .map(this::toDomain)
        .toList();
  }

  private GracePeriod toDomain(GracePeriodEntity e) {
    return new GracePeriod(
        e.getId(),
        e.getTenantId(),
        GraceReason.fromCode(e.getReason()),
        GraceSeverity.fromCode(e.getSeverity()),
        e.getOpenedAt(),
        e.getEndsAt(),
        e.isAutoResolve(),
        json.read(e.getContext()),
        e.isResolved(),
        e.getResolvedAt(),
        e.getResolution(),
        e.getResolvedBy(),
        e.isAutoResolved()
    );
  }

  private GracePeriodEntity toEntity(GracePeriod d) {
    GracePeriodEntity e = new GracePeriodEntity();
    e.setId(d.id());
    e.setTenantId(d.tenantId());
    e.setReason(d.reason().code());
    e.setSeverity(d.severity().code());
    e.setOpenedAt(d.openedAt());
    e.setEndsAt(d.endsAt());
    e.setAutoResolve(d.autoResolve());
    e.setContext(json.write(d.context()));
    e.setResolved(d.resolved());
    e.setResolvedAt(d.resolvedAt());
    e.setResolution(d.resolution());
    e.setResolvedBy(d.resolvedBy());
    e.setAutoResolved(d.autoResolved());
    return e;
  }
}
