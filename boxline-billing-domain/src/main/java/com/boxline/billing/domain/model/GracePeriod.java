package com.boxline.billing.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Time-bounded remediation window.
 *
 * A period is open while it is unresolved and {@code endsAt >= now}. A zero-length period
 * (blocking reasons) is open only at the instant it was created.
 */
public record GracePeriod(
        UUID id,
        UUID tenantId,
        GraceReason reason,
        GraceSeverity severity,
        Instant openedAt,
        Instant endsAt,
        boolean autoResolve,
        Attributes context,
        boolean resolved,
        Instant resolvedAt,
        String resolution,
        String resolvedBy,
        boolean autoResolved
) {

    public GracePeriod {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(openedAt, "openedAt");
        Objects.requireNonNull(endsAt, "endsAt");
        context = context == null ? Attributes.empty() : context;
    }

    public boolean isOpenAt(Instant now) {
        return !resolved && !endsAt.isBefore(now);
    }

    public boolean isExpiredAt(Instant now) {
        return !resolved && endsAt.isBefore(now);
    }

    public long daysRemaining(Instant now) {
        if (!endsAt.isAfter(now)) {
            return 0;
        }
        long hours = Duration.between(now, endsAt).toHours();
        return (hours + 23) / 24;
    }

    public GracePeriod resolve(String resolutionText, String actor, boolean auto, Instant now) {
        return new GracePeriod(id, tenantId, reason, severity, openedAt, endsAt, autoResolve, context,
                true, now, resolutionText, actor, auto);
    }
}
