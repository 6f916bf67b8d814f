package com.boxline.billing.domain.grace;

import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.GraceSeverity;

import java.time.Duration;

/**
 * Optional caller overrides for {@link GracePolicy}. Null fields keep the policy value.
 * {@code autoResolve} defaults to false; only periods that opt in are closed by the expiry sweep.
 */
public record GraceOverrides(GraceSeverity severity, Duration duration, Boolean autoResolve, Attributes context) {

    public static GraceOverrides none() {
        return new GraceOverrides(null, null, null, null);
    }

    public static GraceOverrides withContext(Attributes context) {
        return new GraceOverrides(null, null, null, context);
    }

    public boolean autoResolveOrDefault() {
        return autoResolve != null && autoResolve;
    }
}
