package com.boxline.billing.application.grace;

import com.boxline.billing.domain.model.GracePeriod;

/**
 * Result of {@link GracePeriodManager#open}. {@code wasExisting} is true when an open period for the
 * same tenant and reason was returned instead of creating one.
 */
public record GraceOpenResult(GracePeriod gracePeriod, boolean wasExisting) {

    public static GraceOpenResult created(GracePeriod gp) {
        return new GraceOpenResult(gp, false);
    }

    public static GraceOpenResult existing(GracePeriod gp) {
        return new GraceOpenResult(gp, true);
    }
}
