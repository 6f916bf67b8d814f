package com.boxline.billing.application.usage;

import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.MemberRole;
import com.boxline.billing.domain.usage.UsageSnapshot;

import java.util.List;

/**
 * What {@link UsageLedger#enforceLimits} did.
 *
 * @param skipReason set when enforcement did not run (overage enabled, no seat-adding trigger)
 */
public record LimitCheck(
        UsageSnapshot usage,
        List<MemberRole> exceeded,
        List<MemberRole> approaching,
        List<GracePeriod> gracePeriods,
        String skipReason
) {

    public static LimitCheck skipped(UsageSnapshot usage, String reason) {
        return new LimitCheck(usage, List.of(), List.of(), List.of(), reason);
    }

    public boolean skipped() {
        return skipReason != null;
    }
}
