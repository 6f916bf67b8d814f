package com.boxline.billing.application.planchange;

import com.boxline.billing.domain.model.PlanChangeRequest;
import com.boxline.billing.domain.model.Subscription;
import com.boxline.billing.domain.model.SubscriptionChange;
import com.boxline.billing.domain.pricing.Proration;

/** An approved plan change with everything it wrote. */
public record PlanChangeResult(
        PlanChangeRequest request,
        Subscription subscription,
        SubscriptionChange change,
        Proration proration
) {
}
