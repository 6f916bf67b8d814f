package com.boxline.billing.application.overage;

import com.boxline.billing.domain.model.BillingOrder;
import com.boxline.billing.domain.model.OverageBillingRecord;

/**
 * Overage billed for one tenant and period.
 *
 * @param record   null when no role was over its limit
 * @param order    null when no order was (or needed to be) created
 * @param existing true when the record already existed for the period
 */
public record OverageCharge(OverageBillingRecord record, BillingOrder order, boolean existing) {

    public static OverageCharge none() {
        return new OverageCharge(null, null, false);
    }

    public boolean hasCharge() {
        return record != null && record.totalAmount() > 0;
    }

    public long amount() {
        return record == null ? 0 : record.totalAmount();
    }
}
