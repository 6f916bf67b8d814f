package com.boxline.billing.application.ports;

import com.boxline.billing.application.notify.BillingNotification;

/**
 * Outbound notification service. Implementations may throw; callers treat every failure as non-fatal.
 */
public interface NotificationPort {

    void createNotification(BillingNotification notification);
}
