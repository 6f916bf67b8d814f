package com.boxline.billing.infrastructure.notify;

import com.boxline.billing.application.notify.BillingNotification;
import com.boxline.billing.application.ports.NotificationPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when no notification service is configured (local runs, tests).
 */
public class LoggingNotificationPort implements NotificationPort {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationPort.class);

  @Override
  public void createNotification(BillingNotification n) {
    log.info("Notification (not delivered). tenantId={} type={} dedup={} title={}",
        n.tenantId(), n.type(), n.deduplicationKey(), n.title());
  }
}
