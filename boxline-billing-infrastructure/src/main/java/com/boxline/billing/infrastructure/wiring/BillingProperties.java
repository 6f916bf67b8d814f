package com.boxline.billing.infrastructure.wiring;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * {@code boxline.billing.*}
 */
@ConfigurationProperties(prefix = "boxline.billing")
public record BillingProperties(
    @DefaultValue("3") int eventMaxRetries,
    @DefaultValue("5m") Duration retryBackoffBase,
    @DefaultValue("15m") Duration staleClaimAfter,
    @DefaultValue("USD") String currency,
    @DefaultValue("100") long defaultAthleteRate,
    @DefaultValue("100") long defaultCoachRate,
    @DefaultValue("/settings/billing") String billingUrl,
    @DefaultValue Overage overage
) {

  public record Overage(
      @DefaultValue("10") int batchSize,
      @DefaultValue("1s") Duration batchDelay,
      @DefaultValue("60s") Duration tenantTimeout
  ) {}
}
