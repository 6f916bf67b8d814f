package com.boxline.worker.jobs;

import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.worker.metrics.WorkerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Daily grace sweep: closes expired auto-resolve periods as {@code expired}, then warns tenants
 * whose periods end within the warning window.
 */
@Component
public class GracePeriodSweepJob {

  private static final Logger log = LoggerFactory.getLogger(GracePeriodSweepJob.class);

  static final String NAME = "grace_sweep";

  public record SweepResult(int autoResolved, int warned) {}

  private final GracePeriodManager gracePeriods;
  private final BillingNotifier notifier;
  private final JobRunner runner;
  private final WorkerMetrics metrics;
  private final Clock clock;
  private final int warnDaysAhead;
  private final int resolveLimit;

  public GracePeriodSweepJob(
      GracePeriodManager gracePeriods,
      BillingNotifier notifier,
      JobRunner runner,
      WorkerMetrics metrics,
      Clock clock,
      @Value("${boxline.worker.grace-warn-days:3}") int warnDaysAhead,
      @Value("${boxline.worker.grace-resolve-limit:500}") int resolveLimit
  ) {
    this.gracePeriods = gracePeriods;
    this.notifier = notifier;
    this.runner = runner;
    this.metrics = metrics;
    this.clock = clock;
    this.warnDaysAhead = warnDaysAhead;
    this.resolveLimit = resolveLimit;
  }

  @Scheduled(cron = "${boxline.worker.grace-sweep-cron:0 0 1 * * *}", zone = "UTC")
  public void tick() {
    run();
  }

  Optional<SweepResult> run() {
    return runner.run(NAME, span -> {
      int resolved = gracePeriods.autoResolveExpired(resolveLimit);

      Instant now = clock.instant();
      List<GracePeriod> expiring = gracePeriods.sweepExpiring(warnDaysAhead);
      int warned = 0;
      for (GracePeriod gp : expiring) {
        notifier.gracePeriodExpiring(gp, gp.daysRemaining(now));
        warned++;
      }

      span.setAttribute("boxline.grace.auto_resolved", resolved);
      span.setAttribute("boxline.grace.warned", warned);
      metrics.graceSwept(resolved, warned);
      log.info("Grace sweep done. autoResolved={} warned={}", resolved, warned);
      return new SweepResult(resolved, warned);
    });
  }
}
