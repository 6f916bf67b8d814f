package com.boxline.worker.jobs;

import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.overage.OverageRunSummary;
import com.boxline.worker.metrics.WorkerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Bills the previous calendar month's seat overage. Re-running for the same month creates nothing
 * new, so a missed or repeated tick is harmless.
 */
@Component
public class MonthlyOverageJob {

  private static final Logger log = LoggerFactory.getLogger(MonthlyOverageJob.class);

  static final String NAME = "monthly_overage";

  private final OverageBillingEngine overage;
  private final JobRunner runner;
  private final WorkerMetrics metrics;

  public MonthlyOverageJob(OverageBillingEngine overage, JobRunner runner, WorkerMetrics metrics) {
    this.overage = overage;
    this.runner = runner;
    this.metrics = metrics;
  }

  @Scheduled(cron = "${boxline.worker.overage-cron:0 0 2 1 * *}", zone = "UTC")
  public void tick() {
    run();
  }

  Optional<OverageRunSummary> run() {
    return runner.run(NAME, span -> {
      OverageRunSummary s = overage.processMonthlyOverageBilling();
      span.setAttribute("boxline.overage.period_start", s.period().start().toString());
      span.setAttribute("boxline.overage.tenants", s.results().size());
      span.setAttribute("boxline.overage.failed", s.failed());
      metrics.overageBilled(s.created(), s.totalAmount());
      if (s.failed() > 0) {
        log.warn("Overage run had failures. period={} failed={} succeeded={}",
            s.period().start(), s.failed(), s.succeeded());
      }
      return s;
    });
  }
}
