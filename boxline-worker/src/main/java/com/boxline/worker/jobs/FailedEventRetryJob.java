package com.boxline.worker.jobs;

import com.boxline.billing.application.events.BillingEventService;
import com.boxline.billing.application.events.RetryResult;
import com.boxline.worker.metrics.WorkerMetrics;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/** Re-runs failed billing events that are due and still have attempts left. */
@Component
public class FailedEventRetryJob {

  static final String NAME = "failed_event_retry";

  private final BillingEventService events;
  private final JobRunner runner;
  private final WorkerMetrics metrics;

  public FailedEventRetryJob(BillingEventService events, JobRunner runner, WorkerMetrics metrics) {
    this.events = events;
    this.runner = runner;
    this.metrics = metrics;
  }

  @Scheduled(
      fixedDelayString = "${boxline.worker.retry-interval-ms:900000}",
      initialDelayString = "${boxline.worker.retry-initial-delay-ms:60000}"
  )
  public void tick() {
    run();
  }

  Optional<List<RetryResult>> run() {
    return runner.run(NAME, span -> {
      List<RetryResult> results = events.retryFailed(events.maxRetries());
      long ok = results.stream().filter(RetryResult::success).count();
      span.setAttribute("boxline.events.attempted", results.size());
      span.setAttribute("boxline.events.succeeded", ok);
      metrics.eventRetries(ok, results.size() - ok);
      return results;
    });
  }
}
