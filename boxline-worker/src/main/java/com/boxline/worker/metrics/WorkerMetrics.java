package com.boxline.worker.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker metrics.
 *
 * Exposes:
 * - boxline.worker.job.duration (timer, tags job/outcome)
 * - boxline.worker.job.last_success (gauge, epoch seconds, tag job)
 * - boxline.worker.events.retried (counter, tag outcome)
 * - boxline.worker.overage.records_created / boxline.worker.overage.amount_billed
 * - boxline.worker.grace.auto_resolved / boxline.worker.grace.expiry_warnings
 */
@Component
public class WorkerMetrics {

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> lastSuccess = new ConcurrentHashMap<>();

  private final Counter retrySucceeded;
  private final Counter retryFailed;
  private final Counter overageRecords;
  private final Counter overageAmount;
  private final Counter graceAutoResolved;
  private final Counter graceWarnings;

  public WorkerMetrics(MeterRegistry registry) {
    this.registry = registry;

    this.retrySucceeded = Counter.builder("boxline.worker.events.retried")
        .tag("outcome", "succeeded")
        .description("Failed billing events that succeeded on retry")
        .register(registry);
    this.retryFailed = Counter.builder("boxline.worker.events.retried")
        .tag("outcome", "failed")
        .description("Failed billing events that failed again on retry")
        .register(registry);
    this.overageRecords = Counter.builder("boxline.worker.overage.records_created")
        .description("Overage billing records created by monthly runs")
        .register(registry);
    this.overageAmount = Counter.builder("boxline.worker.overage.amount_billed")
        .description("Overage billed by monthly runs, minor units")
        .register(registry);
    this.graceAutoResolved = Counter.builder("boxline.worker.grace.auto_resolved")
        .description("Expired grace periods closed by the sweep")
        .register(registry);
    this.graceWarnings = Counter.builder("boxline.worker.grace.expiry_warnings")
        .description("Expiry warnings sent for grace periods about to end")
        .register(registry);
  }

  public void jobFinished(String job, boolean success, Duration elapsed) {
    Timer.builder("boxline.worker.job.duration")
        .tag("job", job)
        .tag("outcome", success ? "success" : "failure")
        .register(registry)
        .record(elapsed);
    if (success) {
      lastSuccess.computeIfAbsent(job, j -> registry.gauge("boxline.worker.job.last_success",
              Tags.of("job", j), new AtomicLong()))
          .set(System.currentTimeMillis() / 1000);
    }
  }

  public void eventRetries(long succeeded, long failed) {
    retrySucceeded.increment(succeeded);
    retryFailed.increment(failed);
  }

  public void overageBilled(int recordsCreated, long amount) {
    overageRecords.increment(recordsCreated);
    overageAmount.increment(amount);
  }

  public void graceSwept(int autoResolved, int warned) {
    graceAutoResolved.increment(autoResolved);
    graceWarnings.increment(warned);
  }
}
