package com.boxline.worker.jobs;

import com.boxline.billing.application.Errors;
import com.boxline.worker.metrics.WorkerMetrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs one scheduled job: span {@code billing.job.<name>}, MDC key {@code job}, duration metric.
 *
 * A failing run is logged and recorded on the span; it never propagates into the scheduler thread,
 * so the next tick runs normally.
 */
@Component
public class JobRunner {

  private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

  public static final String MDC_JOB = "job";

  private final WorkerMetrics metrics;
  private final Tracer tracer;

  @Autowired
  public JobRunner(WorkerMetrics metrics) {
    this(metrics, GlobalOpenTelemetry.getTracer("boxline-worker"));
  }

  JobRunner(WorkerMetrics metrics, Tracer tracer) {
    this.metrics = metrics;
    this.tracer = tracer;
  }

  public <T> Optional<T> run(String job, Function<Span, T> work) {
    Span span = tracer.spanBuilder("billing.job." + job)
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute("boxline.job", job)
        .startSpan();
    long started = System.nanoTime();
    MDC.put(MDC_JOB, job);
    try (Scope scope = span.makeCurrent()) {
      log.info("Job started. job={}", job);
      T result = work.apply(span);
      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      metrics.jobFinished(job, true, elapsed);
      log.info("Job finished. job={} tookMs={}", job, elapsed.toMillis());
      return Optional.ofNullable(result);
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR, Errors.safeError(e));
      metrics.jobFinished(job, false, Duration.ofNanos(System.nanoTime() - started));
      log.error("Job failed. job={} err={}", job, Errors.safeError(e), e);
      return Optional.empty();
    } finally {
      span.end();
      MDC.remove(MDC_JOB);
    }
  }
}
