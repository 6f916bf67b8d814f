package com.boxline.worker.jobs;

import com.boxline.billing.application.events.BillingEventService;
import com.boxline.billing.application.events.RetryResult;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.overage.OverageRunSummary;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.GracePeriod;
import com.boxline.billing.domain.model.GraceReason;
import com.boxline.billing.domain.model.GraceSeverity;
import com.boxline.worker.metrics.WorkerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerJobsTest {

  private static final Instant NOW = Instant.parse("2026-03-10T01:00:00Z");

  private SimpleMeterRegistry registry;
  private WorkerMetrics metrics;
  private JobRunner runner;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new WorkerMetrics(registry);
    runner = new JobRunner(metrics, OpenTelemetry.noop().getTracer("test"));
  }

  private double counter(String name, String... tags) {
    return registry.get(name).tags(tags).counter().count();
  }

  @Nested
  @DisplayName("monthly overage")
  class Overage {

    @Mock OverageBillingEngine engine;

    @Test
    void recordsCreatedRecordsAndAmount() {
      BillingPeriod feb = BillingPeriod.ofMonth(YearMonth.of(2026, 2));
      when(engine.processMonthlyOverageBilling())
          .thenReturn(new OverageRunSummary(feb, List.of(), 3, 0, 2, 1, 1500L));

      var out = new MonthlyOverageJob(engine, runner, metrics).run();

      assertThat(out).isPresent();
      assertThat(out.get().created()).isEqualTo(2);
      assertThat(counter("boxline.worker.overage.records_created")).isEqualTo(2.0);
      assertThat(counter("boxline.worker.overage.amount_billed")).isEqualTo(1500.0);
    }

    @Test
    void engineFailureDoesNotEscape() {
      when(engine.processMonthlyOverageBilling()).thenThrow(new IllegalStateException("boom"));

      assertThat(new MonthlyOverageJob(engine, runner, metrics).run()).isEmpty();
      assertThat(counter("boxline.worker.overage.records_created")).isZero();
    }
  }

  @Nested
  @DisplayName("failed event retry")
  class Retry {

    @Mock BillingEventService events;

    @Test
    void countsOutcomesAndUsesConfiguredMaxRetries() {
      when(events.maxRetries()).thenReturn(3);
      when(events.retryFailed(3)).thenReturn(List.of(
          RetryResult.succeeded(UUID.randomUUID(), "evt_1", "order.paid"),
          RetryResult.failed(UUID.randomUUID(), "evt_2", "order.paid", "still failing"),
          RetryResult.succeeded(UUID.randomUUID(), "evt_3", "subscription.updated")));

      var out = new FailedEventRetryJob(events, runner, metrics).run();

      assertThat(out).hasValueSatisfying(r -> assertThat(r).hasSize(3));
      assertThat(counter("boxline.worker.events.retried", "outcome", "succeeded")).isEqualTo(2.0);
      assertThat(counter("boxline.worker.events.retried", "outcome", "failed")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("grace sweep")
  class Sweep {

    @Mock GracePeriodManager gracePeriods;
    @Mock BillingNotifier notifier;

    private GracePeriodSweepJob job() {
      return new GracePeriodSweepJob(gracePeriods, notifier, runner, metrics,
          Clock.fixed(NOW, ZoneOffset.UTC), 3, 500);
    }

    private GracePeriod endingIn(Duration d) {
      return new GracePeriod(UUID.randomUUID(), UUID.randomUUID(), GraceReason.PAYMENT_FAILED,
          GraceSeverity.CRITICAL, NOW.minus(Duration.ofDays(4)), NOW.plus(d), true, Attributes.empty(),
          false, null, null, null, false);
    }

    @Test
    void autoResolvesThenWarnsWithRoundedUpDays() {
      GracePeriod soon = endingIn(Duration.ofHours(30));
      GracePeriod today = endingIn(Duration.ofHours(2));
      when(gracePeriods.autoResolveExpired(500)).thenReturn(4);
      when(gracePeriods.sweepExpiring(3)).thenReturn(List.of(soon, today));

      var out = job().run();

      assertThat(out).contains(new GracePeriodSweepJob.SweepResult(4, 2));
      verify(notifier).gracePeriodExpiring(soon, 2);
      verify(notifier).gracePeriodExpiring(today, 1);
      assertThat(counter("boxline.worker.grace.auto_resolved")).isEqualTo(4.0);
      assertThat(counter("boxline.worker.grace.expiry_warnings")).isEqualTo(2.0);
    }

    @Test
    void resolveFailureSkipsWarnings() {
      when(gracePeriods.autoResolveExpired(500)).thenThrow(new IllegalStateException("db down"));

      assertThat(job().run()).isEmpty();
      verify(notifier, never()).gracePeriodExpiring(any(), anyLong());
    }
  }
}
