package com.boxline.billing.infrastructure.event;

import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.domain.model.BillingEvent;
import com.boxline.billing.domain.model.BillingEventStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(DbBillingEventStore.class)
@DisplayName("DbBillingEventStore")
class DbBillingEventStoreTest {

  private static final Instant T0 = Instant.parse("2025-03-10T12:00:00Z");

  @Autowired
  private DbBillingEventStore store;

  private BillingEvent pending(String externalId) {
    return BillingEvent.pending(UUID.randomUUID(), externalId, "subscription.updated", null, "{\"id\":\"" + externalId + "\"}",
        3, T0);
  }

  @Test
  @DisplayName("second insert with the same external id returns the first row")
  void insertIfAbsentIsConflictAware() {
    InsertResult<BillingEvent> first = store.insertIfAbsent(pending("evt_1"));
    InsertResult<BillingEvent> second = store.insertIfAbsent(pending("evt_1"));

    assertThat(first.inserted()).isTrue();
    assertThat(second.inserted()).isFalse();
    assertThat(second.value().id()).isEqualTo(first.value().id());
    assertThat(second.value().status()).isEqualTo(BillingEventStatus.PENDING);
  }

  @Test
  @DisplayName("only one caller can claim a pending event")
  void claimIsExclusive() {
    BillingEvent e = store.insertIfAbsent(pending("evt_2")).value();

    assertThat(store.claim(e.id(), T0, T0.minus(Duration.ofMinutes(15)))).isTrue();
    assertThat(store.claim(e.id(), T0, T0.minus(Duration.ofMinutes(15)))).isFalse();
    assertThat(store.findById(e.id())).get()
        .extracting(BillingEvent::status)
        .isEqualTo(BillingEventStatus.PROCESSING);
  }

  @Test
  @DisplayName("a processing claim older than the stale threshold can be taken over")
  void staleClaimIsReclaimable() {
    BillingEvent e = store.insertIfAbsent(pending("evt_3")).value();
    store.claim(e.id(), T0, T0.minus(Duration.ofMinutes(15)));

    Instant later = T0.plus(Duration.ofMinutes(20));
    assertThat(store.claim(e.id(), later, later.minus(Duration.ofMinutes(15)))).isTrue();
  }

  @Test
  @DisplayName("processed events are never claimed again")
  void processedIsTerminal() {
    BillingEvent e = store.insertIfAbsent(pending("evt_4")).value();
    UUID tenantId = UUID.randomUUID();
    store.claim(e.id(), T0, T0);
    store.markProcessed(e.id(), true, tenantId, T0.plusSeconds(1));

    BillingEvent done = store.findByExternalId("evt_4").orElseThrow();
    assertThat(done.processed()).isTrue();
    assertThat(done.handled()).isTrue();
    assertThat(done.tenantId()).isEqualTo(tenantId);
    assertThat(done.processedAt()).isEqualTo(T0.plusSeconds(1));
    assertThat(store.claim(e.id(), T0.plusSeconds(5), T0.plusSeconds(5))).isFalse();
  }

  @Test
  @DisplayName("failures increment the retry count and become retryable once due")
  void failedEventsAreRetryableWhenDue() {
    BillingEvent e = store.insertIfAbsent(pending("evt_5")).value();
    store.claim(e.id(), T0, T0);
    store.markFailed(e.id(), "boom", "trace", T0.plus(Duration.ofMinutes(10)), T0);

    BillingEvent failed = store.findById(e.id()).orElseThrow();
    assertThat(failed.status()).isEqualTo(BillingEventStatus.FAILED);
    assertThat(failed.retryCount()).isEqualTo(1);
    assertThat(failed.lastError()).isEqualTo("boom");

    assertThat(store.findRetryable(3, T0.plus(Duration.ofMinutes(5)), 10)).isEmpty();
    List<BillingEvent> due = store.findRetryable(3, T0.plus(Duration.ofMinutes(10)), 10);
    assertThat(due).extracting(BillingEvent::externalId).containsExactly("evt_5");
  }

  @Test
  @DisplayName("events that used up their retries are not returned")
  void exhaustedEventsAreSkipped() {
    BillingEvent e = store.insertIfAbsent(pending("evt_6")).value();
    for (int i = 0; i < 3; i++) {
      store.claim(e.id(), T0, T0);
      store.markFailed(e.id(), "boom " + i, null, T0, T0);
    }

    assertThat(store.findById(e.id()).orElseThrow().retryCount()).isEqualTo(3);
    assertThat(store.findRetryable(3, T0.plus(Duration.ofDays(1)), 10)).isEmpty();
  }

  @Test
  @DisplayName("null error fields and retry time are stored as null and the event is due at once")
  void failureWithoutDetailsIsRetryableImmediately() {
    BillingEvent e = store.insertIfAbsent(pending("evt_7")).value();
    store.claim(e.id(), T0, T0);
    store.markFailed(e.id(), null, null, null, T0);

    BillingEvent failed = store.findById(e.id()).orElseThrow();
    assertThat(failed.tenantId()).isNull();
    assertThat(failed.lastError()).isNull();
    assertThat(failed.lastErrorTrace()).isNull();
    assertThat(failed.nextRetryAt()).isNull();
    assertThat(store.findRetryable(3, T0, 10)).extracting(BillingEvent::externalId).containsExactly("evt_7");
  }
}
