package com.boxline.billing.infrastructure.overage;

import com.boxline.billing.application.ports.InsertResult;
import com.boxline.billing.domain.model.BillingOrder;
import com.boxline.billing.domain.model.BillingPeriod;
import com.boxline.billing.domain.model.OrderStatus;
import com.boxline.billing.domain.model.OverageBillingRecord;
import com.boxline.billing.domain.model.OverageStatus;
import com.boxline.billing.domain.model.RoleOverage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.YearMonth;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({DbOverageBillingStore.class, DbBillingOrderStore.class})
class DbOverageBillingStoreTest {

  private static final Instant T0 = Instant.parse("2025-03-01T02:00:00Z");
  private static final BillingPeriod FEBRUARY = BillingPeriod.ofMonth(YearMonth.of(2025, 2));

  @Autowired
  private DbOverageBillingStore records;

  @Autowired
  private DbBillingOrderStore orders;

  private OverageBillingRecord calculated(UUID tenantId) {
    RoleOverage athletes = RoleOverage.of(80, 75, 100);
    RoleOverage coaches = RoleOverage.of(3, 3, 100);
    return new OverageBillingRecord(UUID.randomUUID(), tenantId, null, FEBRUARY, athletes, coaches,
        athletes.amount() + coaches.amount(), "USD", OverageStatus.CALCULATED, null, null, null, T0, null);
  }

  @Test
  void onePeriodOneRecord() {
    UUID tenantId = UUID.randomUUID();
    InsertResult<OverageBillingRecord> first = records.insertIfAbsent(calculated(tenantId));
    InsertResult<OverageBillingRecord> second = records.insertIfAbsent(calculated(tenantId));

    assertThat(first.inserted()).isTrue();
    assertThat(second.inserted()).isFalse();
    assertThat(second.value().id()).isEqualTo(first.value().id());
    assertThat(second.value().athletes().overage()).isEqualTo(5);
    assertThat(second.value().totalAmount()).isEqualTo(500);
  }

  @Test
  void orderAndPaymentAreSavedOnTheRecord() {
    UUID tenantId = UUID.randomUUID();
    OverageBillingRecord record = records.insertIfAbsent(calculated(tenantId)).value();

    BillingOrder order = orders.save(new BillingOrder(UUID.randomUUID(), tenantId, BillingOrder.TYPE_OVERAGE,
        OrderStatus.PENDING, record.totalAmount(), "USD", "Overage February 2025", record.id(), null, T0, null));
    records.save(record.withOrder(order.id()));
    records.save(records.findById(record.id()).orElseThrow().markPaid("inv_42", T0.plusSeconds(3600)));

    OverageBillingRecord paid = records.findByTenantAndPeriod(tenantId, FEBRUARY).orElseThrow();
    assertThat(paid.status()).isEqualTo(OverageStatus.PAID);
    assertThat(paid.orderId()).isEqualTo(order.id());
    assertThat(paid.externalInvoiceId()).isEqualTo("inv_42");
    assertThat(records.findByTenant(tenantId)).hasSize(1);
    assertThat(orders.findById(order.id())).get().extracting(BillingOrder::status).isEqualTo(OrderStatus.PENDING);
  }
}
