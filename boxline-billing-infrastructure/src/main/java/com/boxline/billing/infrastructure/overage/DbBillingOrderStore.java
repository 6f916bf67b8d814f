package com.boxline.billing.infrastructure.overage;

import com.boxline.billing.application.ports.BillingOrderStore;
import com.boxline.billing.domain.model.BillingOrder;
import com.boxline.billing.domain.model.OrderStatus;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class DbBillingOrderStore implements BillingOrderStore {

  private final BillingOrderRepository orders;

  public DbBillingOrderStore(BillingOrderRepository orders) {
    this.orders = orders;
  }

  @Override
  public BillingOrder save(BillingOrder order) {
    BillingOrderEntity e = new BillingOrderEntity();
    e.setId(order.id());
    e.setTenantId(order.tenantId());
    e.setType(order.type());
    e.setStatus(order.status().code());
    e.setAmount(order.amount());
    e.setCurrency(order.currency());
    e.setDescription(order.description());
    e.setOverageBillingId(order.overageBillingId());
    e.setExternalInvoiceId(order.externalInvoiceId());
    e.setCreatedAt(order.createdAt());
    e.setPaidAt(order.paidAt());
    return toDomain(orders.saveAndFlush(e));
  }

  @Override
  public Optional<BillingOrder> findById(UUID id) {
    return orders.findById(id).map(DbBillingOrderStore::toDomain);
  }

  static BillingOrder toDomain(BillingOrderEntity e) {
    return new BillingOrder(
        e.getId(),
        e.getTenantId(),
        e.getType(),
        OrderStatus.fromCode(e.getStatus()),
        e.getAmount(),
        e.getCurrency(),
        e.getDescription(),
        e.getOverageBillingId(),
        e.getExternalInvoiceId(),
        e.getCreatedAt(),
        e.getPaidAt()
    );
  }
}
