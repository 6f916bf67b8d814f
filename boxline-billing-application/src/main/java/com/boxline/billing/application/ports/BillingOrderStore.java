package com.boxline.billing.application.ports;

import com.boxline.billing.domain.model.BillingOrder;

import java.util.Optional;
import java.util.UUID;

public interface BillingOrderStore {

    BillingOrder save(BillingOrder order);

    Optional<BillingOrder> findById(UUID id);
}
