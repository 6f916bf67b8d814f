package com.boxline.billing.infrastructure.overage;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface BillingOrderRepository extends JpaRepository<BillingOrderEntity, UUID> {
}
