package com.boxline.billing.infrastructure.grace;

public interface GracePeriodRepositoryCustom {

  /**
   * Inserts unless the unresolved (tenant, reason) index already holds a row.
   * Returns true if the row was written.
   */
  boolean insertIfNoneUnresolved(GracePeriodEntity e);
}
