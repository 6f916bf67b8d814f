package com.boxline.billing.infrastructure.tx;

import com.boxline.billing.application.ports.UnitOfWork;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link UnitOfWork} on Spring transactions. PROPAGATION_REQUIRED, so nested units join the outer
 * transaction and after-commit actions wait for the outermost commit.
 */
public class SpringUnitOfWork implements UnitOfWork {

  private final TransactionTemplate tx;

  public SpringUnitOfWork(PlatformTransactionManager transactionManager) {
    this.tx = new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
  }

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    return tx.execute(status -> work.get());
  }

  @Override
  public void afterCommit(Runnable action) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      action.run();
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        action.run();
      }
    });
  }
}
