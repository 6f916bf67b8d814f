package com.boxline.billing.application.ports;

import java.util.function.Supplier;

/**
 * Transaction boundary for multi-row billing mutations.
 */
public interface UnitOfWork {

    /** Runs {@code work} atomically. Nested calls join the outer unit. */
    <T> T inTransaction(Supplier<T> work);

    /**
     * Defers {@code action} until the surrounding unit commits. Outside a unit it runs immediately.
     * Actions of a rolled-back unit never run.
     */
    void afterCommit(Runnable action);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
