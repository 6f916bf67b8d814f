package com.boxline.billing.application.ports;

import java.util.Objects;

/**
 * Outcome of a conflict-aware insert: either the new row or the row that already held the unique key.
 * A unique-key conflict is not an error on these paths.
 */
public record InsertResult<T>(T value, boolean inserted) {

    public InsertResult {
        Objects.requireNonNull(value, "value");
    }

    public static <T> InsertResult<T> inserted(T value) {
        return new InsertResult<>(value, true);
    }

    public static <T> InsertResult<T> existing(T value) {
        return new InsertResult<>(value, false);
    }
}
