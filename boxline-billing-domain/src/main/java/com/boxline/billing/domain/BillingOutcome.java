package com.boxline.billing.domain;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a tenant-facing billing operation.
 *
 * Expected failures (missing entity, wrong state) are values, not exceptions. Callers that want
 * exceptional flow use {@link #orElseThrow()}.
 */
public record BillingOutcome<T>(Kind kind, T value, String message) {

    public enum Kind {
        OK,
        NOT_FOUND,
        INVALID_STATE
    }

    public BillingOutcome {
        Objects.requireNonNull(kind, "kind");
    }

    public static <T> BillingOutcome<T> ok(T value) {
        return new BillingOutcome<>(Kind.OK, value, null);
    }

    public static <T> BillingOutcome<T> notFound(String message) {
        return new BillingOutcome<>(Kind.NOT_FOUND, null, message);
    }

    public static <T> BillingOutcome<T> invalidState(String message) {
        return new BillingOutcome<>(Kind.INVALID_STATE, null, message);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public <R> BillingOutcome<R> map(Function<? super T, ? extends R> fn) {
        if (!isOk()) {
            return new BillingOutcome<>(kind, null, message);
        }
        return ok(fn.apply(value));
    }

    public T orElseThrow() {
        switch (kind) {
            case OK:
                return value;
            case NOT_FOUND:
                throw new NotFoundException(message);
            default:
                throw new InvalidStateException(message);
        }
    }
}
