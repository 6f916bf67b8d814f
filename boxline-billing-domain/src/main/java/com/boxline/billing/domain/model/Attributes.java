package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable metadata attached to usage events, grace periods and audit records.
 *
 * Known keys are declared below and read through typed accessors. Keys this version does not know
 * about are kept as raw strings so newer writers do not lose data when older readers re-save it.
 *
 * Schema:
 * - role, count, limit, overage: seat context of a limit event
 * - plan_id, from_plan_id, to_plan_id: plan context of a plan change
 * - event_id, source: what triggered the record
 * - reason: free-text reason supplied by an actor
 * - amount, invoice_id: payment context
 * - days_remaining, ends_at: grace timing snapshot
 */
public final class Attributes {

    public static final AttributeKey<String> ROLE = AttributeKey.text("role");
    public static final AttributeKey<Long> COUNT = AttributeKey.number("count");
    public static final AttributeKey<Long> LIMIT = AttributeKey.number("limit");
    public static final AttributeKey<Long> OVERAGE = AttributeKey.number("overage");
    public static final AttributeKey<UUID> PLAN_ID = AttributeKey.uuid("plan_id");
    public static final AttributeKey<UUID> FROM_PLAN_ID = AttributeKey.uuid("from_plan_id");
    public static final AttributeKey<UUID> TO_PLAN_ID = AttributeKey.uuid("to_plan_id");
    public static final AttributeKey<String> EVENT_ID = AttributeKey.text("event_id");
    public static final AttributeKey<String> SOURCE = AttributeKey.text("source");
    public static final AttributeKey<String> REASON = AttributeKey.text("reason");
    public static final AttributeKey<Long> AMOUNT = AttributeKey.number("amount");
    public static final AttributeKey<String> INVOICE_ID = AttributeKey.text("invoice_id");
    public static final AttributeKey<Long> DAYS_REMAINING = AttributeKey.number("days_remaining");
    public static final AttributeKey<Instant> ENDS_AT = AttributeKey.instant("ends_at");

    private static final Attributes EMPTY = new Attributes(Map.of());

    private final Map<String, String> values;

    private Attributes(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static Attributes empty() {
        return EMPTY;
    }

    public static Attributes fromRaw(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        return new Attributes(raw);
    }

    public <T> Attributes with(AttributeKey<T> key, T value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            return this;
        }
        Map<String, String> copy = new TreeMap<>(values);
        copy.put(key.name(), key.format(value));
        return new Attributes(copy);
    }

    /**
     * Typed read. A value that does not parse as the key's type reads as empty.
     */
    public <T> Optional<T> get(AttributeKey<T> key) {
        String raw = values.get(key.name());
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(key.parse(raw));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    public Map<String, String> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attributes)) return false;
        return values.equals(((Attributes) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
