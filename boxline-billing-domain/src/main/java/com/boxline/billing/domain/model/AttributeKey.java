package com.boxline.billing.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Typed key into {@link Attributes}. Values are stored as strings and parsed on read.
 */
public final class AttributeKey<T> {

    private final String name;
    private final Function<String, T> parser;
    private final Function<T, String> formatter;

    private AttributeKey(String name, Function<String, T> parser, Function<T, String> formatter) {
        this.name = Objects.requireNonNull(name, "name");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public static AttributeKey<String> text(String name) {
        return new AttributeKey<>(name, Function.identity(), Function.identity());
    }

    public static AttributeKey<Long> number(String name) {
        return new AttributeKey<>(name, Long::parseLong, String::valueOf);
    }

    public static AttributeKey<UUID> uuid(String name) {
        return new AttributeKey<>(name, UUID::fromString, UUID::toString);
    }

    public static AttributeKey<Instant> instant(String name) {
        return new AttributeKey<>(name, Instant::parse, Instant::toString);
    }

    public String name() {
        return name;
    }

    T parse(String raw) {
        return parser.apply(raw);
    }

    String format(T value) {
        return formatter.apply(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
