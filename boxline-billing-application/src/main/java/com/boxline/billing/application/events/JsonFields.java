package com.boxline.billing.application.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Lenient readers for gateway payloads. Missing, null or malformed values read as null.
 */
final class JsonFields {

    private JsonFields() {}

    static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    /** First non-blank of the given fields. */
    static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            String v = text(node, f);
            if (v != null) return v;
        }
        return null;
    }

    static Instant instant(JsonNode node, String field) {
        String s = text(node, field);
        if (s == null) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static boolean bool(JsonNode node, String field) {
        if (node == null) return false;
        JsonNode v = node.get(field);
        return v != null && v.asBoolean(false);
    }

    static long number(JsonNode node, String field) {
        if (node == null) return 0;
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? 0 : v.asLong(0);
    }

    static UUID uuid(JsonNode node, String field) {
        String s = text(node, field);
        if (s == null) return null;
        try {
            return UUID.fromString(s);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static JsonNode object(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        return v != null && v.isObject() ? v : null;
    }
}
