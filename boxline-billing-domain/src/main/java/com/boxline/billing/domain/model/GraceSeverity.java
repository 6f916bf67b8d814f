package com.boxline.billing.domain.model;

import java.util.Locale;

public enum GraceSeverity {
    INFO,
    WARNING,
    CRITICAL,
    BLOCKING;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GraceSeverity fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("GraceSeverity code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
