package com.boxline.billing.domain.model;

import java.util.Locale;

public enum OverageStatus {
    CALCULATED,
    PAID,
    FAILED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OverageStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("OverageStatus code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
