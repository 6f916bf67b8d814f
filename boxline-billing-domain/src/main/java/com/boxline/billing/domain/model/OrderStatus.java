package com.boxline.billing.domain.model;

import java.util.Locale;

public enum OrderStatus {
    PENDING,
    PAID,
    FAILED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OrderStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("OrderStatus code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
