package com.boxline.billing.application.notify;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Payload of the notification service's "create notification" call.
 *
 * {@code deduplicationKey} is deterministic per logical event so repeated triggers collapse into one
 * notification downstream.
 */
public record BillingNotification(
        UUID tenantId,
        UUID userId,
        String type,
        String category,
        Priority priority,
        String title,
        String message,
        String actionUrl,
        List<String> channels,
        Map<String, String> data,
        String deduplicationKey
) {

    public static final String CATEGORY = "billing";

    public enum Priority {
        LOW,
        NORMAL,
        HIGH,
        URGENT
    }

    public BillingNotification {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(deduplicationKey, "deduplicationKey");
        channels = channels == null ? List.of() : List.copyOf(channels);
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
