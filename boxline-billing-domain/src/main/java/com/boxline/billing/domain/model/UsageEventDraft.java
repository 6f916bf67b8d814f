package com.boxline.billing.domain.model;

import java.util.Objects;

/** A usage event before it is stamped with id, window and time. */
public record UsageEventDraft(
        UsageEventType type,
        int quantity,
        boolean billable,
        String actor,
        Attributes metadata
) {

    public UsageEventDraft {
        Objects.requireNonNull(type, "type");
        metadata = metadata == null ? Attributes.empty() : metadata;
    }

    public static UsageEventDraft of(UsageEventType type, String actor) {
        return new UsageEventDraft(type, 1, false, actor, Attributes.empty());
    }

    public static UsageEventDraft of(UsageEventType type, String actor, Attributes metadata) {
        return new UsageEventDraft(type, 1, false, actor, metadata);
    }
}
