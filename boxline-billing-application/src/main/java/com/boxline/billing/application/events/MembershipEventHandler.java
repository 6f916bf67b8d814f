package com.boxline.billing.application.events;

import com.boxline.billing.application.Actors;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.NotFoundException;
import com.boxline.billing.domain.model.Attributes;
import com.boxline.billing.domain.model.UsageEventDraft;
import com.boxline.billing.domain.model.UsageEventType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * {@code membership.changed}: the membership system reports seat changes as
 * {@code data.changes: [{ type: "athlete_added", quantity: 1, actor: "..." }]}.
 * The changes are recorded as usage events, then limits are enforced for them.
 */
public final class MembershipEventHandler implements BillingEventHandler {

    static final String MEMBERSHIP_CHANGED = "membership.changed";

    private final UsageLedger usage;

    public MembershipEventHandler(UsageLedger usage) {
        this.usage = Objects.requireNonNull(usage, "usage");
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(MEMBERSHIP_CHANGED);
    }

    @Override
    public void handle(InboundEvent event, UUID tenantId) {
        if (tenantId == null) {
            throw NotFoundException.of("tenant for event", event.id());
        }
        JsonNode changes = event.data().get("changes");
        if (changes == null || !changes.isArray() || changes.isEmpty()) {
            throw new IllegalArgumentException("membership.changed without changes: " + event.id());
        }

        List<UsageEventDraft> drafts = new ArrayList<>();
        Set<UsageEventType> triggers = EnumSet.noneOf(UsageEventType.class);
        for (JsonNode change : changes) {
            UsageEventType type = UsageEventType.fromCode(JsonFields.text(change, "type"));
            long quantity = Math.max(1, JsonFields.number(change, "quantity"));
            String actor = JsonFields.text(change, "actor");
            drafts.add(new UsageEventDraft(type, (int) quantity, false, actor == null ? Actors.SYSTEM : actor,
                    Attributes.empty().with(Attributes.EVENT_ID, event.id())));
            triggers.add(type);
        }

        usage.recordUsageEvents(tenantId, drafts);
        usage.enforceLimits(tenantId, triggers);
    }
}
