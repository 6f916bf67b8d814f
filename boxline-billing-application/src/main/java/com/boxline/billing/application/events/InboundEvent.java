package com.boxline.billing.application.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;
import java.util.UUID;

/**
 * Inbound billing event: {@code { id, type, data, metadata: { tenantId? } }}.
 *
 * {@code rawPayload} is the envelope as received and is what gets persisted, so a failed event can
 * be rebuilt for retry.
 */
public record InboundEvent(String id, String type, JsonNode data, UUID metadataTenantId, String rawPayload) {

    public InboundEvent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("event id is required");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("event type is required");
        }
        data = data == null ? NullNode.getInstance() : data;
    }

    /**
     * Parses an envelope. {@code fallbackId} is used when the body carries no id (some gateways send
     * it only as a delivery header).
     *
     * @throws IllegalArgumentException if the body is not JSON or lacks id/type
     */
    public static InboundEvent parse(ObjectMapper mapper, String rawPayload, String fallbackId) {
        Objects.requireNonNull(mapper, "mapper");
        JsonNode root;
        try {
            root = mapper.readTree(rawPayload == null ? "" : rawPayload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid event JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("event body must be a JSON object");
        }
        String id = JsonFields.text(root, "id");
        if (id == null) {
            id = fallbackId;
        }
        JsonNode metadata = JsonFields.object(root, "metadata");
        return new InboundEvent(id, JsonFields.text(root, "type"), root.get("data"),
                JsonFields.uuid(metadata, "tenantId"), rawPayload);
    }
}
