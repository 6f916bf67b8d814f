package com.boxline.api.webhook;

import com.boxline.billing.application.Errors;
import com.boxline.billing.application.events.BillingEventService;
import com.boxline.billing.application.events.InboundEvent;
import com.boxline.billing.application.events.IngestResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Payment gateway webhook endpoint.
 *
 * Body is the event envelope {@code { id, type, data, metadata }}. When the body carries no id the
 * {@code X-Event-Id} header is used, then the SHA-256 of the body, so a redelivered payload always
 * maps to the same stored event.
 *
 * A malformed envelope answers 400 and is logged with whatever id and type could be read.
 *
 * A handler failure answers 500 so the gateway redelivers; the event is already recorded as failed
 * and the retry job picks it up as well.
 */
@RestController
@RequestMapping("/api/v1/billing")
public class BillingWebhookController {

  private static final Logger log = LoggerFactory.getLogger(BillingWebhookController.class);

  private final WebhookSignature signature;
  private final BillingEventService events;
  private final ObjectMapper mapper;

  public BillingWebhookController(WebhookSignature signature, BillingEventService events, ObjectMapper mapper) {
    this.signature = signature;
    this.events = events;
    this.mapper = mapper;
  }

  @PostMapping("/webhook")
  public ResponseEntity<Map<String, Object>> webhook(
      @RequestHeader(value = WebhookSignature.HEADER, required = false) String xSignature,
      @RequestHeader(value = "X-Event-Id", required = false) String deliveryId,
      @RequestBody byte[] rawBody
  ) {
    if (!signature.verifyOrBypass(rawBody, xSignature)) {
      log.warn("Webhook rejected: invalid signature. bytes={}", rawBody == null ? 0 : rawBody.length);
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
          "status", "error",
          "reason", "invalid_signature",
          "ts", Instant.now().toString()
      ));
    }

    String body = new String(rawBody, StandardCharsets.UTF_8);
    String fallbackId = deliveryId != null && !deliveryId.isBlank() ? deliveryId.trim() : sha256Hex(rawBody);
    InboundEvent event;
    try {
      event = InboundEvent.parse(mapper, body, fallbackId);
    } catch (IllegalArgumentException e) {
      log.warn("Webhook rejected: malformed envelope. id={} type={} fallbackId={} bytes={} err={}",
          envelopeField(body, "id"), envelopeField(body, "type"), fallbackId, rawBody.length, e.getMessage());
      throw e;
    }

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("eventId", event.id());
    out.put("type", event.type());
    try {
      IngestResult r = events.ingest(event);
      out.put("status", r.status().name().toLowerCase(Locale.ROOT));
      out.put("handled", r.handled());
      out.put("receivedAt", Instant.now().toString());
      return ResponseEntity.ok(out);
    } catch (RuntimeException e) {
      out.put("status", "error");
      out.put("reason", "processing_failed");
      out.put("message", Errors.safeError(e));
      out.put("receivedAt", Instant.now().toString());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(out);
    }
  }

  /** Best-effort read of a top-level text field for logging; null when the body is not a JSON object. */
  private String envelopeField(String body, String field) {
    try {
      JsonNode node = mapper.readTree(body);
      JsonNode value = node == null ? null : node.get(field);
      return value == null || value.isNull() ? null : value.asText();
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private static String sha256Hex(byte[] body) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
