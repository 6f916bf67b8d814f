package com.boxline.billing.infrastructure.gateway;

import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.domain.ExternalServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.UUID;

/**
 * Payment gateway over the Polar REST API (OkHttp + Jackson).
 *
 * Rules:
 * - Every non-2xx answer and every I/O error becomes {@link ExternalServiceException}.
 * - Customers are keyed by the tenant id as external id, so syncing twice updates one customer.
 * - Immediate cancellation and revocation both end the subscription now (DELETE).
 */
public class PolarGatewayClient implements PaymentGatewayPort {

  private static final Logger log = LoggerFactory.getLogger(PolarGatewayClient.class);
  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
  private static final String SERVICE = "gateway";

  private final OkHttpClient client;
  private final ObjectMapper mapper;
  private final HttpUrl baseUrl;
  private final String accessToken;

  public PolarGatewayClient(OkHttpClient client, ObjectMapper mapper, String baseUrl, String accessToken) {
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.baseUrl = HttpUrl.get(Objects.requireNonNull(baseUrl, "baseUrl"));
    this.accessToken = Objects.requireNonNull(accessToken, "accessToken").trim();
  }

  @Override
  public CheckoutSession createCheckoutSession(UUID tenantId, String externalProductId, String customerEmail,
                                               String successUrl) {
    ObjectNode body = mapper.createObjectNode();
    body.putArray("products").add(externalProductId);
    if (customerEmail != null) body.put("customer_email", customerEmail);
    if (successUrl != null) body.put("success_url", successUrl);
    body.putObject("metadata").put("tenantId", tenantId.toString());

    JsonNode r = send("POST", url("v1", "checkouts", ""), body);
    return new CheckoutSession(text(r, "id"), text(r, "url"), instant(r, "expires_at"));
  }

  @Override
  public String billingPortalUrl(String externalCustomerId) {
    ObjectNode body = mapper.createObjectNode().put("customer_id", externalCustomerId);
    JsonNode r = send("POST", url("v1", "customer-sessions", ""), body);
    String portal = text(r, "customer_portal_url");
    if (portal == null) throw new ExternalServiceException(SERVICE, "customer session without portal url");
    return portal;
  }

  @Override
  public void updateSubscription(String externalSubscriptionId, String externalProductId, boolean prorateNow) {
    ObjectNode body = mapper.createObjectNode()
        .put("product_id", externalProductId)
        .put("proration_behavior", prorateNow ? "invoice" : "prorate");
    send("PATCH", url("v1", "subscriptions", externalSubscriptionId), body);
  }

  @Override
  public void cancelSubscription(String externalSubscriptionId, boolean atPeriodEnd) {
    if (!atPeriodEnd) {
      revokeSubscription(externalSubscriptionId);
      return;
    }
    send("PATCH", url("v1", "subscriptions", externalSubscriptionId),
        mapper.createObjectNode().put("cancel_at_period_end", true));
  }

  @Override
  public void resumeSubscription(String externalSubscriptionId) {
    send("PATCH", url("v1", "subscriptions", externalSubscriptionId),
        mapper.createObjectNode().put("cancel_at_period_end", false));
  }

  @Override
  public void revokeSubscription(String externalSubscriptionId) {
    send("DELETE", url("v1", "subscriptions", externalSubscriptionId), null);
  }

  @Override
  public String syncCustomer(UUID tenantId, String email, String name) {
    HttpUrl byExternal = url("v1", "customers", "external", tenantId.toString());
    JsonNode existing = sendAllowMissing("GET", byExternal, null);

    ObjectNode body = mapper.createObjectNode();
    if (email != null) body.put("email", email);
    if (name != null) body.put("name", name);

    if (existing == null) {
      body.put("external_id", tenantId.toString());
      JsonNode created = send("POST", url("v1", "customers", ""), body);
      log.info("Gateway customer created. tenantId={} customerId={}", tenantId, text(created, "id"));
      return requireId(created);
    }
    JsonNode updated = send("PATCH", url("v1", "customers", requireId(existing)), body);
    return requireId(updated);
  }

  @Override
  public Invoice fetchInvoice(String externalInvoiceId) {
    JsonNode r = send("GET", url("v1", "orders", externalInvoiceId), null);
    String status = text(r, "status");
    Instant paidAt = "paid".equalsIgnoreCase(status) ? instant(r, "created_at") : null;
    return new Invoice(requireId(r), status, r.path("total_amount").asLong(0), text(r, "currency"), paidAt);
  }

  private HttpUrl url(String... segments) {
    HttpUrl.Builder b = baseUrl.newBuilder();
    for (String s : segments) b.addPathSegment(s);
    return b.build();
  }

  private JsonNode send(String method, HttpUrl url, JsonNode body) {
    JsonNode r = exchange(method, url, body, false);
    return r == null ? mapper.createObjectNode() : r;
  }

  /** Like {@link #send} but returns null for 404. */
  private JsonNode sendAllowMissing(String method, HttpUrl url, JsonNode body) {
    return exchange(method, url, body, true);
  }

  private JsonNode exchange(String method, HttpUrl url, JsonNode body, boolean allowMissing) {
    RequestBody payload = body == null ? null : RequestBody.create(write(body), JSON);
    Request req = new Request.Builder()
        .url(url)
        .header("Authorization", "Bearer " + accessToken)
        .header("Accept", "application/json")
        .method(method, payload)
        .build();

    try (Response resp = client.newCall(req).execute()) {
      String raw = resp.body() != null ? resp.body().string() : "";
      if (allowMissing && resp.code() == 404) return null;
      if (!resp.isSuccessful()) {
        log.warn("Gateway call failed. method={} path={} status={}", method, url.encodedPath(), resp.code());
        throw new ExternalServiceException(SERVICE, method + " " + url.encodedPath() + " => HTTP "
            + resp.code() + " " + abbreviate(raw));
      }
      return raw.isBlank() ? null : mapper.readTree(raw);
    } catch (IOException e) {
      throw new ExternalServiceException(SERVICE, method + " " + url.encodedPath() + " failed: " + e.getMessage(), e);
    }
  }

  private String write(JsonNode body) {
    try {
      return mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize gateway request", e);
    }
  }

  private static String requireId(JsonNode r) {
    String id = text(r, "id");
    if (id == null) throw new ExternalServiceException(SERVICE, "gateway response without id");
    return id;
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n == null ? null : n.get(field);
    return v == null || v.isNull() ? null : v.asText();
  }

  private static Instant instant(JsonNode n, String field) {
    String s = text(n, field);
    if (s == null || s.isBlank()) return null;
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String abbreviate(String s) {
    return s.length() <= 300 ? s : s.substring(0, 300) + "...";
  }
}
