package com.boxline.billing.infrastructure.notify;

import com.boxline.billing.application.notify.BillingNotification;
import com.boxline.billing.application.ports.NotificationPort;
import com.boxline.billing.domain.ExternalServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Posts billing notifications to the notification service.
 *
 * Every failure surfaces as {@link ExternalServiceException}; the notifier above decides that it
 * is non-fatal.
 */
public class HttpNotificationClient implements NotificationPort {

  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
  private static final String SERVICE = "notifications";

  private final OkHttpClient client;
  private final ObjectMapper mapper;
  private final String endpoint;
  private final String token;

  public HttpNotificationClient(OkHttpClient client, ObjectMapper mapper, String baseUrl, String token) {
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.endpoint = trimSlash(Objects.requireNonNull(baseUrl, "baseUrl")) + "/api/v1/notifications";
    this.token = token == null ? "" : token.trim();
  }

  @Override
  public void createNotification(BillingNotification n) {
    Request.Builder req = new Request.Builder()
        .url(endpoint)
        .post(RequestBody.create(toJson(n), JSON));
    if (!token.isEmpty()) req.header("Authorization", "Bearer " + token);

    try (Response resp = client.newCall(req.build()).execute()) {
      if (!resp.isSuccessful()) {
        throw new ExternalServiceException(SERVICE, "HTTP " + resp.code() + " => " +
            (resp.body() != null ? resp.body().string() : ""));
      }
    } catch (IOException e) {
      throw new ExternalServiceException(SERVICE, "notification call failed: " + e.getMessage(), e);
    }
  }

  String toJson(BillingNotification n) {
    ObjectNode body = mapper.createObjectNode();
    body.put("boxId", n.tenantId().toString());
    if (n.userId() != null) body.put("userId", n.userId().toString());
    body.put("type", n.type());
    body.put("category", n.category());
    body.put("priority", n.priority() == null ? "normal" : n.priority().name().toLowerCase(Locale.ROOT));
    body.put("title", n.title());
    body.put("message", n.message());
    if (n.actionUrl() != null) body.put("actionUrl", n.actionUrl());
    body.putPOJO("channels", n.channels());
    body.putPOJO("data", n.data());
    body.put("deduplicationKey", n.deduplicationKey());
    try {
      return mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize notification", e);
    }
  }

  private static String trimSlash(String url) {
    String s = url.trim();
    while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
    return s;
  }
}
