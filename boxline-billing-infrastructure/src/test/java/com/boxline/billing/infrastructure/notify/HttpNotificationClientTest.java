package com.boxline.billing.infrastructure.notify;

import com.boxline.billing.application.notify.BillingNotification;
import com.boxline.billing.domain.ExternalServiceException;
import com.boxline.billing.infrastructure.support.CannedHttp;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpNotificationClientTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final CannedHttp http = new CannedHttp();
  private final HttpNotificationClient client =
      new HttpNotificationClient(http.client(), mapper, "https://notify.test/", "svc-token");

  private final UUID tenant = UUID.randomUUID();

  private BillingNotification notification() {
    return new BillingNotification(tenant, null, "payment_failed", BillingNotification.CATEGORY,
        BillingNotification.Priority.URGENT, "Payment failed", "Update your card",
        "/settings/billing", List.of("in_app", "email"), Map.of("invoiceId", "inv_1"),
        "payment_failed:" + tenant + ":inv_1");
  }

  @Test
  void postsWithBearerTokenAndServiceFieldNames() throws Exception {
    http.respond(201, "{}");

    client.createNotification(notification());

    CannedHttp.Recorded req = http.last();
    assertThat(req.method()).isEqualTo("POST");
    assertThat(req.path()).isEqualTo("/api/v1/notifications");
    assertThat(req.authorization()).isEqualTo("Bearer svc-token");

    JsonNode body = mapper.readTree(req.body());
    assertThat(body.get("boxId").asText()).isEqualTo(tenant.toString());
    assertThat(body.has("userId")).isFalse();
    assertThat(body.get("priority").asText()).isEqualTo("urgent");
    assertThat(body.get("channels")).hasSize(2);
    assertThat(body.get("data").get("invoiceId").asText()).isEqualTo("inv_1");
    assertThat(body.get("deduplicationKey").asText()).startsWith("payment_failed:");
  }

  @Test
  void serverErrorBecomesExternalServiceException() {
    http.respond(500, "down");

    assertThatThrownBy(() -> client.createNotification(notification()))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessageContaining("500");
  }

  @Test
  void noAuthorizationHeaderWithoutToken() {
    CannedHttp local = new CannedHttp().respond(200, "{}");
    new HttpNotificationClient(local.client(), mapper, "https://notify.test", null)
        .createNotification(notification());

    assertThat(local.last().authorization()).isNull();
  }
}
