package com.boxline.billing.infrastructure.gateway;

import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.domain.ExternalServiceException;
import com.boxline.billing.infrastructure.support.CannedHttp;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolarGatewayClientTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private CannedHttp http;
  private PolarGatewayClient gateway;

  @BeforeEach
  void setUp() {
    http = new CannedHttp();
    gateway = new PolarGatewayClient(http.client(), mapper, "https://gateway.test", " tok-123 ");
  }

  private JsonNode lastBody() throws IOException {
    return mapper.readTree(http.last().body());
  }

  @Nested
  @DisplayName("checkout and portal")
  class Sessions {

    @Test
    void checkoutCarriesProductAndTenantMetadata() throws IOException {
      UUID tenant = UUID.randomUUID();
      http.respond(201, "{\"id\":\"co_1\",\"url\":\"https://pay/co_1\",\"expires_at\":\"2025-03-10T13:00:00Z\"}");

      PaymentGatewayPort.CheckoutSession s =
          gateway.createCheckoutSession(tenant, "prod_growth", "owner@box.test", "https://app/ok");

      assertThat(s.id()).isEqualTo("co_1");
      assertThat(s.url()).isEqualTo("https://pay/co_1");
      assertThat(s.expiresAt()).isEqualTo(Instant.parse("2025-03-10T13:00:00Z"));

      assertThat(http.last().method()).isEqualTo("POST");
      assertThat(http.last().path()).isEqualTo("/v1/checkouts/");
      assertThat(http.last().authorization()).isEqualTo("Bearer tok-123");
      JsonNode body = lastBody();
      assertThat(body.get("products").get(0).asText()).isEqualTo("prod_growth");
      assertThat(body.get("metadata").get("tenantId").asText()).isEqualTo(tenant.toString());
    }

    @Test
    void portalWithoutUrlIsAGatewayFailure() {
      http.respond(201, "{\"id\":\"cs_1\"}");

      assertThatThrownBy(() -> gateway.billingPortalUrl("cus_1"))
          .isInstanceOf(ExternalServiceException.class);
    }
  }

  @Nested
  @DisplayName("subscription calls")
  class Subscriptions {

    @Test
    void immediateChangeInvoicesTheProration() throws IOException {
      http.respond(200, "{\"id\":\"sub_1\"}");

      gateway.updateSubscription("sub_1", "prod_pro", true);

      assertThat(http.last().method()).isEqualTo("PATCH");
      assertThat(http.last().path()).isEqualTo("/v1/subscriptions/sub_1");
      assertThat(lastBody().get("proration_behavior").asText()).isEqualTo("invoice");
      assertThat(lastBody().get("product_id").asText()).isEqualTo("prod_pro");
    }

    @Test
    void cancelAtPeriodEndPatchesTheFlag() throws IOException {
      http.respond(200, "{}");

      gateway.cancelSubscription("sub_1", true);

      assertThat(http.last().method()).isEqualTo("PATCH");
      assertThat(lastBody().get("cancel_at_period_end").asBoolean()).isTrue();
    }

    @Test
    void immediateCancelRevokes() {
      http.respond(204, "");

      gateway.cancelSubscription("sub_1", false);

      assertThat(http.last().method()).isEqualTo("DELETE");
      assertThat(http.last().path()).isEqualTo("/v1/subscriptions/sub_1");
    }
  }

  @Nested
  @DisplayName("customer sync")
  class Customers {

    @Test
    void missingCustomerIsCreatedWithTenantAsExternalId() throws IOException {
      UUID tenant = UUID.randomUUID();
      http.respond(404, "{\"error\":\"not found\"}")
          .respond(201, "{\"id\":\"cus_9\"}");

      String id = gateway.syncCustomer(tenant, "owner@box.test", "Iron Box");

      assertThat(id).isEqualTo("cus_9");
      assertThat(http.requests()).extracting(CannedHttp.Recorded::method).containsExactly("GET", "POST");
      assertThat(http.requests().get(0).path()).isEqualTo("/v1/customers/external/" + tenant);
      assertThat(lastBody().get("external_id").asText()).isEqualTo(tenant.toString());
    }

    @Test
    void existingCustomerIsUpdated() {
      http.respond(200, "{\"id\":\"cus_5\"}")
          .respond(200, "{\"id\":\"cus_5\"}");

      String id = gateway.syncCustomer(UUID.randomUUID(), "new@box.test", null);

      assertThat(id).isEqualTo("cus_5");
      assertThat(http.last().method()).isEqualTo("PATCH");
      assertThat(http.last().path()).isEqualTo("/v1/customers/cus_5");
    }
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    void clientErrorBecomesExternalServiceException() {
      http.respond(422, "{\"detail\":\"bad product\"}");

      assertThatThrownBy(() -> gateway.updateSubscription("sub_1", "nope", false))
          .isInstanceOf(ExternalServiceException.class)
          .hasMessageContaining("422");
    }

    @Test
    void ioErrorBecomesExternalServiceException() {
      http.fail(new SocketTimeoutException("read timed out"));

      assertThatThrownBy(() -> gateway.revokeSubscription("sub_1"))
          .isInstanceOf(ExternalServiceException.class)
          .hasCauseInstanceOf(SocketTimeoutException.class);
    }
  }
}
