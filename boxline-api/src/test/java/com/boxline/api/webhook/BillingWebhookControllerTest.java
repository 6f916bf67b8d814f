package com.boxline.api.webhook;

import com.boxline.api.common.ApiExceptionHandler;
import com.boxline.api.security.JwtBeans;
import com.boxline.api.security.SecurityConfig;
import com.boxline.billing.application.events.BillingEventService;
import com.boxline.billing.application.events.InboundEvent;
import com.boxline.billing.application.events.IngestResult;
import com.boxline.billing.domain.ExternalServiceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BillingWebhookController.class)
@Import({SecurityConfig.class, JwtBeans.class, WebhookSignature.class, ApiExceptionHandler.class})
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class BillingWebhookControllerTest {

  private static final String SECRET = "whsec-test";

  @Autowired
  private MockMvc mvc;

  @MockBean
  private BillingEventService events;

  private ResultActions deliver(String json, String signature, String deliveryId) throws Exception {
    var req = post("/api/v1/billing/webhook")
        .contentType(MediaType.APPLICATION_JSON)
        .content(json.getBytes(StandardCharsets.UTF_8));
    if (signature != null) req.header(WebhookSignature.HEADER, signature);
    if (deliveryId != null) req.header("X-Event-Id", deliveryId);
    return mvc.perform(req);
  }

  private static String sign(String json) {
    return WebhookSignature.sign(SECRET, json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void processedEventAnswersOk() throws Exception {
    String json = "{\"id\":\"evt_1\",\"type\":\"subscription.active\",\"data\":{\"id\":\"sub_1\"}}";
    when(events.ingest(any())).thenReturn(IngestResult.processed(UUID.randomUUID(), "evt_1", true));

    deliver(json, sign(json), null)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("processed"))
        .andExpect(jsonPath("$.eventId").value("evt_1"))
        .andExpect(jsonPath("$.handled").value(true));
  }

  @Test
  void badSignatureNeverReachesTheService() throws Exception {
    String json = "{\"id\":\"evt_1\",\"type\":\"order.paid\"}";

    deliver(json, sign("{\"id\":\"evt_other\"}"), null)
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.reason").value("invalid_signature"));

    verify(events, never()).ingest(any());
  }

  @Test
  void deliveryHeaderSuppliesMissingEventId() throws Exception {
    String json = "{\"type\":\"order.paid\",\"data\":{}}";
    when(events.ingest(any())).thenReturn(IngestResult.alreadyProcessed(UUID.randomUUID(), "dlv_42"));

    deliver(json, sign(json), "dlv_42")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("already_processed"));

    ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
    verify(events).ingest(captor.capture());
    assertThat(captor.getValue().id()).isEqualTo("dlv_42");
    assertThat(captor.getValue().rawPayload()).isEqualTo(json);
  }

  @Test
  void bodyWithoutIdFallsBackToItsHash() throws Exception {
    String json = "{\"type\":\"order.paid\",\"data\":{}}";
    when(events.ingest(any())).thenReturn(IngestResult.processed(UUID.randomUUID(), "x", true));

    deliver(json, sign(json), null).andExpect(status().isOk());

    ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
    verify(events).ingest(captor.capture());
    assertThat(captor.getValue().id()).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void handlerFailureAnswers500SoTheGatewayRedelivers() throws Exception {
    String json = "{\"id\":\"evt_9\",\"type\":\"order.paid\",\"data\":{}}";
    when(events.ingest(any())).thenThrow(new ExternalServiceException("gateway", "timeout"));

    deliver(json, sign(json), null)
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.reason").value("processing_failed"))
        .andExpect(jsonPath("$.message").value("timeout"));
  }

  @Test
  void envelopeWithoutTypeIsABadRequest() throws Exception {
    String json = "{\"id\":\"evt_3\",\"data\":{}}";

    deliver(json, sign(json), null)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("bad_request"));
  }

  @Test
  void malformedEnvelopeIsLoggedWithItsIdentifiers(CapturedOutput output) throws Exception {
    String json = "{\"id\":\"evt_4\",\"data\":{}}";

    deliver(json, sign(json), "dlv-9")
        .andExpect(status().isBadRequest());

    verify(events, never()).ingest(any());
    assertThat(output.getOut())
        .contains("Webhook rejected: malformed envelope")
        .contains("id=evt_4")
        .contains("fallbackId=dlv-9");
  }

  @Test
  void unparseableBodyIsLoggedWithItsHashFallback(CapturedOutput output) throws Exception {
    String json = "not json";

    deliver(json, sign(json), null)
        .andExpect(status().isBadRequest());

    verify(events, never()).ingest(any());
    assertThat(output.getOut())
        .contains("Webhook rejected: malformed envelope")
        .contains("id=null type=null")
        .contains("bytes=8");
  }
}
