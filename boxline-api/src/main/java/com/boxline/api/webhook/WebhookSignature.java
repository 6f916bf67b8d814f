package com.boxline.api.webhook;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies the gateway webhook signature: {@code X-Signature = hex(HMAC_SHA256(secret, rawBody))}.
 *
 * Without a configured secret every delivery is rejected, except under the dev/local profiles.
 */
@Component
public class WebhookSignature {

  public static final String HEADER = "X-Signature";

  private final String secret;
  private final Environment env;

  public WebhookSignature(@Value("${boxline.webhook.secret:}") String secret, Environment env) {
    this.secret = secret == null ? "" : secret.trim();
    this.env = env;
  }

  public boolean verifyOrBypass(byte[] rawBody, String headerSignature) {
    if (secret.isEmpty()) {
      return env != null && env.acceptsProfiles(Profiles.of("dev", "local"));
    }
    if (headerSignature == null || headerSignature.isBlank()) return false;

    String computed = sign(secret, rawBody == null ? new byte[0] : rawBody);
    return MessageDigest.isEqual(
        computed.getBytes(StandardCharsets.UTF_8),
        headerSignature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
  }

  /** Lower-case hex HMAC-SHA256 of {@code body}. */
  public static String sign(String secret, byte[] body) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      return HexFormat.of().formatHex(mac.doFinal(body));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute HMAC SHA-256", e);
    }
  }
}
