package com.boxline.api.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * HS256 token verification. Tokens are issued by the identity service with the same shared secret.
 */
@Configuration
public class JwtBeans {

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(@Value("${boxline.auth.jwt-secret:}") String secret) {
    var key = new SecretKeySpec(deriveKey(secret), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }

  /**
   * Any configured secret string becomes a fixed 32-byte key (SHA-256 of the string).
   */
  byte[] deriveKey(String secret) {
    String s = secret == null ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev", "test"))) {
        s = "dev-secret-change-me";
      } else {
        throw new IllegalStateException("boxline.auth.jwt-secret is empty. Set BOXLINE_JWT_SECRET.");
      }
    }
    try {
      return MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
