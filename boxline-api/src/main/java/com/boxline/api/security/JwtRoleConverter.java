package com.boxline.api.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.List;
import java.util.Locale;

/**
 * Maps the JWT claim "role" ("OWNER", "ADMIN", ...) to a Spring authority ("ROLE_OWNER", ...).
 * Tokens without a role get ROLE_USER.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    String role = jwt.getClaimAsString("role");
    String authority = role == null || role.isBlank()
        ? "ROLE_USER"
        : "ROLE_" + role.trim().toUpperCase(Locale.ROOT);
    return new JwtAuthenticationToken(jwt, List.of(new SimpleGrantedAuthority(authority)));
  }
}
