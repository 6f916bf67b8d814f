package com.boxline.api.security;

import com.boxline.billing.application.Actors;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Who is calling, and may they act on a tenant.
 *
 * A caller acts on a tenant when the token's {@code tenantId} claim names it, or when the caller is
 * ADMIN. Actor strings recorded on billing rows are {@code user:<sub>} or {@code admin:<sub>}.
 */
@Component
public class TenantAccess {

  public static final String ROLE_ADMIN = "ROLE_ADMIN";

  /**
   * @throws AccessDeniedException if the caller may not act on {@code tenantId}
   */
  public String requireTenant(UUID tenantId) {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      throw new AccessDeniedException("authentication required");
    }
    if (isAdmin(auth)) {
      return actor(jat);
    }
    String claim = jat.getToken().getClaimAsString("tenantId");
    if (claim == null || !claim.trim().equalsIgnoreCase(tenantId.toString())) {
      throw new AccessDeniedException("token is not scoped to tenant " + tenantId);
    }
    return actor(jat);
  }

  /** Actor string of the current caller, {@code system} when unauthenticated. */
  public String currentActor() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      return Actors.SYSTEM;
    }
    return actor(jat);
  }

  private static String actor(JwtAuthenticationToken jat) {
    Jwt jwt = jat.getToken();
    String sub = jwt.getSubject() == null ? "unknown" : jwt.getSubject();
    return (isAdmin(jat) ? "admin:" : "user:") + sub;
  }

  private static boolean isAdmin(Authentication auth) {
    for (GrantedAuthority a : auth.getAuthorities()) {
      if (ROLE_ADMIN.equals(a.getAuthority())) return true;
    }
    return false;
  }
}
