package com.boxline.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless JWT security for the billing API.
 *
 * The webhook is public at this layer and authenticated by its HMAC signature inside the
 * controller. Admin endpoints need ROLE_ADMIN; tenant endpoints additionally check the
 * {@code tenantId} claim (see {@link TenantAccess}).
 */
@Configuration
public class SecurityConfig {

  @Bean
  @Order(2)
  SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
    return http
        .securityMatcher("/api/v1/health", "/error", "/api/v1/billing/webhook")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/api/v1/health", "/error").permitAll()
            .requestMatchers(HttpMethod.POST, "/api/v1/billing/webhook").permitAll()
            .anyRequest().denyAll()
        )
        .build();
  }

  @Bean
  @Order(3)
  SecurityFilterChain securedApiChain(HttpSecurity http) throws Exception {
    return http
        .securityMatcher("/api/**")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .requestMatchers("/api/v1/admin/**").hasRole("ADMIN")
            .anyRequest().authenticated()
        )
        .oauth2ResourceServer(oauth -> oauth
            .jwt(jwt -> jwt.jwtAuthenticationConverter(new JwtRoleConverter()))
        )
        .build();
  }
}
