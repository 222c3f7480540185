package com.alerthub.providers.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableMethodSecurity
@EnableConfigurationProperties(ProvidersApiProperties.class)
public class ProvidersSecurityConfig {

  @Bean
  TenantAuthenticationFilter tenantAuthenticationFilter(ProvidersApiProperties properties) {
    return new TenantAuthenticationFilter(properties);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, TenantAuthenticationFilter tenantAuthenticationFilter) throws Exception {
    // 操作ごとの権限は各コントローラの @PreAuthorize で判定する。
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(tenantAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/providers/healthcheck")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/providers/healthcheck")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/providers/{provider_type}/schema")
                    .permitAll()
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
