package com.alerthub.providers.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class TenantAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(TenantAuthenticationFilter.class);

  private final ProvidersApiProperties properties;

  public TenantAuthenticationFilter(ProvidersApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      filterChain.doFilter(request, response);
      return;
    }
    final String tenantId = request.getHeader(properties.tenantIdHeaderName());
    if (tenantId == null || tenantId.isBlank()) {
      logger.warn(
          "internal request rejected: missing required header {} on path={}",
          properties.tenantIdHeaderName(),
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final AuthenticatedEntity entity =
        new AuthenticatedEntity(tenantId.trim(), request.getHeader(properties.userHeaderName()));
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            entity, "N/A", buildAuthorities(request.getHeader(properties.permissionsHeaderName())));
    logger.debug(
        "tenant authentication established for path={} tenant_id={} authorities={}",
        request.getRequestURI(),
        entity.tenantId(),
        authentication.getAuthorities());
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedPermissions) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    if (forwardedPermissions == null || forwardedPermissions.isBlank()) {
      return authorities;
    }
    for (String permission : forwardedPermissions.split(",")) {
      final String normalized = permission.trim();
      // 未知の権限は付与しない。
      if (ProviderPermission.isKnown(normalized)) {
        authorities.add(new SimpleGrantedAuthority(normalized));
      }
    }
    return authorities;
  }
}
