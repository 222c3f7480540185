package com.alerthub.providers.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "providers.api")
public record ProvidersApiProperties(
    String headerName,
    String token,
    String tenantIdHeaderName,
    String userHeaderName,
    String permissionsHeaderName) {

  public ProvidersApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    tenantIdHeaderName =
        tenantIdHeaderName == null || tenantIdHeaderName.isBlank()
            ? "X-Tenant-Id"
            : tenantIdHeaderName;
    userHeaderName =
        userHeaderName == null || userHeaderName.isBlank() ? "X-User-Email" : userHeaderName;
    permissionsHeaderName =
        permissionsHeaderName == null || permissionsHeaderName.isBlank()
            ? "X-User-Permissions"
            : permissionsHeaderName;
  }
}
