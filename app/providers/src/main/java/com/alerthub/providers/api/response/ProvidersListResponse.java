package com.alerthub.providers.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProvidersListResponse(
    List<ProviderView> providers,
    List<ProviderView> installedProviders,
    List<ProviderView> linkedProviders,
    boolean isLocalhost) {}
