package com.alerthub.providers.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstallProviderResponse(
    String type,
    String id,
    Map<String, Object> details,
    Map<String, Object> validatedScopes,
    Boolean webhookInstalled,
    String webhookError) {}
