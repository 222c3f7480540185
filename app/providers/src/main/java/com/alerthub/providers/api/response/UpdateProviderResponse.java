package com.alerthub.providers.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateProviderResponse(
    Map<String, Object> details, Map<String, Object> validatedScopes, String updatedBy) {}
