package com.alerthub.providers.model;

import java.time.Instant;

public record TenantApiKeyRecord(
    String tenantId,
    String referenceId,
    String keyHash,
    String createdBy,
    String description,
    Instant createdAt) {}
