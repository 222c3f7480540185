package com.alerthub.providers.model;

import java.time.Instant;

public record ProviderExecutionLogRecord(
    String id,
    String tenantId,
    String providerId,
    Instant timestamp,
    String level,
    String message,
    String contextJson) {}
