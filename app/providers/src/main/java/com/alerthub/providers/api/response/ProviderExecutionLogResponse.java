package com.alerthub.providers.api.response;

import com.alerthub.providers.model.ProviderExecutionLogRecord;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** context は保存済みの JSON をそのまま埋め込む。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderExecutionLogResponse(
    String id,
    String providerId,
    Instant timestamp,
    String logLevel,
    String logMessage,
    @JsonRawValue String context) {

  public static ProviderExecutionLogResponse from(ProviderExecutionLogRecord record) {
    return new ProviderExecutionLogResponse(
        record.id(),
        record.providerId(),
        record.timestamp(),
        record.level(),
        record.message(),
        record.contextJson() == null ? "{}" : record.contextJson());
  }
}
