package com.alerthub.providers.api.response;

import com.alerthub.providers.model.AlertAuditEvent;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertAuditResponse(
    String id,
    Instant timestamp,
    String fingerprint,
    String action,
    String userId,
    String description,
    List<Mention> mentions) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Mention(String mentionedUserId) {}

  public static AlertAuditResponse from(AlertAuditEvent event) {
    // 空のメンションは null として返す。
    final List<Mention> mentions =
        event.mentions() == null || event.mentions().isEmpty()
            ? null
            : event.mentions().stream().map(Mention::new).toList();
    return new AlertAuditResponse(
        event.id(),
        event.timestamp(),
        event.fingerprint(),
        event.action(),
        event.userId(),
        event.description(),
        mentions);
  }
}
