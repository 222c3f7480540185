/*
 * どこで: Providers ドメインモデル
 * 何を: アラート 1 件に紐づく監査イベントを表す
 * なぜ: 監査履歴の圧縮を入力を書き換えずに行えるよう不変値として扱うため
 */
package com.alerthub.providers.model;

import java.time.Instant;
import java.util.List;

public record AlertAuditEvent(
    String id,
    Instant timestamp,
    String fingerprint,
    String action,
    String userId,
    String description,
    List<String> mentions) {

  public AlertAuditEvent {
    mentions = mentions == null ? null : List.copyOf(mentions);
  }

  public AlertAuditEvent withDescription(String newDescription) {
    return new AlertAuditEvent(id, timestamp, fingerprint, action, userId, newDescription, mentions);
  }
}
