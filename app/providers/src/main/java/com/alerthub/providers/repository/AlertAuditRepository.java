/*
 * どこで: Providers データアクセス
 * 何を: alert_audit を fingerprint 単位で時系列取得する
 * なぜ: 監査履歴の圧縮が発生順に並んだ入力を前提とするため
 */
package com.alerthub.providers.repository;

import static com.alerthub.common.JdbcTimestampUtils.toInstant;
import static com.alerthub.common.JdbcTimestampUtils.toTimestamp;

import com.alerthub.providers.model.AlertAuditEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AlertAuditRepository {

  private static final TypeReference<List<String>> MENTIONS_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public List<AlertAuditEvent> findByFingerprint(String tenantId, String fingerprint) {
    // 同時刻のイベントは id で順序を固定し、圧縮結果を呼び出しごとに安定させる。
    final String sql =
        """
        SELECT id, timestamp, fingerprint, action, user_id, description,
               mentions::text AS mentions_text
        FROM alert_audit
        WHERE tenant_id = :tenantId
          AND fingerprint = :fingerprint
        ORDER BY timestamp ASC, id ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("fingerprint", fingerprint);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int insert(String tenantId, AlertAuditEvent event) {
    final String sql =
        """
        INSERT INTO alert_audit (
          id,
          tenant_id,
          fingerprint,
          timestamp,
          action,
          user_id,
          description,
          mentions
        ) VALUES (
          :id,
          :tenantId,
          :fingerprint,
          :timestamp,
          :action,
          :userId,
          :description,
          :mentions::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", UUID.fromString(event.id()))
            .addValue("tenantId", tenantId)
            .addValue("fingerprint", event.fingerprint())
            .addValue("timestamp", toTimestamp(event.timestamp()))
            .addValue("action", event.action())
            .addValue("userId", event.userId())
            .addValue("description", event.description())
            .addValue("mentions", writeMentions(event.mentions()));
    return jdbcTemplate.update(sql, params);
  }

  private AlertAuditEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AlertAuditEvent(
        rs.getString("id"),
        toInstant(rs, "timestamp"),
        rs.getString("fingerprint"),
        rs.getString("action"),
        rs.getString("user_id"),
        rs.getString("description"),
        readMentions(rs.getString("mentions_text")));
  }

  private String writeMentions(List<String> mentions) {
    if (mentions == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(mentions);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize mentions", ex);
    }
  }

  private List<String> readMentions(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, MENTIONS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse mentions", ex);
    }
  }
}
