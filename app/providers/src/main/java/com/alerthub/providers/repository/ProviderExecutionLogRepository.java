/*
 * どこで: Providers データアクセス
 * 何を: provider_execution_logs の登録/取得/削除を担う
 * なぜ: インストールや scope 検証の経緯をプロバイダ単位で追えるようにするため
 */
package com.alerthub.providers.repository;

import static com.alerthub.common.JdbcTimestampUtils.toInstant;
import static com.alerthub.common.JdbcTimestampUtils.toTimestamp;

import com.alerthub.providers.model.ProviderExecutionLogRecord;
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
public class ProviderExecutionLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(ProviderExecutionLogRecord record) {
    final String sql =
        """
        INSERT INTO provider_execution_logs (
          id,
          tenant_id,
          provider_id,
          timestamp,
          log_level,
          log_message,
          context
        ) VALUES (
          :id,
          :tenantId,
          :providerId,
          :timestamp,
          :level,
          :message,
          :context::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", UUID.fromString(record.id()))
            .addValue("tenantId", record.tenantId())
            .addValue("providerId", record.providerId())
            .addValue("timestamp", toTimestamp(record.timestamp()))
            .addValue("level", record.level())
            .addValue("message", record.message())
            .addValue("context", record.contextJson() == null ? "{}" : record.contextJson());
    return jdbcTemplate.update(sql, params);
  }

  public List<ProviderExecutionLogRecord> findByProvider(
      String tenantId, String providerId, int limit) {
    final String sql =
        """
        SELECT id, tenant_id, provider_id, timestamp, log_level, log_message,
               context::text AS context_text
        FROM provider_execution_logs
        WHERE tenant_id = :tenantId
          AND provider_id = :providerId
        ORDER BY timestamp DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteByProvider(String tenantId, String providerId) {
    final String sql =
        """
        DELETE FROM provider_execution_logs
        WHERE tenant_id = :tenantId
          AND provider_id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId);
    return jdbcTemplate.update(sql, params);
  }

  private ProviderExecutionLogRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProviderExecutionLogRecord(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("provider_id"),
        toInstant(rs, "timestamp"),
        rs.getString("log_level"),
        rs.getString("log_message"),
        rs.getString("context_text"));
  }
}
