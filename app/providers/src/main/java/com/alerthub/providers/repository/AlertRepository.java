/*
 * どこで: Providers データアクセス
 * 何を: alerts テーブルからプロバイダ単位の件数/分布/リンク元を集計する
 * なぜ: 一覧画面で受信状況とインストール外の送信元を示すため
 */
package com.alerthub.providers.repository;

import static com.alerthub.common.JdbcTimestampUtils.toInstant;
import static com.alerthub.common.JdbcTimestampUtils.toTimestamp;

import com.alerthub.providers.model.HourlyAlertCount;
import com.alerthub.providers.model.LinkedProviderRecord;
import com.alerthub.providers.model.ProviderAlertDistribution;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AlertRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long countAllAlerts(String tenantId, String providerType, String providerId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM alerts
        WHERE tenant_id = :tenantId
          AND provider_type = :providerType
          AND provider_id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerType", providerType)
            .addValue("providerId", providerId);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public long countAlertsBetween(
      String tenantId, String providerType, String providerId, Instant startTime, Instant endTime) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM alerts
        WHERE tenant_id = :tenantId
          AND provider_type = :providerType
          AND provider_id = :providerId
          AND timestamp >= :startTime
          AND timestamp <= :endTime
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerType", providerType)
            .addValue("providerId", providerId)
            .addValue("startTime", toTimestamp(startTime))
            .addValue("endTime", toTimestamp(endTime));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  /** キーは {@link ProviderAlertDistribution#key(String, String)}。 */
  public Map<String, ProviderAlertDistribution> findDistribution(String tenantId, Instant since) {
    final String hourlySql =
        """
        SELECT provider_id, provider_type,
               date_trunc('hour', timestamp) AS hour,
               COUNT(*) AS number
        FROM alerts
        WHERE tenant_id = :tenantId
          AND timestamp >= :since
        GROUP BY provider_id, provider_type, date_trunc('hour', timestamp)
        ORDER BY hour
        """;
    final String lastReceivedSql =
        """
        SELECT provider_id, provider_type, MAX(timestamp) AS last_alert_received
        FROM alerts
        WHERE tenant_id = :tenantId
        GROUP BY provider_id, provider_type
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("since", toTimestamp(since));

    final Map<String, List<HourlyAlertCount>> hourly = new LinkedHashMap<>();
    jdbcTemplate.query(
        hourlySql,
        params,
        rs -> {
          final String key =
              ProviderAlertDistribution.key(rs.getString("provider_id"), rs.getString("provider_type"));
          hourly
              .computeIfAbsent(key, ignored -> new ArrayList<>())
              .add(new HourlyAlertCount(toInstant(rs, "hour"), rs.getLong("number")));
        });

    final Map<String, ProviderAlertDistribution> result = new LinkedHashMap<>();
    jdbcTemplate.query(
        lastReceivedSql,
        params,
        rs -> {
          final String providerId = rs.getString("provider_id");
          final String providerType = rs.getString("provider_type");
          final String key = ProviderAlertDistribution.key(providerId, providerType);
          result.put(
              key,
              new ProviderAlertDistribution(
                  providerId,
                  providerType,
                  hourly.getOrDefault(key, List.of()),
                  toInstant(rs, "last_alert_received")));
        });
    return result;
  }

  public List<LinkedProviderRecord> findLinkedProviders(String tenantId) {
    final String sql =
        """
        SELECT a.provider_type, a.provider_id, MAX(a.timestamp) AS last_alert_received
        FROM alerts a
        LEFT JOIN providers p
          ON p.tenant_id = a.tenant_id
         AND p.id = a.provider_id
        WHERE a.tenant_id = :tenantId
          AND a.provider_type IS NOT NULL
          AND p.id IS NULL
        GROUP BY a.provider_type, a.provider_id
        ORDER BY a.provider_type, a.provider_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("tenantId", tenantId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new LinkedProviderRecord(
                rs.getString("provider_type"),
                rs.getString("provider_id"),
                toInstant(rs, "last_alert_received")));
  }
}
