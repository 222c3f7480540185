/*
 * どこで: Providers データアクセス
 * 何を: providers テーブルの登録/取得/更新/削除を担う
 * なぜ: (tenant_id, id) 単位でインストール状態を一意に管理するため
 */
package com.alerthub.providers.repository;

import static com.alerthub.common.JdbcTimestampUtils.toInstant;
import static com.alerthub.common.JdbcTimestampUtils.toTimestamp;

import com.alerthub.providers.model.ProviderRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProviderRepository {

  private static final TypeReference<LinkedHashMap<String, Object>> SCOPES_TYPE =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<ProviderRecord> findByTenantAndId(String tenantId, String providerId) {
    final String sql =
        """
        SELECT tenant_id, id, name, type, installed_by, installation_time,
               last_updated_by, last_updated_at, configuration_key,
               validated_scopes::text AS validated_scopes_text, pulling_enabled
        FROM providers
        WHERE tenant_id = :tenantId
          AND id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ProviderRecord> findByTenant(String tenantId) {
    final String sql =
        """
        SELECT tenant_id, id, name, type, installed_by, installation_time,
               last_updated_by, last_updated_at, configuration_key,
               validated_scopes::text AS validated_scopes_text, pulling_enabled
        FROM providers
        WHERE tenant_id = :tenantId
        ORDER BY installation_time, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("tenantId", tenantId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean exists(String tenantId, String providerId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM providers
        WHERE tenant_id = :tenantId
          AND id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count != null && count > 0;
  }

  public int insert(ProviderRecord record) {
    // (tenant_id, id) の主キー違反は DuplicateKeyException として呼び出し側で扱う。
    final String sql =
        """
        INSERT INTO providers (
          tenant_id,
          id,
          name,
          type,
          installed_by,
          installation_time,
          configuration_key,
          validated_scopes,
          pulling_enabled
        ) VALUES (
          :tenantId,
          :id,
          :name,
          :type,
          :installedBy,
          :installationTime,
          :configurationKey,
          :validatedScopes::jsonb,
          :pullingEnabled
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", record.tenantId())
            .addValue("id", record.id())
            .addValue("name", record.name())
            .addValue("type", record.type())
            .addValue("installedBy", record.installedBy())
            .addValue("installationTime", toTimestamp(record.installationTime()))
            .addValue("configurationKey", record.configurationKey())
            .addValue("validatedScopes", writeScopes(record.validatedScopes()))
            .addValue("pullingEnabled", record.pullingEnabled());
    return jdbcTemplate.update(sql, params);
  }

  public int updateValidatedScopes(
      String tenantId, String providerId, Map<String, Object> validatedScopes) {
    final String sql =
        """
        UPDATE providers
        SET validated_scopes = :validatedScopes::jsonb
        WHERE tenant_id = :tenantId
          AND id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId)
            .addValue("validatedScopes", writeScopes(validatedScopes));
    return jdbcTemplate.update(sql, params);
  }

  public int updateConfiguration(
      String tenantId,
      String providerId,
      Map<String, Object> validatedScopes,
      String updatedBy,
      Instant updatedAt) {
    final String sql =
        """
        UPDATE providers
        SET validated_scopes = :validatedScopes::jsonb,
            last_updated_by  = :updatedBy,
            last_updated_at  = :updatedAt
        WHERE tenant_id = :tenantId
          AND id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId)
            .addValue("validatedScopes", writeScopes(validatedScopes))
            .addValue("updatedBy", updatedBy)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String tenantId, String providerId) {
    final String sql =
        """
        DELETE FROM providers
        WHERE tenant_id = :tenantId
          AND id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("providerId", providerId);
    return jdbcTemplate.update(sql, params);
  }

  private ProviderRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProviderRecord(
        rs.getString("id"),
        rs.getString("tenant_id"),
        rs.getString("name"),
        rs.getString("type"),
        rs.getString("installed_by"),
        toInstant(rs, "installation_time"),
        rs.getString("last_updated_by"),
        toInstant(rs, "last_updated_at"),
        rs.getString("configuration_key"),
        readScopes(rs.getString("validated_scopes_text")),
        rs.getBoolean("pulling_enabled"));
  }

  private String writeScopes(Map<String, Object> validatedScopes) {
    try {
      return objectMapper.writeValueAsString(validatedScopes == null ? Map.of() : validatedScopes);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize validated scopes", ex);
    }
  }

  private Map<String, Object> readScopes(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, SCOPES_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse validated scopes", ex);
    }
  }
}
