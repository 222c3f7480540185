/*
 * どこで: Providers データアクセス
 * 何を: tenant_api_keys の排他取得/登録を担う
 * なぜ: webhook 用 API キーをテナントごとに 1 本だけ発行するため
 */
package com.alerthub.providers.repository;

import static com.alerthub.common.JdbcTimestampUtils.toInstant;
import static com.alerthub.common.JdbcTimestampUtils.toTimestamp;

import com.alerthub.providers.model.TenantApiKeyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class TenantApiKeyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockByKey(long lockKey) {
    // 同一 tenant/reference の発行をトランザクション内で直列化する。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<TenantApiKeyRecord> findByReference(String tenantId, String referenceId) {
    final String sql =
        """
        SELECT tenant_id, reference_id, key_hash, created_by, description, created_at
        FROM tenant_api_keys
        WHERE tenant_id = :tenantId
          AND reference_id = :referenceId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("referenceId", referenceId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insert(TenantApiKeyRecord record) {
    final String sql =
        """
        INSERT INTO tenant_api_keys (
          tenant_id,
          reference_id,
          key_hash,
          created_by,
          description,
          created_at
        ) VALUES (
          :tenantId,
          :referenceId,
          :keyHash,
          :createdBy,
          :description,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", record.tenantId())
            .addValue("referenceId", record.referenceId())
            .addValue("keyHash", record.keyHash())
            .addValue("createdBy", record.createdBy())
            .addValue("description", record.description())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public int updateKeyHash(String tenantId, String referenceId, String keyHash) {
    final String sql =
        """
        UPDATE tenant_api_keys
        SET key_hash = :keyHash
        WHERE tenant_id = :tenantId
          AND reference_id = :referenceId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("referenceId", referenceId)
            .addValue("keyHash", keyHash);
    return jdbcTemplate.update(sql, params);
  }

  private TenantApiKeyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TenantApiKeyRecord(
        rs.getString("tenant_id"),
        rs.getString("reference_id"),
        rs.getString("key_hash"),
        rs.getString("created_by"),
        rs.getString("description"),
        toInstant(rs, "created_at"));
  }
}
