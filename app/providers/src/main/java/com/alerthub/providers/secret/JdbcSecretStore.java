/*
 * どこで: Providers 秘密情報ストア
 * 何を: provider_secrets テーブルに秘密情報を保存する実装
 * なぜ: キー単位で原子的に upsert/削除できる永続ストアを既定にするため
 */
package com.alerthub.providers.secret;

import static com.alerthub.common.JdbcTimestampUtils.toTimestamp;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "providers.secret-store.type",
    havingValue = "jdbc",
    matchIfMissing = true)
public class JdbcSecretStore implements SecretStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public void write(String key, String value) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("secret key is required");
    }
    final String sql =
        """
        INSERT INTO provider_secrets (
          secret_key,
          secret_value,
          created_at,
          updated_at
        ) VALUES (
          :secretKey,
          :secretValue,
          :now,
          :now
        )
        ON CONFLICT (secret_key) DO UPDATE
          SET
            secret_value = EXCLUDED.secret_value,
            updated_at   = EXCLUDED.updated_at
        """;
    final Instant now = Instant.now(clock);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("secretKey", key)
            .addValue("secretValue", value)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public String read(String key) {
    final String sql =
        """
        SELECT secret_value
        FROM provider_secrets
        WHERE secret_key = :secretKey
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("secretKey", key);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getString("secret_value"))
        .stream()
        .findFirst()
        .orElseThrow(() -> new SecretNotFoundException(key));
  }

  @Override
  public boolean delete(String key) {
    final String sql = "DELETE FROM provider_secrets WHERE secret_key = :secretKey";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("secretKey", key);
    return jdbcTemplate.update(sql, params) > 0;
  }
}
