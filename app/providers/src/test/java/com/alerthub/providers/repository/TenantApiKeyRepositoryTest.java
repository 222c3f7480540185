/*
 * どこで: Providers リポジトリの統合テスト
 * 何を: tenant API キーの登録/参照/ハッシュ更新と advisory lock の前提を Postgres で検証する
 * なぜ: webhook キー発行が DB 上で一意かつ直列化されることを保証するため
 */
package com.alerthub.providers.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alerthub.providers.AbstractPostgresContainerTest;
import com.alerthub.providers.model.TenantApiKeyRecord;
import com.alerthub.providers.service.WebhookApiKeyService;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;

@SpringBootTest
@ActiveProfiles("test")
class TenantApiKeyRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private TenantApiKeyRepository apiKeyRepository;

  @Autowired private WebhookApiKeyService webhookApiKeyService;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM tenant_api_keys", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM provider_secrets", new MapSqlParameterSource());
  }

  @Test
  void insertFindAndUpdateKeyHash() {
    apiKeyRepository.insert(
        new TenantApiKeyRecord("tenant-a", "webhook", "hash-1", "system", "Webhooks API key", BASE_TIME));

    apiKeyRepository.updateKeyHash("tenant-a", "webhook", "hash-2");

    final TenantApiKeyRecord found = apiKeyRepository.findByReference("tenant-a", "webhook").orElseThrow();
    assertThat(found.keyHash()).isEqualTo("hash-2");
    assertThat(found.createdBy()).isEqualTo("system");
    assertThat(found.createdAt()).isEqualTo(BASE_TIME);
    assertThat(apiKeyRepository.findByReference("tenant-b", "webhook")).isEmpty();
  }

  @Test
  void lockRequiresSurroundingTransaction() {
    assertThatThrownBy(() -> apiKeyRepository.lockByKey(42L))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void webhookApiKeyIsStableAcrossCalls() {
    final String first = webhookApiKeyService.getOrCreateWebhookApiKey("tenant-a");
    final String second = webhookApiKeyService.getOrCreateWebhookApiKey("tenant-a");
    final String otherTenant = webhookApiKeyService.getOrCreateWebhookApiKey("tenant-b");

    assertThat(second).isEqualTo(first);
    assertThat(otherTenant).isNotEqualTo(first);
    assertThat(apiKeyRepository.findByReference("tenant-a", "webhook")).isPresent();
  }
}
