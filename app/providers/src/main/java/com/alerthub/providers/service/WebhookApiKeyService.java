/*
 * どこで: Providers サービス層
 * 何を: webhook 受信用の tenant 共通 API キーを取得/発行する
 * なぜ: 外部システムからのコールバックを安定したシステム所有キーで認証するため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.model.TenantApiKeyRecord;
import com.alerthub.providers.repository.TenantApiKeyRepository;
import com.alerthub.providers.secret.SecretNotFoundException;
import com.alerthub.providers.secret.SecretStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class WebhookApiKeyService {

  static final String REFERENCE_ID = "webhook";
  static final String CREATED_BY = "system";
  static final String DESCRIPTION = "Webhooks API key";

  private static final Logger logger = LoggerFactory.getLogger(WebhookApiKeyService.class);

  private final TenantApiKeyRepository apiKeyRepository;
  private final SecretStore secretStore;
  private final ApiKeyDigester digester;
  private final Clock clock;

  @Transactional
  public String getOrCreateWebhookApiKey(String tenantId) {
    apiKeyRepository.lockByKey(digester.lockKey(tenantId + ":" + REFERENCE_ID));
    final String secretKey = secretKey(tenantId);
    final Optional<TenantApiKeyRecord> existing =
        apiKeyRepository.findByReference(tenantId, REFERENCE_ID);
    if (existing.isPresent()) {
      try {
        return secretStore.read(secretKey);
      } catch (SecretNotFoundException ex) {
        // ハッシュだけ残っている場合は平文を復元できないため発行し直す。
        logger.warn("webhook api key secret missing, rotating tenant_id={}", tenantId);
        return rotate(tenantId, secretKey);
      }
    }
    final String apiKey = digester.newApiKey();
    secretStore.write(secretKey, apiKey);
    apiKeyRepository.insert(
        new TenantApiKeyRecord(
            tenantId,
            REFERENCE_ID,
            digester.hash(apiKey),
            CREATED_BY,
            DESCRIPTION,
            Instant.now(clock)));
    logger.info("webhook api key created tenant_id={}", tenantId);
    return apiKey;
  }

  private String rotate(String tenantId, String secretKey) {
    final String apiKey = digester.newApiKey();
    secretStore.write(secretKey, apiKey);
    apiKeyRepository.updateKeyHash(tenantId, REFERENCE_ID, digester.hash(apiKey));
    return apiKey;
  }

  static String secretKey(String tenantId) {
    return tenantId + "_api_key_" + REFERENCE_ID;
  }
}
