/*
 * どこで: Providers サービス層
 * 何を: プロバイダ単位のライフサイクルログを記録/取得する
 * なぜ: インストールや scope 検証の経緯を画面から追えるようにするため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.model.ProviderExecutionLogRecord;
import com.alerthub.providers.repository.ProviderExecutionLogRepository;
import com.alerthub.providers.repository.ProviderRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProviderExecutionLogService {

  static final int DEFAULT_LIMIT = 100;

  private static final Logger logger = LoggerFactory.getLogger(ProviderExecutionLogService.class);

  private final ProviderExecutionLogRepository logRepository;
  private final ProviderRepository providerRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public void info(String tenantId, String providerId, String message, Map<String, Object> context) {
    append(tenantId, providerId, "INFO", message, context);
  }

  public void warn(String tenantId, String providerId, String message, Map<String, Object> context) {
    append(tenantId, providerId, "WARNING", message, context);
  }

  public List<ProviderExecutionLogRecord> getLogs(String tenantId, String providerId) {
    if (!providerRepository.exists(tenantId, providerId)) {
      throw ProviderNotFoundException.unknownProvider(providerId);
    }
    return logRepository.findByProvider(tenantId, providerId, DEFAULT_LIMIT);
  }

  public int deleteLogs(String tenantId, String providerId) {
    return logRepository.deleteByProvider(tenantId, providerId);
  }

  private void append(
      String tenantId,
      String providerId,
      String level,
      String message,
      Map<String, Object> context) {
    final ProviderExecutionLogRecord record =
        new ProviderExecutionLogRecord(
            UUID.randomUUID().toString(),
            tenantId,
            providerId,
            Instant.now(clock),
            level,
            message,
            toJson(context));
    try {
      logRepository.insert(record);
    } catch (DataAccessException ex) {
      // ライフサイクルログの欠落で本処理を失敗させない。
      logger.warn(
          "failed to append provider execution log tenant_id={} provider_id={} message={}",
          tenantId,
          providerId,
          message,
          ex);
    }
  }

  private String toJson(Map<String, Object> context) {
    try {
      return objectMapper.writeValueAsString(context == null ? Map.of() : context);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize provider log context", ex);
    }
  }
}
