/*
 * どこで: Providers サービス層
 * 何を: ProviderConfig を JSON として secret store へ読み書きする
 * なぜ: 設定キーの書式と直列化形式を一箇所に固定するため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.secret.SecretStore;
import com.alerthub.providers.spi.ProviderConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProviderConfigStore {

  private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT =
      new TypeReference<>() {};

  private final SecretStore secretStore;
  private final ObjectMapper objectMapper;

  public static String configurationKey(String tenantId, String providerType, String providerId) {
    return tenantId + "_" + providerType + "_" + providerId;
  }

  public void write(String key, ProviderConfig config) {
    final String json;
    try {
      json = objectMapper.writeValueAsString(config);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize provider config", ex);
    }
    secretStore.write(key, json);
  }

  /** secret が無い場合は SecretNotFoundException をそのまま伝える。 */
  public ProviderConfig read(String key) {
    final String json = secretStore.read(key);
    try {
      return objectMapper.readValue(json, ProviderConfig.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored provider config is not valid json: " + key, ex);
    }
  }

  /** 型に束縛せず JSON オブジェクトとして返す。export 用。 */
  public Map<String, Object> readJson(String key) {
    final String json = secretStore.read(key);
    try {
      return objectMapper.readValue(json, JSON_OBJECT);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored provider config is not valid json: " + key, ex);
    }
  }

  public boolean delete(String key) {
    return secretStore.delete(key);
  }
}
