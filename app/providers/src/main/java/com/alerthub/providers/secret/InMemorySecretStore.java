/*
 * どこで: Providers 秘密情報ストア
 * 何を: プロセス内メモリに秘密情報を保持する実装
 * なぜ: ローカル実行とテストで DB を使わずにインストール経路を動かすため
 */
package com.alerthub.providers.secret;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "providers.secret-store.type", havingValue = "memory")
public class InMemorySecretStore implements SecretStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemorySecretStore.class);

  private final Map<String, String> secrets = new ConcurrentHashMap<>();

  @Override
  public void write(String key, String value) {
    requireKey(key);
    if (value == null) {
      throw new IllegalArgumentException("secret value is required");
    }
    secrets.put(key, value);
    logger.debug("secret written to memory store key={}", key);
  }

  @Override
  public String read(String key) {
    requireKey(key);
    final String value = secrets.get(key);
    if (value == null) {
      throw new SecretNotFoundException(key);
    }
    return value;
  }

  @Override
  public boolean delete(String key) {
    requireKey(key);
    return secrets.remove(key) != null;
  }

  public int size() {
    return secrets.size();
  }

  private void requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("secret key is required");
    }
  }
}
