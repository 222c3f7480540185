/*
 * どこで: Provider SPI
 * 何を: プロバイダインスタンスの設定 (認証値と表示名) を表す
 * なぜ: secret store に保存する JSON と factory 入力の形を一つに揃えるため
 */
package com.alerthub.providers.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderConfig(Map<String, String> authentication, String name) {

  public ProviderConfig {
    authentication =
        authentication == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(authentication));
  }

  public static ProviderConfig of(Map<String, String> authentication) {
    return new ProviderConfig(authentication, null);
  }

  public static ProviderConfig empty() {
    return new ProviderConfig(Map.of(), null);
  }

  public String value(String key) {
    return authentication.get(key);
  }

  public Map<String, Object> toDetails() {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("authentication", authentication);
    if (name != null) {
      details.put("name", name);
    }
    return details;
  }
}
