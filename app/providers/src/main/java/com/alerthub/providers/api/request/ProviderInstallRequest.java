/*
 * どこで: Providers API リクエスト
 * 何を: インストール要求の本文から識別子/フラグ/認証項目を取り出す
 * なぜ: 種別ごとに異なる認証項目をフラットな本文で受け付けるため
 */
package com.alerthub.providers.api.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderInstallRequest(
    String providerId,
    String providerName,
    String providerType,
    Map<String, String> authentication,
    boolean pullingEnabled,
    boolean installWebhook) {

  public ProviderInstallRequest {
    authentication =
        authentication == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(authentication));
  }

  public static ProviderInstallRequest fromBody(Map<String, Object> body) {
    if (body == null || body.isEmpty()) {
      throw new IllegalArgumentException("no valid data provided");
    }
    final Map<String, Object> remaining = new LinkedHashMap<>(body);
    final String providerId = requireText(remaining, "provider_id");
    final String providerName = requireText(remaining, "provider_name");
    final Object rawType = remaining.remove("provider_type");
    final String providerType =
        rawType == null || rawType.toString().isBlank() ? providerId : rawType.toString();
    final boolean pullingEnabled = flag(remaining.remove("pulling_enabled"), true);
    final boolean installWebhook = flag(remaining.remove("install_webhook"), false);
    return new ProviderInstallRequest(
        providerId,
        providerName,
        providerType,
        toAuthentication(remaining),
        pullingEnabled,
        installWebhook);
  }

  /** JSON の真偽値と "true"/"false" 文字列の両方を受け付ける。 */
  public static boolean flag(Object value, boolean defaultValue) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String text && !text.isBlank()) {
      return Boolean.parseBoolean(text.trim());
    }
    return defaultValue;
  }

  public static Map<String, String> toAuthentication(Map<String, Object> values) {
    final Map<String, String> authentication = new LinkedHashMap<>();
    values.forEach(
        (key, value) -> {
          if (value != null) {
            authentication.put(key, value.toString());
          }
        });
    return authentication;
  }

  private static String requireText(Map<String, Object> body, String field) {
    final Object value = body.remove(field);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("missing required field: " + field);
    }
    return value.toString();
  }
}
