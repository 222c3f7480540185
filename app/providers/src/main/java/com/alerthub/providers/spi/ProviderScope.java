/*
 * どこで: Provider SPI
 * 何を: プロバイダの認証情報が満たすべき権限 (scope) を表す
 * なぜ: インストール前の必須 scope 検証と画面表示の元データにするため
 */
package com.alerthub.providers.spi;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderScope(
    String name,
    String description,
    boolean mandatory,
    boolean mandatoryForWebhook,
    String documentationUrl) {

  public ProviderScope {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("scope name is required");
    }
    description = description == null ? "" : description;
  }

  public static ProviderScope mandatory(String name, String description) {
    return new ProviderScope(name, description, true, false, null);
  }

  public static ProviderScope optional(String name, String description) {
    return new ProviderScope(name, description, false, false, null);
  }
}
