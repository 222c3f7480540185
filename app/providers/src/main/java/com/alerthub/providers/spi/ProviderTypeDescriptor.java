/*
 * どこで: Provider SPI
 * 何を: プロバイダ種別のメタデータ (認証項目/scope/機能/webhook テンプレート/アラートスキーマ) を保持する
 * なぜ: インスタンス化せずにカタログ表示・設定検証・webhook 案内を行うため
 */
package com.alerthub.providers.spi;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record ProviderTypeDescriptor(
    String type,
    String displayName,
    List<AuthField> authFields,
    List<ProviderScope> scopes,
    Set<ProviderCapability> capabilities,
    List<String> tags,
    List<String> categories,
    Map<String, Object> alertSchema,
    WebhookTemplates webhookTemplates,
    boolean comingSoon) {

  public ProviderTypeDescriptor {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("provider type is required");
    }
    displayName = displayName == null || displayName.isBlank() ? type : displayName;
    authFields = authFields == null ? List.of() : List.copyOf(authFields);
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
    capabilities =
        capabilities == null || capabilities.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(ProviderCapability.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    tags = tags == null ? List.of() : List.copyOf(tags);
    categories = categories == null ? List.of("Others") : List.copyOf(categories);
    alertSchema =
        alertSchema == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(alertSchema));
  }

  public boolean supports(ProviderCapability capability) {
    return capabilities.contains(capability);
  }

  public boolean hasMandatoryScopes() {
    return scopes.stream().anyMatch(ProviderScope::mandatory);
  }

  public List<String> mandatoryScopeNames() {
    return scopes.stream().filter(ProviderScope::mandatory).map(ProviderScope::name).toList();
  }

  public List<AuthField> requiredAuthFields() {
    return authFields.stream().filter(AuthField::required).toList();
  }

  public Optional<WebhookTemplates> webhook() {
    return Optional.ofNullable(webhookTemplates);
  }
}
