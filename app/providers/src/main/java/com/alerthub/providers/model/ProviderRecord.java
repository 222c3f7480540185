/*
 * どこで: Providers ドメインモデル
 * 何を: テナントにインストール済みのプロバイダ (providers テーブル 1 行) を表す
 * なぜ: 設定本体は secret store に置き、レコードには参照キーだけを保持するため
 */
package com.alerthub.providers.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderRecord(
    String id,
    String tenantId,
    String name,
    String type,
    String installedBy,
    Instant installationTime,
    String lastUpdatedBy,
    Instant lastUpdatedAt,
    String configurationKey,
    Map<String, Object> validatedScopes,
    boolean pullingEnabled) {

  public ProviderRecord {
    validatedScopes =
        validatedScopes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(validatedScopes));
  }

  public ProviderRecord withValidatedScopes(Map<String, Object> scopes) {
    return new ProviderRecord(
        id,
        tenantId,
        name,
        type,
        installedBy,
        installationTime,
        lastUpdatedBy,
        lastUpdatedAt,
        configurationKey,
        scopes,
        pullingEnabled);
  }
}
