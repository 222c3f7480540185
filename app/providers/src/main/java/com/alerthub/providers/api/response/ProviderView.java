/*
 * どこで: Providers API レスポンス
 * 何を: 一覧/エクスポート/ヘルスチェック一覧で返すプロバイダ 1 件の表示形
 * なぜ: 種別メタデータとインストール状態と受信状況を一つの形にまとめて返すため
 */
package com.alerthub.providers.api.response;

import com.alerthub.providers.model.HourlyAlertCount;
import com.alerthub.providers.spi.AuthField;
import com.alerthub.providers.spi.ProviderScope;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderView(
    String id,
    String type,
    String displayName,
    boolean installed,
    boolean linked,
    Map<String, Object> details,
    Map<String, Object> validatedScopes,
    List<ProviderScope> scopes,
    Map<String, AuthField> config,
    boolean canQuery,
    List<String> queryParams,
    boolean canNotify,
    List<String> notifyParams,
    List<ProviderMethodView> methods,
    List<String> tags,
    List<String> categories,
    boolean pullingAvailable,
    boolean pullingEnabled,
    boolean supportsWebhook,
    boolean comingSoon,
    boolean health,
    String installedBy,
    Instant installationTime,
    String lastUpdatedBy,
    Instant lastAlertReceived,
    List<HourlyAlertCount> alertsDistribution) {

  public ProviderView withIdentity(String newId) {
    return new ProviderView(
        newId,
        type,
        displayName,
        installed,
        linked,
        details,
        validatedScopes,
        scopes,
        config,
        canQuery,
        queryParams,
        canNotify,
        notifyParams,
        methods,
        tags,
        categories,
        pullingAvailable,
        pullingEnabled,
        supportsWebhook,
        comingSoon,
        health,
        installedBy,
        installationTime,
        lastUpdatedBy,
        lastAlertReceived,
        alertsDistribution);
  }

  public ProviderView withDistribution(
      List<HourlyAlertCount> distribution, Instant lastReceived) {
    return new ProviderView(
        id,
        type,
        displayName,
        installed,
        linked,
        details,
        validatedScopes,
        scopes,
        config,
        canQuery,
        queryParams,
        canNotify,
        notifyParams,
        methods,
        tags,
        categories,
        pullingAvailable,
        pullingEnabled,
        supportsWebhook,
        comingSoon,
        health,
        installedBy,
        installationTime,
        lastUpdatedBy,
        lastAlertReceived == null ? lastReceived : lastAlertReceived,
        distribution);
  }
}
