/*
 * どこで: Provider SPI
 * 何を: 生成済みプロバイダインスタンスが公開する共通機能を定義する
 * なぜ: 種別ごとに異なる実装を一つの呼び出し面で扱うため
 */
package com.alerthub.providers.spi;

import java.util.List;
import java.util.Map;

public interface Provider extends AutoCloseable {

  String providerId();

  String providerType();

  /** scope 名ごとに true/false もしくは未充足理由の文字列を返す。 */
  Map<String, Object> validateScopes();

  List<Map<String, Object>> getAlertsConfiguration();

  List<ProviderLogEntry> getLogs(int limit);

  void deployAlert(Map<String, Object> alert, String alertId);

  Map<String, Object> getHealthReport();

  void setupWebhook(String tenantId, String webhookUrl, String apiKey, boolean setupAlerts);

  /** 削除時に外部側へ残した登録 (webhook など) を片付ける。 */
  void cleanUp();

  @Override
  void close();
}
