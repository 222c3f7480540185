/*
 * どこで: Provider SPI
 * 何を: プロバイダ種別が提供できる機能の集合を定義する
 * なぜ: インスタンスを生成せずにカタログ上で機能有無を判定するため
 */
package com.alerthub.providers.spi;

public enum ProviderCapability {
  QUERY,
  NOTIFY,
  PULL_ALERTS,
  DEPLOY_ALERTS,
  WEBHOOK,
  HEALTH,
  LOGS,
  OAUTH2
}
