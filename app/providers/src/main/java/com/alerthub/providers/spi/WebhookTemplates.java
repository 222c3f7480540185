/*
 * どこで: Provider SPI
 * 何を: webhook 設定手順の説明/ペイロード/markdown テンプレートを保持する
 * なぜ: 受信 URL と API キーを埋め込んだ案内文を種別ごとに提供するため
 */
package com.alerthub.providers.spi;

public record WebhookTemplates(String description, String template, String markdown) {

  public static final String PLACEHOLDER_URL = "{webhook_url}";
  public static final String PLACEHOLDER_API_KEY = "{api_key}";
  public static final String PLACEHOLDER_URL_WITH_AUTH = "{webhook_url_with_auth}";

  public WebhookTemplates {
    description = description == null ? "" : description;
    template = template == null ? "" : template;
  }
}
