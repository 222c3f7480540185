/*
 * どこで: Provider SPI
 * 何を: 認証項目の値の型と書式判定を定義する
 * なぜ: 不正な設定でインスタンスを生成しないよう factory で事前検証するため
 */
package com.alerthub.providers.spi;

import java.net.URI;
import java.net.URISyntaxException;

public enum AuthFieldType {
  STRING,
  URL,
  INTEGER,
  BOOLEAN;

  public boolean accepts(String value) {
    if (value == null) {
      return false;
    }
    return switch (this) {
      case STRING -> true;
      case URL -> isHttpUrl(value);
      case INTEGER -> isInteger(value);
      case BOOLEAN -> "true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value);
    };
  }

  private static boolean isHttpUrl(String value) {
    try {
      final URI uri = new URI(value.trim());
      final String scheme = uri.getScheme();
      return uri.getHost() != null
          && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  private static boolean isInteger(String value) {
    try {
      Long.parseLong(value.trim());
      return true;
    } catch (NumberFormatException ex) {
      return false;
    }
  }
}
