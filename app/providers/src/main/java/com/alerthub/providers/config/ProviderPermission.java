/*
 * どこで: Providers セキュリティ設定
 * 何を: 各操作に要求する権限値を定義する
 * なぜ: ゲートウェイから転送される権限文字列と操作の対応を一箇所で管理するため
 */
package com.alerthub.providers.config;

public enum ProviderPermission {
  READ_PROVIDERS("read:providers"),
  WRITE_PROVIDERS("write:providers"),
  DELETE_PROVIDERS("delete:providers"),
  UPDATE_PROVIDERS("update:providers"),
  READ_ALERT("read:alert"),
  WRITE_ALERT("write:alert");

  private final String value;

  ProviderPermission(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static boolean isKnown(String value) {
    for (ProviderPermission permission : values()) {
      if (permission.value.equals(value)) {
        return true;
      }
    }
    return false;
  }
}
