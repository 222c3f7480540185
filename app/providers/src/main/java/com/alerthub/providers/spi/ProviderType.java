/*
 * どこで: Provider SPI
 * 何を: プロバイダ種別 1 件 (メタデータ/メソッド登録簿/生成関数/OAuth2 交換) を表す
 * なぜ: カタログが種別名から生成関数を引けるようにし、リフレクションを使わないため
 */
package com.alerthub.providers.spi;

import java.util.Map;

public abstract class ProviderType<P extends Provider> {

  private final ProviderTypeDescriptor descriptor;
  private final ProviderMethodRegistry<P> methods;

  protected ProviderType(ProviderTypeDescriptor descriptor, ProviderMethodRegistry<P> methods) {
    this.descriptor = descriptor;
    this.methods = methods;
  }

  public final String typeName() {
    return descriptor.type();
  }

  public final ProviderTypeDescriptor descriptor() {
    return descriptor;
  }

  public final ProviderMethodRegistry<P> methods() {
    return methods;
  }

  /** 設定は factory で検証済みの前提で呼ばれる。 */
  public abstract P create(ProviderContext context, String providerId, ProviderConfig config);

  /** 認可コード等のペイロードを認証項目へ交換する。既定では未対応。 */
  public Map<String, String> exchangeOAuth2(Map<String, Object> payload) {
    throw new ProviderConfigurationException(
        "provider type " + typeName() + " does not support oauth2 installation");
  }
}
