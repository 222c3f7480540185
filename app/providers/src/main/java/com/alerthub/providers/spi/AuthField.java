/*
 * どこで: Provider SPI
 * 何を: プロバイダ種別が要求する認証項目 1 件を表す
 * なぜ: 必須/秘匿/型をカタログで公開し、factory の検証と UI 表示に共用するため
 */
package com.alerthub.providers.spi;

public record AuthField(
    String name,
    String description,
    boolean required,
    boolean sensitive,
    AuthFieldType type,
    String hint) {

  public AuthField {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("auth field name is required");
    }
    description = description == null ? "" : description;
    type = type == null ? AuthFieldType.STRING : type;
  }

  public static AuthField required(String name, String description, AuthFieldType type) {
    return new AuthField(name, description, true, false, type, null);
  }

  public static AuthField optional(String name, String description, AuthFieldType type) {
    return new AuthField(name, description, false, false, type, null);
  }

  public AuthField asSensitive() {
    return new AuthField(name, description, required, true, type, hint);
  }

  public AuthField withHint(String newHint) {
    return new AuthField(name, description, required, sensitive, type, newHint);
  }
}
