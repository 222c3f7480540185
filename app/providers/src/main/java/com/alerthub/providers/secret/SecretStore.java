/*
 * どこで: Providers 秘密情報ストア
 * 何を: プロバイダ設定を格納する key/value ストアの契約
 * なぜ: レコードには参照キーだけを持たせ、認証情報を別ストアへ隔離するため
 */
package com.alerthub.providers.secret;

public interface SecretStore {

  /** 同一キーへの書き込みは上書きになる。 */
  void write(String key, String value);

  /** 存在しない場合は {@link SecretNotFoundException}。 */
  String read(String key);

  /** 削除した場合 true。 */
  boolean delete(String key);
}
