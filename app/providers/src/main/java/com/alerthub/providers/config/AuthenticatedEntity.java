package com.alerthub.providers.config;

/** ゲートウェイで認証済みの呼び出し元。tenant はすべての操作の暗黙引数になる。 */
public record AuthenticatedEntity(String tenantId, String email) {

  public String actor() {
    return email == null || email.isBlank() ? "system" : email;
  }
}
