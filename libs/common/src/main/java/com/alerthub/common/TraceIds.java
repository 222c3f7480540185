package com.alerthub.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // ハイフン無しの 32 桁。OAuth2 インストール時の provider id に使う
  public static String newCompactId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
