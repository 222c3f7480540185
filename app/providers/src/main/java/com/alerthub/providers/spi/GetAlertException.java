package com.alerthub.providers.spi;

/** アラート設定の取得失敗。接続テストでは status をそのまま返す。 */
public class GetAlertException extends ProviderMethodException {

  public GetAlertException(int statusCode, String message) {
    super(statusCode, message);
  }

  public GetAlertException(int statusCode, String message, Throwable cause) {
    super(statusCode, message, cause);
  }
}
