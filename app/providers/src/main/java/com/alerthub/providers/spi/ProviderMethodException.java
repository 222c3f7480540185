/*
 * どこで: Provider SPI
 * 何を: プロバイダ自身がステータスとメッセージを決めて報告する失敗
 * なぜ: 外部サービスの拒否理由を呼び出し側へそのまま伝えるため
 */
package com.alerthub.providers.spi;

public class ProviderMethodException extends ProviderException {

  private final int statusCode;

  public ProviderMethodException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public ProviderMethodException(int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
