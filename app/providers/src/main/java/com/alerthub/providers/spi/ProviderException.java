/*
 * どこで: Provider SPI
 * 何を: プロバイダ由来の失敗の基底例外
 * なぜ: 境界層でプロバイダ起因の失敗をまとめて client error に寄せるため
 */
package com.alerthub.providers.spi;

public class ProviderException extends RuntimeException {

  public ProviderException(String message) {
    super(message);
  }

  public ProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
