/*
 * どこで: Provider SPI
 * 何を: メソッド呼び出し引数の過不足/型不一致を表す
 * なぜ: プロバイダ内部の失敗と呼び出し側の入力誤りを区別するため
 */
package com.alerthub.providers.spi;

public class InvalidParametersException extends RuntimeException {

  public InvalidParametersException(String message) {
    super(message);
  }

  public InvalidParametersException(String message, Throwable cause) {
    super(message, cause);
  }
}
