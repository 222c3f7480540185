package com.alerthub.providers.service;

/** 想定外の失敗。原因は cause に保持し、呼び出し側へは固定文言だけを返す。 */
public class ProviderInternalException extends RuntimeException {

  public ProviderInternalException(Throwable cause) {
    super("internal server error", cause);
  }
}
