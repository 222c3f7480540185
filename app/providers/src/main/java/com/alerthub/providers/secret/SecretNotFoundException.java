package com.alerthub.providers.secret;

public class SecretNotFoundException extends RuntimeException {

  private final String key;

  public SecretNotFoundException(String key) {
    super("secret not found: " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
