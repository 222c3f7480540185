package com.alerthub.providers.spi;

import java.util.List;

public class ProviderConfigurationException extends ProviderException {

  private final List<String> invalidFields;

  public ProviderConfigurationException(String message) {
    this(message, List.of());
  }

  public ProviderConfigurationException(String message, List<String> invalidFields) {
    super(message);
    this.invalidFields = invalidFields == null ? List.of() : List.copyOf(invalidFields);
  }

  public ProviderConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.invalidFields = List.of();
  }

  public List<String> invalidFields() {
    return invalidFields;
  }
}
