package com.alerthub.providers.service;

public class ProviderAlreadyInstalledException extends RuntimeException {

  public ProviderAlreadyInstalledException(String providerId) {
    super("provider " + providerId + " is already installed");
  }

  public ProviderAlreadyInstalledException(String providerId, Throwable cause) {
    super("provider " + providerId + " is already installed", cause);
  }
}
