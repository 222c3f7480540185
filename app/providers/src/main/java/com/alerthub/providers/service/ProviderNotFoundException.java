package com.alerthub.providers.service;

public class ProviderNotFoundException extends RuntimeException {

  public enum Reason {
    PROVIDER_TYPE,
    PROVIDER,
    METHOD
  }

  private final Reason reason;

  public ProviderNotFoundException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ProviderNotFoundException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public static ProviderNotFoundException unknownType(String providerType) {
    return new ProviderNotFoundException(
        Reason.PROVIDER_TYPE, "provider type " + providerType + " not found");
  }

  public static ProviderNotFoundException unknownProvider(String providerId) {
    return new ProviderNotFoundException(Reason.PROVIDER, "provider " + providerId + " not found");
  }

  public static ProviderNotFoundException unknownMethod(String providerType, String methodName) {
    return new ProviderNotFoundException(
        Reason.METHOD, "method " + methodName + " not found on provider type " + providerType);
  }

  public Reason reason() {
    return reason;
  }
}
