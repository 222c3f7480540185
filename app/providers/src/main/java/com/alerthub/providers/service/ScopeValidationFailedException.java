package com.alerthub.providers.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 必須 scope が満たされずインストールを中断したことを表す。 */
public class ScopeValidationFailedException extends RuntimeException {

  private final Map<String, Object> validatedScopes;
  private final List<String> failedScopes;

  public ScopeValidationFailedException(
      Map<String, Object> validatedScopes, List<String> failedScopes) {
    super("mandatory scopes are not granted: " + String.join(", ", failedScopes));
    this.validatedScopes = Collections.unmodifiableMap(new LinkedHashMap<>(validatedScopes));
    this.failedScopes = List.copyOf(failedScopes);
  }

  public Map<String, Object> validatedScopes() {
    return validatedScopes;
  }

  public List<String> failedScopes() {
    return failedScopes;
  }
}
