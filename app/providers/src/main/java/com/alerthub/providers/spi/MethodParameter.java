package com.alerthub.providers.spi;

public record MethodParameter(String name, ParameterType type, boolean required) {

  public MethodParameter {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("parameter name is required");
    }
    type = type == null ? ParameterType.ANY : type;
  }

  public static MethodParameter required(String name, ParameterType type) {
    return new MethodParameter(name, type, true);
  }

  public static MethodParameter optional(String name, ParameterType type) {
    return new MethodParameter(name, type, false);
  }
}
