package com.alerthub.providers.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 宣言に沿って検証済みの引数。取り出しは型付きアクセサで行う。 */
public final class MethodArguments {

  private final String methodName;
  private final Map<String, Object> values;

  MethodArguments(String methodName, Map<String, Object> values) {
    this.methodName = methodName;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public String string(String name) {
    return require(name).toString();
  }

  public String string(String name, String defaultValue) {
    final Object value = values.get(name);
    return value == null ? defaultValue : value.toString();
  }

  public long integer(String name, long defaultValue) {
    final Object value = values.get(name);
    return value == null ? defaultValue : ((Number) value).longValue();
  }

  public boolean bool(String name, boolean defaultValue) {
    final Object value = values.get(name);
    return value == null ? defaultValue : (Boolean) value;
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> object(String name) {
    final Object value = values.get(name);
    return value == null ? Map.of() : (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  public List<Object> list(String name) {
    final Object value = values.get(name);
    return value == null ? List.of() : (List<Object>) value;
  }

  public Map<String, Object> asMap() {
    return values;
  }

  private Object require(String name) {
    final Object value = values.get(name);
    if (value == null) {
      throw new InvalidParametersException(methodName + "() missing required parameter: " + name);
    }
    return value;
  }
}
