package com.alerthub.providers.spi;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public enum ParameterType {
  STRING,
  INTEGER,
  NUMBER,
  BOOLEAN,
  OBJECT,
  LIST,
  ANY;

  public boolean accepts(Object value) {
    return switch (this) {
      case STRING -> value instanceof CharSequence;
      case INTEGER ->
          value instanceof Integer
              || value instanceof Long
              || value instanceof Short
              || value instanceof BigInteger;
      case NUMBER -> value instanceof Number;
      case BOOLEAN -> value instanceof Boolean;
      case OBJECT -> value instanceof Map<?, ?>;
      case LIST -> value instanceof List<?>;
      case ANY -> true;
    };
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
