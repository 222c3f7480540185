/*
 * どこで: Provider SPI
 * 何を: 種別ごとのメソッド名から型付きハンドラへの登録簿
 * なぜ: 名前による動的呼び出しをリフレクション無しで実現し、登録時に重複を弾くため
 */
package com.alerthub.providers.spi;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class ProviderMethodRegistry<P extends Provider> {

  private final Class<P> providerClass;
  private final Map<String, ProviderMethod<P>> methods;

  private ProviderMethodRegistry(Class<P> providerClass, Map<String, ProviderMethod<P>> methods) {
    this.providerClass = providerClass;
    this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
  }

  public static <P extends Provider> Builder<P> builder(Class<P> providerClass) {
    return new Builder<>(providerClass);
  }

  public static <P extends Provider> ProviderMethodRegistry<P> empty(Class<P> providerClass) {
    return new Builder<>(providerClass).build();
  }

  public Optional<ProviderMethod<P>> find(String name) {
    return Optional.ofNullable(methods.get(name));
  }

  public Collection<ProviderMethod<P>> methods() {
    return methods.values();
  }

  public Object invoke(ProviderMethod<P> method, Provider provider, MethodArguments arguments) {
    if (!providerClass.isInstance(provider)) {
      throw new IllegalStateException(
          "provider "
              + provider
              + " is not an instance of "
              + providerClass.getSimpleName()
              + " required by method "
              + method.name());
    }
    return method.handler().handle(providerClass.cast(provider), arguments);
  }

  public static final class Builder<P extends Provider> {

    private final Class<P> providerClass;
    private final Map<String, ProviderMethod<P>> methods = new LinkedHashMap<>();

    private Builder(Class<P> providerClass) {
      if (providerClass == null) {
        throw new IllegalArgumentException("providerClass is required");
      }
      this.providerClass = providerClass;
    }

    public Builder<P> method(
        String name,
        String description,
        List<MethodParameter> parameters,
        ProviderMethodHandler<P> handler) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("method name is required");
      }
      if (handler == null) {
        throw new IllegalArgumentException("handler is required for method " + name);
      }
      if (methods.containsKey(name)) {
        throw new IllegalArgumentException("method " + name + " is already registered");
      }
      final Set<String> seen = new HashSet<>();
      for (MethodParameter parameter : parameters == null ? List.<MethodParameter>of() : parameters) {
        if (!seen.add(parameter.name())) {
          throw new IllegalArgumentException(
              "method " + name + " declares parameter " + parameter.name() + " twice");
        }
      }
      methods.put(name, new ProviderMethod<>(name, description, parameters, handler));
      return this;
    }

    public ProviderMethodRegistry<P> build() {
      return new ProviderMethodRegistry<>(providerClass, methods);
    }
  }
}
