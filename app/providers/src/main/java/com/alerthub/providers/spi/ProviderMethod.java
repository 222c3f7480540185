/*
 * どこで: Provider SPI
 * 何を: 名前付きで呼び出せるプロバイダ操作 1 件と、その引数の束縛を表す
 * なぜ: 任意の操作を公開しつつ、引数の過不足と型を呼び出し前に検証するため
 */
package com.alerthub.providers.spi;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public record ProviderMethod<P extends Provider>(
    String name,
    String description,
    List<MethodParameter> parameters,
    ProviderMethodHandler<P> handler) {

  public ProviderMethod {
    description = description == null ? "" : description;
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public List<String> parameterNames() {
    return parameters.stream().map(MethodParameter::name).toList();
  }

  public MethodArguments bind(Map<String, Object> params) {
    final Map<String, Object> supplied = params == null ? Map.of() : params;

    final Set<String> unexpected = new TreeSet<>(supplied.keySet());
    parameters.forEach(parameter -> unexpected.remove(parameter.name()));
    if (!unexpected.isEmpty()) {
      throw new InvalidParametersException(
          name + "() got unexpected parameters: " + String.join(", ", unexpected));
    }

    final Map<String, Object> bound = new LinkedHashMap<>();
    for (MethodParameter parameter : parameters) {
      final Object value = supplied.get(parameter.name());
      if (value == null) {
        if (parameter.required()) {
          throw new InvalidParametersException(
              name + "() missing required parameter: " + parameter.name());
        }
        continue;
      }
      if (!parameter.type().accepts(value)) {
        throw new InvalidParametersException(
            name
                + "() parameter "
                + parameter.name()
                + " must be of type "
                + parameter.type().label());
      }
      bound.put(parameter.name(), value);
    }
    return new MethodArguments(name, bound);
  }
}
