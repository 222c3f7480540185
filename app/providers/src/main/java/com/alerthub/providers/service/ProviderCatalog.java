/*
 * どこで: Providers サービス層
 * 何を: 起動時に登録されたプロバイダ種別を種別名で引けるように保持する
 * なぜ: 起動後は読み取り専用とし、リクエスト間で同期無しに共有するため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProviderCatalog {

  private static final Logger logger = LoggerFactory.getLogger(ProviderCatalog.class);

  private final Map<String, ProviderType<?>> types;

  public ProviderCatalog(List<ProviderType<?>> providerTypes) {
    final Map<String, ProviderType<?>> registered = new TreeMap<>();
    for (ProviderType<?> providerType : providerTypes) {
      final ProviderType<?> previous = registered.putIfAbsent(providerType.typeName(), providerType);
      if (previous != null) {
        throw new IllegalStateException(
            "provider type " + providerType.typeName() + " is registered twice");
      }
    }
    this.types = Collections.unmodifiableMap(registered);
    logger.info("provider catalog loaded types={}", types.keySet());
  }

  public Optional<ProviderType<?>> find(String providerType) {
    if (providerType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(types.get(providerType));
  }

  public ProviderType<?> require(String providerType) {
    return find(providerType).orElseThrow(() -> ProviderNotFoundException.unknownType(providerType));
  }

  public Collection<ProviderType<?>> types() {
    return types.values();
  }

  public List<ProviderTypeDescriptor> descriptors() {
    return types.values().stream().map(ProviderType::descriptor).toList();
  }
}
