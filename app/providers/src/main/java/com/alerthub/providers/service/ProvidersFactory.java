/*
 * どこで: Providers サービス層
 * 何を: 種別名と設定からプロバイダインスタンスを生成する
 * なぜ: 認証項目の検証を生成前に済ませ、不完全なインスタンスを外へ出さないため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.spi.AuthField;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderConfigurationException;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProvidersFactory {

  private static final Logger logger = LoggerFactory.getLogger(ProvidersFactory.class);

  private final ProviderCatalog catalog;

  public ProviderTypeDescriptor getProviderClass(String providerType) {
    return catalog.require(providerType).descriptor();
  }

  public ProviderType<?> getProviderType(String providerType) {
    return catalog.require(providerType);
  }

  public List<ProviderTypeDescriptor> getAllProviders() {
    return catalog.descriptors();
  }

  public Provider getProvider(
      @NonNull ProviderContext context,
      @NonNull String providerId,
      String providerType,
      @NonNull ProviderConfig config) {
    final ProviderType<?> type = catalog.require(providerType);
    validateAuthentication(type.descriptor(), config);
    try {
      return type.create(context, providerId, config);
    } catch (ProviderConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      logger.info(
          "provider construction rejected configuration provider_type={} provider_id={} reason={}",
          providerType,
          providerId,
          ex.getMessage());
      throw new ProviderConfigurationException(
          "invalid configuration for provider " + providerType + ": " + ex.getMessage(), ex);
    }
  }

  private void validateAuthentication(ProviderTypeDescriptor descriptor, ProviderConfig config) {
    final List<String> missing = new ArrayList<>();
    final List<String> malformed = new ArrayList<>();
    for (AuthField field : descriptor.authFields()) {
      final String value = config.value(field.name());
      if (value == null || value.isBlank()) {
        if (field.required()) {
          missing.add(field.name());
        }
        continue;
      }
      if (!field.type().accepts(value)) {
        malformed.add(field.name());
      }
    }
    if (!missing.isEmpty()) {
      final List<String> invalid = new ArrayList<>(missing);
      invalid.addAll(malformed);
      throw new ProviderConfigurationException(
          "missing required authentication fields for provider "
              + descriptor.type()
              + ": "
              + String.join(", ", missing),
          invalid);
    }
    if (!malformed.isEmpty()) {
      throw new ProviderConfigurationException(
          "malformed authentication fields for provider "
              + descriptor.type()
              + ": "
              + String.join(", ", malformed),
          malformed);
    }
  }
}
