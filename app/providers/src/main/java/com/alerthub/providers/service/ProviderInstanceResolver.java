/*
 * どこで: Providers サービス層
 * 何を: tenant と provider id から設定を引き当ててインスタンスを生成する
 * なぜ: default-<type> の組み込みインスタンスと永続化済みインスタンスの解決経路を分けるため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.model.ProviderRecord;
import com.alerthub.providers.repository.ProviderRepository;
import com.alerthub.providers.secret.SecretNotFoundException;
import com.alerthub.providers.spi.InvalidParametersException;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProviderInstanceResolver {

  static final String DEFAULT_PREFIX = "default-";

  private static final Logger logger = LoggerFactory.getLogger(ProviderInstanceResolver.class);

  private final ProvidersFactory providersFactory;
  private final ProviderRepository providerRepository;
  private final ProviderConfigStore configStore;

  public static boolean isDefaultProvider(String providerId) {
    return providerId != null && providerId.startsWith(DEFAULT_PREFIX);
  }

  public Provider resolve(String tenantId, String providerId) {
    if (isDefaultProvider(providerId)) {
      return resolveDefault(providerId);
    }
    final ProviderRecord record =
        providerRepository
            .findByTenantAndId(tenantId, providerId)
            .orElseThrow(() -> ProviderNotFoundException.unknownProvider(providerId));
    return resolveRecord(record);
  }

  public Provider resolveRecord(ProviderRecord record) {
    final ProviderConfig config = readConfig(record.configurationKey(), record.id());
    return providersFactory.getProvider(
        ProviderContext.forTenant(record.tenantId()), record.id(), record.type(), config);
  }

  /** 種別と id の組で引く経路。secret だけ残ったものや種別違いのレコードは未インストール扱い。 */
  public Provider resolveForType(String tenantId, String providerType, String providerId) {
    providersFactory.getProviderClass(providerType);
    final ProviderRecord record =
        providerRepository
            .findByTenantAndId(tenantId, providerId)
            .filter(found -> providerType.equals(found.type()))
            .orElseThrow(() -> ProviderNotFoundException.unknownProvider(providerId));
    return resolveRecord(record);
  }

  private Provider resolveDefault(String providerId) {
    // tenant の secret やレコードは一切参照しない。
    final String providerType = providerId.substring(DEFAULT_PREFIX.length());
    if (providerType.isBlank()) {
      throw new InvalidParametersException(
          "default provider must be in the format default-<provider_type>");
    }
    logger.debug("resolving built-in default provider provider_type={}", providerType);
    return providersFactory.getProvider(
        ProviderContext.anonymous(), providerId, providerType, ProviderConfig.empty());
  }

  private ProviderConfig readConfig(String key, String providerId) {
    try {
      return configStore.read(key);
    } catch (SecretNotFoundException ex) {
      logger.warn("provider configuration secret missing provider_id={}", providerId);
      throw new ProviderNotFoundException(
          ProviderNotFoundException.Reason.PROVIDER,
          "provider " + providerId + " not found",
          ex);
    }
  }
}
