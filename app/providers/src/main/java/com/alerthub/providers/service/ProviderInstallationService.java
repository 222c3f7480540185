/*
 * どこで: Providers サービス層
 * 何を: プロバイダのインストール/OAuth2 インストール/更新/削除を順序付きで実行する
 * なぜ: 設定検証と scope 検証を書き込み前に終え、secret とレコードの不整合を残さないため
 */
package com.alerthub.providers.service;

import com.alerthub.common.TraceIds;
import com.alerthub.providers.api.request.ProviderInstallRequest;
import com.alerthub.providers.api.response.InstallProviderResponse;
import com.alerthub.providers.api.response.UpdateProviderResponse;
import com.alerthub.providers.model.ProviderRecord;
import com.alerthub.providers.repository.ProviderRepository;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderException;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProviderInstallationService {

  static final String WEBHOOK_UNSUPPORTED = "provider does not support webhook";
  static final String WEBHOOK_FAILED = "webhook installation failed";

  private static final Logger logger = LoggerFactory.getLogger(ProviderInstallationService.class);

  private final ProvidersFactory providersFactory;
  private final ProviderRepository providerRepository;
  private final ProviderConfigStore configStore;
  private final ProviderInstanceResolver instanceResolver;
  private final ScopeValidationService scopeValidationService;
  private final WebhookProvisioningService webhookProvisioningService;
  private final ProviderExecutionLogService executionLogService;
  private final ProvidersMetrics metrics;
  private final Clock clock;

  public InstallProviderResponse installProvider(
      String tenantId, String installedBy, ProviderInstallRequest request) {
    final String providerId = request.providerId();
    final String providerType = request.providerType();
    if (ProviderInstanceResolver.isDefaultProvider(providerId)) {
      throw new IllegalArgumentException(
          "provider id must not start with " + ProviderInstanceResolver.DEFAULT_PREFIX);
    }
    final ProviderTypeDescriptor descriptor = providersFactory.getProviderClass(providerType);
    final ProviderConfig config =
        new ProviderConfig(request.authentication(), request.providerName());

    // ここまでの失敗では何も書き込まない。
    final Map<String, Object> validatedScopes;
    try (Provider provider =
        providersFactory.getProvider(
            ProviderContext.forTenant(tenantId), providerId, providerType, config)) {
      validatedScopes =
          scopeValidationService.validateScopes(
              provider, descriptor, descriptor.hasMandatoryScopes());
    } catch (RuntimeException ex) {
      metrics.recordInstall(providerType, "rejected");
      throw ex;
    }
    if (providerRepository.exists(tenantId, providerId)) {
      metrics.recordInstall(providerType, "conflict");
      throw new ProviderAlreadyInstalledException(providerId);
    }

    final String configurationKey =
        ProviderConfigStore.configurationKey(tenantId, providerType, providerId);
    configStore.write(configurationKey, config);
    final ProviderRecord record =
        new ProviderRecord(
            providerId,
            tenantId,
            request.providerName(),
            providerType,
            installedBy,
            Instant.now(clock),
            null,
            null,
            configurationKey,
            validatedScopes,
            request.pullingEnabled());
    insertRecord(record);
    metrics.recordInstall(providerType, "installed");
    executionLogService.info(
        tenantId,
        providerId,
        "provider installed",
        Map.of("installed_by", installedBy, "provider_type", providerType));
    logger.info(
        "provider installed tenant_id={} provider_type={} provider_id={}",
        tenantId,
        providerType,
        providerId);

    Boolean webhookInstalled = null;
    String webhookError = null;
    if (request.installWebhook()) {
      webhookError = installWebhookQuietly(tenantId, providerType, providerId);
      webhookInstalled = webhookError == null;
    }
    return new InstallProviderResponse(
        providerType,
        providerId,
        config.toDetails(),
        validatedScopes,
        webhookInstalled,
        webhookError);
  }

  public InstallProviderResponse installOAuth2Provider(
      String tenantId, String installedBy, String providerType, Map<String, Object> payload) {
    final ProviderType<?> type = providersFactory.getProviderType(providerType);
    // 制御用のキーは取り除いてから交換処理へ渡す
    final Map<String, Object> body = new LinkedHashMap<>();
    if (payload != null) {
      body.putAll(payload);
    }
    final String providerId = TraceIds.newCompactId();
    final boolean installWebhook = ProviderInstallRequest.flag(body.remove("install_webhook"), true);
    final boolean pullingEnabled = ProviderInstallRequest.flag(body.remove("pulling_enabled"), true);
    final Object requested = body.remove("provider_name");

    final Map<String, String> authentication = new LinkedHashMap<>(type.exchangeOAuth2(body));
    String providerName = authentication.remove("provider_name");
    if (providerName == null || providerName.isBlank()) {
      providerName =
          requested == null || requested.toString().isBlank()
              ? providerId + "-oauth2"
              : requested.toString();
    }
    logger.info(
        "oauth2 exchange completed tenant_id={} provider_type={} provider_id={}",
        tenantId,
        providerType,
        providerId);
    return installProvider(
        tenantId,
        installedBy,
        new ProviderInstallRequest(
            providerId,
            normalizeName(providerName),
            providerType,
            authentication,
            pullingEnabled,
            installWebhook));
  }

  public UpdateProviderResponse updateProvider(
      String tenantId, String providerId, Map<String, String> authentication, String updatedBy) {
    if (authentication == null || authentication.isEmpty()) {
      throw new IllegalArgumentException("no valid data provided");
    }
    final ProviderRecord record =
        providerRepository
            .findByTenantAndId(tenantId, providerId)
            .orElseThrow(() -> ProviderNotFoundException.unknownProvider(providerId));
    final ProviderTypeDescriptor descriptor = providersFactory.getProviderClass(record.type());
    final ProviderConfig config = new ProviderConfig(authentication, record.name());

    final Map<String, Object> validatedScopes;
    try (Provider provider =
        providersFactory.getProvider(
            ProviderContext.forTenant(tenantId), providerId, record.type(), config)) {
      validatedScopes = scopeValidationService.validateScopes(provider, descriptor, true);
    }
    configStore.write(record.configurationKey(), config);
    providerRepository.updateConfiguration(
        tenantId, providerId, validatedScopes, updatedBy, Instant.now(clock));
    executionLogService.info(
        tenantId, providerId, "provider configuration updated", Map.of("updated_by", updatedBy));
    logger.info(
        "provider updated tenant_id={} provider_id={} updated_by={}",
        tenantId,
        providerId,
        updatedBy);
    return new UpdateProviderResponse(config.toDetails(), validatedScopes, updatedBy);
  }

  public void deleteProvider(String tenantId, String providerType, String providerId) {
    final ProviderRecord record =
        providerRepository
            .findByTenantAndId(tenantId, providerId)
            .filter(found -> providerType == null || providerType.equals(found.type()))
            .orElseThrow(() -> ProviderNotFoundException.unknownProvider(providerId));

    try (Provider provider = instanceResolver.resolveRecord(record)) {
      provider.cleanUp();
    } catch (RuntimeException ex) {
      // 外部側の後始末に失敗しても削除は続行する。
      logger.warn(
          "provider cleanup failed tenant_id={} provider_id={}", tenantId, providerId, ex);
    }

    providerRepository.delete(tenantId, providerId);
    executionLogService.deleteLogs(tenantId, providerId);
    try {
      configStore.delete(record.configurationKey());
    } catch (RuntimeException ex) {
      logger.warn(
          "provider secret delete failed tenant_id={} provider_id={} key={}",
          tenantId,
          providerId,
          record.configurationKey(),
          ex);
    }
    logger.info(
        "provider deleted tenant_id={} provider_type={} provider_id={}",
        tenantId,
        record.type(),
        providerId);
  }

  static String normalizeName(String name) {
    return name.toLowerCase(Locale.ROOT).replace(" ", "").replace('_', '-');
  }

  private void insertRecord(ProviderRecord record) {
    try {
      providerRepository.insert(record);
    } catch (DuplicateKeyException ex) {
      // 同時インストールに負けた側。secret は勝った側と同一キーなので消さない。
      metrics.recordInstall(record.type(), "conflict");
      throw new ProviderAlreadyInstalledException(record.id(), ex);
    } catch (RuntimeException ex) {
      metrics.recordInstall(record.type(), "failed");
      try {
        configStore.delete(record.configurationKey());
      } catch (RuntimeException cleanupEx) {
        ex.addSuppressed(cleanupEx);
        logger.warn(
            "failed to remove secret after record insert failure key={}",
            record.configurationKey(),
            cleanupEx);
      }
      throw ex;
    }
  }

  private String installWebhookQuietly(String tenantId, String providerType, String providerId) {
    try {
      if (!webhookProvisioningService.installWebhook(tenantId, providerType, providerId)) {
        return WEBHOOK_UNSUPPORTED;
      }
      executionLogService.info(tenantId, providerId, "webhook installed", Map.of());
      return null;
    } catch (ProviderException ex) {
      logWebhookFailure(tenantId, providerType, providerId, ex);
      return ex.getMessage();
    } catch (RuntimeException ex) {
      logWebhookFailure(tenantId, providerType, providerId, ex);
      return WEBHOOK_FAILED;
    }
  }

  private void logWebhookFailure(
      String tenantId, String providerType, String providerId, RuntimeException ex) {
    logger.warn(
        "webhook installation failed tenant_id={} provider_type={} provider_id={}",
        tenantId,
        providerType,
        providerId,
        ex);
    executionLogService.warn(
        tenantId,
        providerId,
        "webhook installation failed",
        Map.of("error", String.valueOf(ex.getMessage())));
  }
}
