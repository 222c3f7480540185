/*
 * どこで: Providers サービス層
 * 何を: webhook 受信 URL と API キーを組み立て、案内テンプレートの描画とプロバイダへの登録依頼を行う
 * なぜ: 外部システムが押し込むイベントを tenant/プロバイダ単位で受け取れるようにするため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.api.response.WebhookSettingsResponse;
import com.alerthub.providers.config.ProvidersProperties;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderCapability;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import com.alerthub.providers.spi.WebhookTemplates;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@RequiredArgsConstructor
public class WebhookProvisioningService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookProvisioningService.class);

  private final ProvidersFactory providersFactory;
  private final ProviderInstanceResolver instanceResolver;
  private final WebhookApiKeyService apiKeyService;
  private final ProvidersProperties properties;
  private final ProvidersMetrics metrics;

  public WebhookSettingsResponse getWebhookSettings(
      String tenantId, String providerType, String providerId) {
    final ProviderTypeDescriptor descriptor = providersFactory.getProviderClass(providerType);
    final String webhookUrl = webhookUrl(providerType, providerId);
    final String apiKey = apiKeyService.getOrCreateWebhookApiKey(tenantId);
    final String webhookUrlWithAuth = withCredential(webhookUrl, apiKey);

    final WebhookTemplates templates =
        descriptor.webhook().orElseGet(() -> new WebhookTemplates("", "", null));
    return new WebhookSettingsResponse(
        render(templates.description(), webhookUrl, apiKey, webhookUrlWithAuth),
        render(templates.template(), webhookUrl, apiKey, webhookUrlWithAuth),
        templates.markdown() == null
            ? null
            : render(templates.markdown(), webhookUrl, apiKey, webhookUrlWithAuth));
  }

  /** 種別が自己登録に対応しない場合は false を返す (エラーにはしない)。 */
  public boolean installWebhook(String tenantId, String providerType, String providerId) {
    final ProviderTypeDescriptor descriptor = providersFactory.getProviderClass(providerType);
    if (!descriptor.supports(ProviderCapability.WEBHOOK)) {
      logger.info("provider type does not support webhook setup provider_type={}", providerType);
      metrics.recordWebhookInstall("unsupported");
      return false;
    }
    final String webhookUrl = webhookUrl(providerType, providerId);
    final String apiKey = apiKeyService.getOrCreateWebhookApiKey(tenantId);
    try (Provider provider = instanceResolver.resolveForType(tenantId, providerType, providerId)) {
      provider.setupWebhook(tenantId, webhookUrl, apiKey, true);
    } catch (RuntimeException ex) {
      metrics.recordWebhookInstall("failed");
      throw ex;
    }
    metrics.recordWebhookInstall("installed");
    logger.info(
        "webhook installed tenant_id={} provider_type={} provider_id={}",
        tenantId,
        providerType,
        providerId);
    return true;
  }

  String webhookUrl(String providerType, String providerId) {
    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(properties.apiUrl())
            .pathSegment("alerts", "event", providerType);
    if (providerId != null && !providerId.isBlank()) {
      builder.queryParam("provider_id", providerId);
    }
    return builder.encode().build().toUriString();
  }

  String withCredential(String webhookUrl, String apiKey) {
    return UriComponentsBuilder.fromUriString(webhookUrl)
        .userInfo(properties.webhookCredentialUser() + ":" + apiKey)
        .build()
        .toUriString();
  }

  private String render(
      String template, String webhookUrl, String apiKey, String webhookUrlWithAuth) {
    return template
        .replace(WebhookTemplates.PLACEHOLDER_URL_WITH_AUTH, webhookUrlWithAuth)
        .replace(WebhookTemplates.PLACEHOLDER_URL, webhookUrl)
        .replace(WebhookTemplates.PLACEHOLDER_API_KEY, apiKey);
  }
}
