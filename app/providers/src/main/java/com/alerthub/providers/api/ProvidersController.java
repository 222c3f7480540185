/*
 * どこで: Providers API
 * 何を: プロバイダの一覧/インストール/更新/削除/呼び出し/webhook/ヘルスチェックのエンドポイントを提供する
 * なぜ: 認証済み tenant を暗黙引数としてサービス層へ渡し、操作ごとの権限を宣言するため
 */
package com.alerthub.providers.api;

import com.alerthub.providers.api.request.ProviderInstallRequest;
import com.alerthub.providers.api.response.AlertCountResponse;
import com.alerthub.providers.api.response.AlertsResponse;
import com.alerthub.providers.api.response.HealthcheckProvidersResponse;
import com.alerthub.providers.api.response.InstallProviderResponse;
import com.alerthub.providers.api.response.MessageResponse;
import com.alerthub.providers.api.response.ProviderExecutionLogResponse;
import com.alerthub.providers.api.response.ProviderView;
import com.alerthub.providers.api.response.ProvidersListResponse;
import com.alerthub.providers.api.response.UpdateProviderResponse;
import com.alerthub.providers.api.response.WebhookInstallResponse;
import com.alerthub.providers.api.response.WebhookSettingsResponse;
import com.alerthub.providers.config.AuthenticatedEntity;
import com.alerthub.providers.service.ProviderExecutionLogService;
import com.alerthub.providers.service.ProviderInstallationService;
import com.alerthub.providers.service.ProviderInvocationService;
import com.alerthub.providers.service.ProviderQueryService;
import com.alerthub.providers.service.ScopeValidationService;
import com.alerthub.providers.service.WebhookProvisioningService;
import com.alerthub.providers.spi.ProviderLogEntry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/providers")
@RequiredArgsConstructor
public class ProvidersController {

  private static final Logger logger = LoggerFactory.getLogger(ProvidersController.class);

  private final ProviderQueryService queryService;
  private final ProviderInstallationService installationService;
  private final ProviderInvocationService invocationService;
  private final ScopeValidationService scopeValidationService;
  private final WebhookProvisioningService webhookProvisioningService;
  private final ProviderExecutionLogService executionLogService;

  @GetMapping
  @PreAuthorize("hasAuthority('read:providers')")
  public ProvidersListResponse listProviders(@AuthenticationPrincipal AuthenticatedEntity entity) {
    logger.info("listing providers tenant_id={}", entity.tenantId());
    return queryService.listProviders(entity.tenantId());
  }

  @GetMapping("/export")
  @PreAuthorize("hasAuthority('read:providers')")
  public List<ProviderView> exportProviders(@AuthenticationPrincipal AuthenticatedEntity entity) {
    logger.info("exporting installed providers tenant_id={}", entity.tenantId());
    return queryService.exportProviders(entity.tenantId());
  }

  @GetMapping("/{provider_id}/logs")
  @PreAuthorize("hasAuthority('read:providers')")
  public List<ProviderExecutionLogResponse> getProviderLogs(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_id") String providerId) {
    return executionLogService.getLogs(entity.tenantId(), providerId).stream()
        .map(ProviderExecutionLogResponse::from)
        .toList();
  }

  @GetMapping("/{provider_type}/{provider_id}/logs")
  @PreAuthorize("hasAuthority('read:providers')")
  public List<ProviderLogEntry> getInstanceLogs(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @PathVariable("provider_id") String providerId,
      @RequestParam(name = "limit", defaultValue = "5") int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return queryService.getInstanceLogs(entity.tenantId(), providerType, providerId, limit);
  }

  @GetMapping("/{provider_type}/schema")
  public Map<String, Object> getAlertSchema(@PathVariable("provider_type") String providerType) {
    return queryService.getAlertSchema(providerType);
  }

  @GetMapping("/{provider_type}/{provider_id}/configured-alerts")
  @PreAuthorize("hasAuthority('read:providers')")
  public AlertsResponse getAlertsConfiguration(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @PathVariable("provider_id") String providerId) {
    return queryService.getAlertsConfiguration(entity.tenantId(), providerType, providerId);
  }

  @GetMapping("/{provider_type}/{provider_id}/alerts/count")
  @PreAuthorize("hasAuthority('read:providers')")
  public AlertCountResponse countAlerts(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @PathVariable("provider_id") String providerId,
      @RequestParam(name = "ever", defaultValue = "false") boolean ever,
      @RequestParam(name = "start_time", required = false) Instant startTime,
      @RequestParam(name = "end_time", required = false) Instant endTime) {
    return queryService.countAlerts(
        entity.tenantId(), providerType, providerId, ever, startTime, endTime);
  }

  @PostMapping("/{provider_type}/{provider_id}/alerts")
  @PreAuthorize("hasAuthority('write:providers')")
  public MessageResponse deployAlert(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @PathVariable("provider_id") String providerId,
      @RequestParam(name = "alert_id", required = false) String alertId,
      @RequestBody Map<String, Object> alert) {
    return queryService.deployAlert(entity.tenantId(), providerType, providerId, alert, alertId);
  }

  @PostMapping("/test")
  @PreAuthorize("hasAuthority('write:providers')")
  public AlertsResponse testProvider(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @RequestBody Map<String, Object> body) {
    return queryService.testProvider(entity.tenantId(), body);
  }

  @PostMapping("/{provider_id}/invoke/{method}")
  @PreAuthorize("hasAuthority('write:providers')")
  public Object invokeProviderMethod(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_id") String providerId,
      @PathVariable("method") String method,
      @RequestBody(required = false) Map<String, Object> params) {
    logger.info(
        "invoking provider method tenant_id={} provider_id={} method={}",
        entity.tenantId(),
        providerId,
        method);
    return invocationService.invoke(entity.tenantId(), providerId, method, params);
  }

  @PostMapping("/{provider_id}/scopes")
  @PreAuthorize("hasAuthority('write:providers')")
  public Map<String, Object> validateProviderScopes(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_id") String providerId) {
    return scopeValidationService.revalidate(entity.tenantId(), providerId);
  }

  @PutMapping("/{provider_id}")
  @PreAuthorize("hasAuthority('update:providers')")
  public UpdateProviderResponse updateProvider(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_id") String providerId,
      @RequestBody(required = false) Map<String, Object> body) {
    final Map<String, String> authentication =
        body == null ? Map.of() : ProviderInstallRequest.toAuthentication(body);
    return installationService.updateProvider(
        entity.tenantId(), providerId, authentication, entity.actor());
  }

  @DeleteMapping("/{provider_type}/{provider_id}")
  @PreAuthorize("hasAuthority('delete:providers')")
  public MessageResponse deleteProvider(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @PathVariable("provider_id") String providerId) {
    installationService.deleteProvider(entity.tenantId(), providerType, providerId);
    return new MessageResponse("deleted");
  }

  @PostMapping("/install")
  @PreAuthorize("hasAuthority('write:providers')")
  public InstallProviderResponse installProvider(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @RequestBody Map<String, Object> body) {
    return installationService.installProvider(
        entity.tenantId(), entity.actor(), ProviderInstallRequest.fromBody(body));
  }

  @PostMapping("/install/oauth2/{provider_type}")
  @PreAuthorize("hasAuthority('write:providers')")
  public InstallProviderResponse installOAuth2Provider(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @RequestBody Map<String, Object> body) {
    return installationService.installOAuth2Provider(
        entity.tenantId(), entity.actor(), providerType, body);
  }

  @PostMapping("/install/webhook/{provider_type}/{provider_id}")
  @PreAuthorize("hasAuthority('write:providers')")
  public WebhookInstallResponse installProviderWebhook(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @PathVariable("provider_id") String providerId) {
    return new WebhookInstallResponse(
        webhookProvisioningService.installWebhook(entity.tenantId(), providerType, providerId));
  }

  @GetMapping("/{provider_type}/webhook")
  @PreAuthorize("hasAuthority('read:providers')")
  public WebhookSettingsResponse getWebhookSettings(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("provider_type") String providerType,
      @RequestParam(name = "provider_id", required = false) String providerId) {
    return webhookProvisioningService.getWebhookSettings(
        entity.tenantId(), providerType, providerId);
  }

  @GetMapping("/healthcheck")
  public HealthcheckProvidersResponse getHealthcheckProviders() {
    return queryService.getHealthcheckProviders();
  }

  @PostMapping("/healthcheck")
  public Map<String, Object> healthcheckProvider(@RequestBody Map<String, Object> body) {
    return queryService.healthcheck(body);
  }
}
