/*
 * どこで: Providers サービス層のユニットテスト
 * 何を: インストール/OAuth2 インストール/更新/削除の順序と失敗時の後始末を検証する
 * なぜ: 検証失敗で何も書き込まず、secret とレコードの不整合を残さないことを保証するため
 */
package com.alerthub.providers.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.alerthub.providers.api.request.ProviderInstallRequest;
import com.alerthub.providers.api.response.InstallProviderResponse;
import com.alerthub.providers.api.response.UpdateProviderResponse;
import com.alerthub.providers.model.ProviderRecord;
import com.alerthub.providers.repository.ProviderRepository;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderConfigurationException;
import com.alerthub.providers.spi.ProviderMethodException;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.support.FakeProviderType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

@ExtendWith(MockitoExtension.class)
class ProviderInstallationServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String TENANT = "tenant-a";
  private static final String USER = "alice@example.com";
  private static final String CONFIG_KEY = "tenant-a_fake_prod";

  @Mock private ProviderRepository providerRepository;
  @Mock private ProviderConfigStore configStore;
  @Mock private WebhookProvisioningService webhookProvisioningService;
  @Mock private ProviderExecutionLogService executionLogService;

  private final FakeProviderType fakeType = new FakeProviderType();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  private ProviderInstallationService service;

  @BeforeEach
  void setUp() {
    final ProvidersFactory factory =
        new ProvidersFactory(new ProviderCatalog(List.<ProviderType<?>>of(fakeType)));
    final ProvidersMetrics metrics = new ProvidersMetrics(registry);
    final ProviderInstanceResolver resolver =
        new ProviderInstanceResolver(factory, providerRepository, configStore);
    final ScopeValidationService scopeValidationService =
        new ScopeValidationService(
            providerRepository, resolver, factory, executionLogService, metrics);
    service =
        new ProviderInstallationService(
            factory,
            providerRepository,
            configStore,
            resolver,
            scopeValidationService,
            webhookProvisioningService,
            executionLogService,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void installWritesSecretBeforeRecord() {
    final InstallProviderResponse response = service.installProvider(TENANT, USER, request(false));

    final InOrder order = inOrder(configStore, providerRepository);
    order.verify(configStore).write(eq(CONFIG_KEY), any(ProviderConfig.class));
    final ArgumentCaptor<ProviderRecord> captor = ArgumentCaptor.forClass(ProviderRecord.class);
    order.verify(providerRepository).insert(captor.capture());

    final ProviderRecord record = captor.getValue();
    assertThat(record.id()).isEqualTo("prod");
    assertThat(record.tenantId()).isEqualTo(TENANT);
    assertThat(record.installedBy()).isEqualTo(USER);
    assertThat(record.installationTime()).isEqualTo(NOW);
    assertThat(record.configurationKey()).isEqualTo(CONFIG_KEY);
    assertThat(record.validatedScopes()).containsEntry("read", true);

    assertThat(response.type()).isEqualTo(FakeProviderType.TYPE);
    assertThat(response.id()).isEqualTo("prod");
    assertThat(response.details()).containsEntry("name", "Production");
    assertThat(response.webhookInstalled()).isNull();
    assertThat(installCount("installed")).isEqualTo(1.0d);
  }

  @Test
  void mandatoryScopeFailureWritesNothing() {
    fakeType.respondingWithScopes(Map.of("read", "missing permission", "write", true));

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request(false)))
        .isInstanceOfSatisfying(
            ScopeValidationFailedException.class,
            ex -> {
              assertThat(ex.failedScopes()).containsExactly("read");
              assertThat(ex.validatedScopes()).containsEntry("read", "missing permission");
            });
    verifyNoInteractions(configStore);
    verify(providerRepository, never()).insert(any());
    assertThat(installCount("rejected")).isEqualTo(1.0d);
    assertThat(fakeType.closedCount()).isEqualTo(1);
  }

  @Test
  void missingAuthenticationWritesNothing() {
    final ProviderInstallRequest request =
        new ProviderInstallRequest("prod", "Production", FakeProviderType.TYPE, Map.of(), true, false);

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request))
        .isInstanceOf(ProviderConfigurationException.class);
    verifyNoInteractions(configStore, providerRepository);
  }

  @Test
  void existingProviderIsConflict() {
    when(providerRepository.exists(TENANT, "prod")).thenReturn(true);

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request(false)))
        .isInstanceOf(ProviderAlreadyInstalledException.class);
    verifyNoInteractions(configStore);
    assertThat(installCount("conflict")).isEqualTo(1.0d);
  }

  @Test
  void concurrentInsertLoserKeepsSecret() {
    when(providerRepository.insert(any())).thenThrow(new DuplicateKeyException("providers_pkey"));

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request(false)))
        .isInstanceOf(ProviderAlreadyInstalledException.class)
        .hasCauseInstanceOf(DuplicateKeyException.class);
    verify(configStore, never()).delete(anyString());
  }

  @Test
  void failedInsertRemovesSecret() {
    when(providerRepository.insert(any()))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request(false)))
        .isInstanceOf(DataAccessResourceFailureException.class);
    verify(configStore).delete(CONFIG_KEY);
    assertThat(installCount("failed")).isEqualTo(1.0d);
  }

  @Test
  void failedSecretCleanupIsAttachedAsSuppressed() {
    when(providerRepository.insert(any()))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));
    when(configStore.delete(CONFIG_KEY)).thenThrow(new IllegalStateException("store down"));

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request(false)))
        .isInstanceOf(DataAccessResourceFailureException.class)
        .satisfies(ex -> assertThat(ex.getSuppressed()).hasSize(1));
  }

  @Test
  void webhookSuccessIsReported() {
    when(webhookProvisioningService.installWebhook(TENANT, FakeProviderType.TYPE, "prod"))
        .thenReturn(true);

    final InstallProviderResponse response = service.installProvider(TENANT, USER, request(true));

    assertThat(response.webhookInstalled()).isTrue();
    assertThat(response.webhookError()).isNull();
  }

  @Test
  void webhookFailureDoesNotFailInstallation() {
    when(webhookProvisioningService.installWebhook(TENANT, FakeProviderType.TYPE, "prod"))
        .thenThrow(new ProviderMethodException(502, "connection failed"));

    final InstallProviderResponse response = service.installProvider(TENANT, USER, request(true));

    assertThat(response.webhookInstalled()).isFalse();
    assertThat(response.webhookError()).isEqualTo("connection failed");
    verify(providerRepository).insert(any());
    verify(executionLogService)
        .warn(eq(TENANT), eq("prod"), eq("webhook installation failed"), any());
  }

  @Test
  void unexpectedWebhookFailureHidesDetails() {
    when(webhookProvisioningService.installWebhook(TENANT, FakeProviderType.TYPE, "prod"))
        .thenThrow(new IllegalStateException("socket closed by 10.0.0.3"));

    final InstallProviderResponse response = service.installProvider(TENANT, USER, request(true));

    assertThat(response.webhookInstalled()).isFalse();
    assertThat(response.webhookError()).isEqualTo(ProviderInstallationService.WEBHOOK_FAILED);
  }

  @Test
  void unsupportedWebhookIsReported() {
    when(webhookProvisioningService.installWebhook(TENANT, FakeProviderType.TYPE, "prod"))
        .thenReturn(false);

    final InstallProviderResponse response = service.installProvider(TENANT, USER, request(true));

    assertThat(response.webhookInstalled()).isFalse();
    assertThat(response.webhookError()).isEqualTo(ProviderInstallationService.WEBHOOK_UNSUPPORTED);
  }

  @Test
  void defaultPrefixedIdIsRejected() {
    final ProviderInstallRequest request =
        new ProviderInstallRequest(
            "default-fake",
            "Default",
            FakeProviderType.TYPE,
            Map.of(FakeProviderType.TOKEN, "secret"),
            true,
            false);

    assertThatThrownBy(() -> service.installProvider(TENANT, USER, request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("default-");
    verifyNoInteractions(configStore, providerRepository);
  }

  @Test
  void oauth2InstallNormalizesRemoteName() {
    final InstallProviderResponse response =
        service.installOAuth2Provider(
            TENANT,
            USER,
            FakeProviderType.TYPE,
            Map.of("code", "c1", "remote_name", "My Fake_Instance"));

    final ArgumentCaptor<ProviderConfig> config = ArgumentCaptor.forClass(ProviderConfig.class);
    verify(configStore).write(anyString(), config.capture());
    assertThat(config.getValue().name()).isEqualTo("myfake-instance");
    assertThat(config.getValue().authentication())
        .containsExactly(Map.entry(FakeProviderType.TOKEN, "oauth-c1"));
    assertThat(response.id()).hasSize(32).doesNotContain("-");
  }

  @Test
  void oauth2InstallFallsBackToGeneratedName() {
    final InstallProviderResponse response =
        service.installOAuth2Provider(TENANT, USER, FakeProviderType.TYPE, Map.of("code", "c1"));

    assertThat(response.details()).containsEntry("name", response.id() + "-oauth2");
  }

  @Test
  void oauth2InstallProvisionsWebhookUnlessDisabled() {
    when(webhookProvisioningService.installWebhook(
            eq(TENANT), eq(FakeProviderType.TYPE), anyString()))
        .thenReturn(true);

    final InstallProviderResponse response =
        service.installOAuth2Provider(TENANT, USER, FakeProviderType.TYPE, Map.of("code", "c1"));

    assertThat(response.webhookInstalled()).isTrue();
    verify(webhookProvisioningService).installWebhook(TENANT, FakeProviderType.TYPE, response.id());
  }

  @Test
  void oauth2InstallWithWebhookDisabledSkipsProvisioning() {
    final InstallProviderResponse response =
        service.installOAuth2Provider(
            TENANT,
            USER,
            FakeProviderType.TYPE,
            Map.of("code", "c1", "install_webhook", "false", "pulling_enabled", "false"));

    assertThat(response.webhookInstalled()).isNull();
    verifyNoInteractions(webhookProvisioningService);
    final ArgumentCaptor<ProviderRecord> record = ArgumentCaptor.forClass(ProviderRecord.class);
    verify(providerRepository).insert(record.capture());
    assertThat(record.getValue().pullingEnabled()).isFalse();
  }

  @Test
  void oauth2ExchangeReceivesPayloadWithoutControlKeys() {
    final InstallProviderResponse response =
        service.installOAuth2Provider(
            TENANT,
            USER,
            FakeProviderType.TYPE,
            Map.of(
                "code", "c1",
                "install_webhook", "false",
                "pulling_enabled", "true",
                "provider_name", "Team Alerts"));

    assertThat(fakeType.oauth2Payloads()).containsExactly(Map.of("code", "c1"));
    assertThat(response.details()).containsEntry("name", "teamalerts");
    final ArgumentCaptor<ProviderConfig> config = ArgumentCaptor.forClass(ProviderConfig.class);
    verify(configStore).write(anyString(), config.capture());
    assertThat(config.getValue().authentication())
        .containsOnlyKeys(FakeProviderType.TOKEN);
  }

  @Test
  void updateValidatesBeforeWritingAndStampsUpdater() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.of(record()));

    final UpdateProviderResponse response =
        service.updateProvider(
            TENANT, "prod", Map.of(FakeProviderType.TOKEN, "rotated"), "bob@example.com");

    final InOrder order = inOrder(configStore, providerRepository);
    order.verify(configStore).write(eq(CONFIG_KEY), any(ProviderConfig.class));
    order
        .verify(providerRepository)
        .updateConfiguration(eq(TENANT), eq("prod"), any(), eq("bob@example.com"), eq(NOW));
    assertThat(response.updatedBy()).isEqualTo("bob@example.com");
    assertThat(response.details()).containsEntry("name", "Production");
  }

  @Test
  void updateWithMissingMandatoryScopeWritesNothing() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.of(record()));
    fakeType.respondingWithScopes(Map.of("read", false));

    assertThatThrownBy(
            () ->
                service.updateProvider(
                    TENANT, "prod", Map.of(FakeProviderType.TOKEN, "rotated"), USER))
        .isInstanceOf(ScopeValidationFailedException.class);
    verifyNoInteractions(configStore);
  }

  @Test
  void updateWithoutDataIsRejected() {
    assertThatThrownBy(() -> service.updateProvider(TENANT, "prod", Map.of(), USER))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("no valid data provided");
  }

  @Test
  void updateOfUnknownProviderIsNotFound() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.updateProvider(TENANT, "prod", Map.of(FakeProviderType.TOKEN, "x"), USER))
        .isInstanceOf(ProviderNotFoundException.class);
  }

  @Test
  void deleteRemovesRecordLogsAndSecret() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.of(record()));
    when(configStore.read(CONFIG_KEY)).thenReturn(config());

    service.deleteProvider(TENANT, FakeProviderType.TYPE, "prod");

    verify(providerRepository).delete(TENANT, "prod");
    verify(executionLogService).deleteLogs(TENANT, "prod");
    verify(configStore).delete(CONFIG_KEY);
  }

  @Test
  void deleteContinuesWhenCleanupFails() {
    fakeType.failingCleanUpWith(new ProviderMethodException(502, "webhook endpoint gone"));
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.of(record()));
    when(configStore.read(CONFIG_KEY)).thenReturn(config());

    service.deleteProvider(TENANT, FakeProviderType.TYPE, "prod");

    verify(providerRepository).delete(TENANT, "prod");
    verify(configStore).delete(CONFIG_KEY);
  }

  @Test
  void deleteToleratesSecretStoreFailure() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.of(record()));
    when(configStore.read(CONFIG_KEY)).thenReturn(config());
    doThrow(new IllegalStateException("store down")).when(configStore).delete(CONFIG_KEY);

    service.deleteProvider(TENANT, FakeProviderType.TYPE, "prod");

    verify(providerRepository).delete(TENANT, "prod");
  }

  @Test
  void deleteOfUnknownProviderIsNotFound() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.deleteProvider(TENANT, FakeProviderType.TYPE, "prod"))
        .isInstanceOfSatisfying(
            ProviderNotFoundException.class,
            ex -> assertThat(ex.reason()).isEqualTo(ProviderNotFoundException.Reason.PROVIDER));
    verify(providerRepository, never()).delete(anyString(), anyString());
    verifyNoInteractions(configStore, executionLogService);
  }

  @Test
  void deleteWithMismatchedTypeIsNotFound() {
    when(providerRepository.findByTenantAndId(TENANT, "prod")).thenReturn(Optional.of(record()));

    assertThatThrownBy(() -> service.deleteProvider(TENANT, "http", "prod"))
        .isInstanceOf(ProviderNotFoundException.class);
    verify(providerRepository, never()).delete(anyString(), anyString());
  }

  @Test
  void normalizeNameLowercasesAndReplacesSeparators() {
    assertThat(ProviderInstallationService.normalizeName("Prod Alerts_EU")).isEqualTo("prodalerts-eu");
  }

  private ProviderInstallRequest request(boolean installWebhook) {
    return new ProviderInstallRequest(
        "prod",
        "Production",
        FakeProviderType.TYPE,
        Map.of(FakeProviderType.TOKEN, "secret"),
        true,
        installWebhook);
  }

  private ProviderConfig config() {
    return new ProviderConfig(Map.of(FakeProviderType.TOKEN, "secret"), "Production");
  }

  private ProviderRecord record() {
    return new ProviderRecord(
        "prod",
        TENANT,
        "Production",
        FakeProviderType.TYPE,
        USER,
        NOW.minusSeconds(3600),
        null,
        null,
        CONFIG_KEY,
        Map.of("read", true, "write", true),
        true);
  }

  private double installCount(String result) {
    return registry
        .get("providers.install.total")
        .tag("type", FakeProviderType.TYPE)
        .tag("result", result)
        .counter()
        .count();
  }
}
