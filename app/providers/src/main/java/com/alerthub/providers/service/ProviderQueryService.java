/*
 * どこで: Providers サービス層
 * 何を: 一覧/エクスポート/ログ/アラート件数/アラート定義の取得と配備/接続テスト/ヘルスチェックを提供する
 * なぜ: カタログ・インストール済みレコード・受信アラートを組み合わせた読み取り操作を一箇所に集めるため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.api.request.ProviderInstallRequest;
import com.alerthub.providers.api.response.AlertCountResponse;
import com.alerthub.providers.api.response.AlertsResponse;
import com.alerthub.providers.api.response.HealthcheckProvidersResponse;
import com.alerthub.providers.api.response.MessageResponse;
import com.alerthub.providers.api.response.ProviderMethodView;
import com.alerthub.providers.api.response.ProviderView;
import com.alerthub.providers.api.response.ProvidersListResponse;
import com.alerthub.providers.config.ProvidersProperties;
import com.alerthub.providers.model.HourlyAlertCount;
import com.alerthub.providers.model.LinkedProviderRecord;
import com.alerthub.providers.model.ProviderAlertDistribution;
import com.alerthub.providers.model.ProviderRecord;
import com.alerthub.providers.repository.AlertRepository;
import com.alerthub.providers.repository.ProviderRepository;
import com.alerthub.providers.secret.SecretNotFoundException;
import com.alerthub.providers.spi.AuthField;
import com.alerthub.providers.spi.GetAlertException;
import com.alerthub.providers.spi.InvalidParametersException;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderCapability;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderLogEntry;
import com.alerthub.providers.spi.ProviderMethod;
import com.alerthub.providers.spi.ProviderMethodException;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProviderQueryService {

  static final String MASK = "******";

  private static final Logger logger = LoggerFactory.getLogger(ProviderQueryService.class);

  private static final String QUERY_METHOD = "query";
  private static final String NOTIFY_METHOD = "notify";
  private static final String ALERT_TAG = "alert";
  private static final int SYNTHETIC_MAX_PER_HOUR = 100;

  private final ProviderCatalog catalog;
  private final ProvidersFactory providersFactory;
  private final ProviderRepository providerRepository;
  private final AlertRepository alertRepository;
  private final ProviderConfigStore configStore;
  private final ProviderInstanceResolver instanceResolver;
  private final ProvidersProperties properties;
  private final Clock clock;

  public ProvidersListResponse listProviders(String tenantId) {
    final List<ProviderView> available =
        catalog.types().stream().map(type -> toView(type, null, null, false)).toList();
    List<ProviderView> installed = getInstalledProviders(tenantId, true, true);
    List<ProviderView> linked = getLinkedProviders(tenantId);
    if (properties.distributionEnabled()) {
      if (properties.readOnly()) {
        installed = installed.stream().map(this::withSyntheticDistribution).toList();
        linked = linked.stream().map(this::withSyntheticDistribution).toList();
      } else {
        final Map<String, ProviderAlertDistribution> distribution =
            alertRepository.findDistribution(
                tenantId, Instant.now(clock).minus(properties.distributionWindow()));
        installed = installed.stream().map(view -> withDistribution(view, distribution)).toList();
        linked = linked.stream().map(view -> withDistribution(view, distribution)).toList();
      }
    }
    return new ProvidersListResponse(available, installed, linked, properties.isLocalhost());
  }

  public List<ProviderView> exportProviders(String tenantId) {
    return getInstalledProviders(tenantId, true, false);
  }

  /** 種別がカタログに無いレコードは表示できないため除外する。 */
  public List<ProviderView> getInstalledProviders(
      String tenantId, boolean includeDetails, boolean maskSensitive) {
    final List<ProviderView> views = new ArrayList<>();
    for (ProviderRecord record : providerRepository.findByTenant(tenantId)) {
      final Optional<ProviderType<?>> type = catalog.find(record.type());
      if (type.isEmpty()) {
        logger.warn(
            "installed provider has unknown type tenant_id={} provider_id={} provider_type={}",
            tenantId,
            record.id(),
            record.type());
        continue;
      }
      final Map<String, Object> details =
          includeDetails ? readDetails(record, type.get().descriptor(), maskSensitive) : null;
      views.add(toView(type.get(), record, details, false));
    }
    return views;
  }

  public List<ProviderView> getLinkedProviders(String tenantId) {
    final List<ProviderView> views = new ArrayList<>();
    for (LinkedProviderRecord linked : alertRepository.findLinkedProviders(tenantId)) {
      final Optional<ProviderType<?>> type = catalog.find(linked.providerType());
      if (type.isEmpty()) {
        logger.debug("linked provider type not in catalog provider_type={}", linked.providerType());
        continue;
      }
      views.add(
          toView(type.get(), null, null, true)
              .withIdentity(linked.providerId())
              .withDistribution(null, linked.lastAlertReceived()));
    }
    return views;
  }

  public Map<String, Object> getAlertSchema(String providerType) {
    return providersFactory.getProviderClass(providerType).alertSchema();
  }

  public AlertsResponse getAlertsConfiguration(
      String tenantId, String providerType, String providerId) {
    try (Provider provider = instanceResolver.resolveForType(tenantId, providerType, providerId)) {
      return new AlertsResponse(provider.getAlertsConfiguration());
    }
  }

  /** インスタンス側のログ取得失敗は空リストとして返す。 */
  public List<ProviderLogEntry> getInstanceLogs(
      String tenantId, String providerType, String providerId, int limit) {
    try (Provider provider = instanceResolver.resolveForType(tenantId, providerType, providerId)) {
      return provider.getLogs(limit);
    } catch (ProviderNotFoundException | InvalidParametersException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn(
          "failed to get provider logs tenant_id={} provider_type={} provider_id={}",
          tenantId,
          providerType,
          providerId,
          ex);
      return List.of();
    }
  }

  public AlertCountResponse countAlerts(
      String tenantId,
      String providerType,
      String providerId,
      boolean ever,
      Instant startTime,
      Instant endTime) {
    providersFactory.getProviderClass(providerType);
    if (ever) {
      return new AlertCountResponse(
          alertRepository.countAllAlerts(tenantId, providerType, providerId));
    }
    if (startTime == null || endTime == null) {
      throw new IllegalArgumentException("either ever or both start_time and end_time are required");
    }
    if (startTime.isAfter(endTime)) {
      throw new IllegalArgumentException("start_time must not be after end_time");
    }
    return new AlertCountResponse(
        alertRepository.countAlertsBetween(tenantId, providerType, providerId, startTime, endTime));
  }

  public MessageResponse deployAlert(
      String tenantId,
      String providerType,
      String providerId,
      Map<String, Object> alert,
      String alertId) {
    try (Provider provider = instanceResolver.resolveForType(tenantId, providerType, providerId)) {
      provider.deployAlert(alert == null ? Map.of() : alert, alertId);
    }
    logger.info(
        "alert deployed tenant_id={} provider_type={} provider_id={} alert_id={}",
        tenantId,
        providerType,
        providerId,
        alertId);
    return new MessageResponse("deployed");
  }

  /** 保存せずに生成したインスタンスでアラート取得を試す。 */
  public AlertsResponse testProvider(String tenantId, Map<String, Object> body) {
    try (Provider provider = ephemeralProvider(ProviderContext.forTenant(tenantId), body)) {
      return new AlertsResponse(provider.getAlertsConfiguration());
    } catch (GetAlertException | ProviderNotFoundException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.info("provider test failed tenant_id={} reason={}", tenantId, ex.getMessage());
      throw new ProviderMethodException(400, String.valueOf(ex.getMessage()), ex);
    }
  }

  public Map<String, Object> healthcheck(Map<String, Object> body) {
    try (Provider provider = ephemeralProvider(ProviderContext.anonymous(), body)) {
      return provider.getHealthReport();
    }
  }

  public HealthcheckProvidersResponse getHealthcheckProviders() {
    final List<ProviderView> providers =
        catalog.types().stream()
            .filter(type -> type.descriptor().supports(ProviderCapability.HEALTH))
            .map(type -> toView(type, null, null, false))
            .toList();
    return new HealthcheckProvidersResponse(providers, properties.isLocalhost());
  }

  private Provider ephemeralProvider(ProviderContext context, Map<String, Object> body) {
    if (body == null || body.isEmpty()) {
      throw new IllegalArgumentException("no valid data provided");
    }
    final Map<String, Object> remaining = new LinkedHashMap<>(body);
    final Object providerId = remaining.remove("provider_id");
    if (providerId == null || providerId.toString().isBlank()) {
      throw new IllegalArgumentException("missing required field: provider_id");
    }
    final Object rawType = remaining.remove("provider_type");
    final String providerType =
        rawType == null || rawType.toString().isBlank() ? providerId.toString() : rawType.toString();
    final Object providerName = remaining.remove("provider_name");
    final ProviderConfig config =
        new ProviderConfig(
            ProviderInstallRequest.toAuthentication(remaining),
            providerName == null ? null : providerName.toString());
    return providersFactory.getProvider(context, providerId.toString(), providerType, config);
  }

  private Map<String, Object> readDetails(
      ProviderRecord record, ProviderTypeDescriptor descriptor, boolean maskSensitive) {
    final ProviderConfig config;
    try {
      config = configStore.read(record.configurationKey());
    } catch (SecretNotFoundException ex) {
      logger.warn(
          "installed provider has no configuration secret tenant_id={} provider_id={}",
          record.tenantId(),
          record.id());
      return null;
    }
    if (!maskSensitive) {
      return config.toDetails();
    }
    final Map<String, String> masked = new LinkedHashMap<>(config.authentication());
    descriptor.authFields().stream()
        .filter(AuthField::sensitive)
        .map(AuthField::name)
        .filter(masked::containsKey)
        .forEach(name -> masked.put(name, MASK));
    return new ProviderConfig(masked, config.name()).toDetails();
  }

  private ProviderView toView(
      ProviderType<?> type,
      ProviderRecord record,
      Map<String, Object> details,
      boolean linked) {
    final ProviderTypeDescriptor descriptor = type.descriptor();
    final Map<String, AuthField> config = new LinkedHashMap<>();
    descriptor.authFields().forEach(field -> config.put(field.name(), field));
    final List<ProviderMethodView> methods =
        type.methods().methods().stream()
            .map(
                method ->
                    new ProviderMethodView(
                        method.name(), method.description(), method.parameterNames()))
            .toList();
    final boolean installed = record != null;
    return new ProviderView(
        installed ? record.id() : descriptor.type(),
        descriptor.type(),
        installed && record.name() != null ? record.name() : descriptor.displayName(),
        installed,
        linked,
        details,
        installed ? record.validatedScopes() : null,
        descriptor.scopes(),
        config,
        descriptor.supports(ProviderCapability.QUERY),
        parameterNames(type, QUERY_METHOD),
        descriptor.supports(ProviderCapability.NOTIFY),
        parameterNames(type, NOTIFY_METHOD),
        methods,
        descriptor.tags(),
        descriptor.categories(),
        descriptor.supports(ProviderCapability.PULL_ALERTS),
        installed && record.pullingEnabled(),
        descriptor.supports(ProviderCapability.WEBHOOK),
        descriptor.comingSoon(),
        descriptor.supports(ProviderCapability.HEALTH),
        installed ? record.installedBy() : null,
        installed ? record.installationTime() : null,
        installed ? record.lastUpdatedBy() : null,
        null,
        null);
  }

  private List<String> parameterNames(ProviderType<?> type, String methodName) {
    return type.methods().find(methodName).map(ProviderMethod::parameterNames).orElse(List.of());
  }

  private ProviderView withDistribution(
      ProviderView view, Map<String, ProviderAlertDistribution> distribution) {
    final ProviderAlertDistribution found =
        distribution.get(ProviderAlertDistribution.key(view.id(), view.type()));
    if (found == null) {
      return view.withDistribution(List.of(), null);
    }
    return view.withDistribution(found.hourly(), found.lastAlertReceived());
  }

  /** デモ運用向け。provider id ごとに決まった値を返す。 */
  private ProviderView withSyntheticDistribution(ProviderView view) {
    if (!view.tags().contains(ALERT_TAG)) {
      return view;
    }
    final Instant now = Instant.now(clock);
    final Instant currentHour = now.truncatedTo(ChronoUnit.HOURS);
    final long hours = Math.max(1L, properties.distributionWindow().toHours());
    final Random random = new Random(ProviderAlertDistribution.key(view.id(), view.type()).hashCode());
    final List<HourlyAlertCount> hourly = new ArrayList<>();
    for (long offset = hours - 1; offset >= 0; offset--) {
      hourly.add(
          new HourlyAlertCount(
              currentHour.minus(Duration.ofHours(offset)),
              random.nextInt(SYNTHETIC_MAX_PER_HOUR + 1)));
    }
    return view.withDistribution(hourly, now);
  }
}
