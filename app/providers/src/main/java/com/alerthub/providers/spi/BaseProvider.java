/*
 * どこで: Provider SPI
 * 何を: id/type/config の束縛と未対応機能の既定応答を提供する
 * なぜ: 具象プロバイダが対応する機能だけを実装すれば済むようにするため
 */
package com.alerthub.providers.spi;

import java.util.List;
import java.util.Map;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class BaseProvider implements Provider {

  private static final int UNSUPPORTED_STATUS = 400;

  protected final Logger logger = LoggerFactory.getLogger(getClass());

  private final ProviderContext context;
  private final String providerId;
  private final String providerType;
  private final ProviderConfig config;

  protected BaseProvider(
      @NonNull ProviderContext context,
      @NonNull String providerId,
      @NonNull String providerType,
      @NonNull ProviderConfig config) {
    this.context = context;
    this.providerId = providerId;
    this.providerType = providerType;
    this.config = config;
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public String providerType() {
    return providerType;
  }

  protected ProviderContext context() {
    return context;
  }

  protected ProviderConfig config() {
    return config;
  }

  protected String authentication(String key) {
    return config.value(key);
  }

  @Override
  public Map<String, Object> validateScopes() {
    return Map.of();
  }

  @Override
  public List<Map<String, Object>> getAlertsConfiguration() {
    throw unsupported("alerts configuration");
  }

  @Override
  public List<ProviderLogEntry> getLogs(int limit) {
    return List.of();
  }

  @Override
  public void deployAlert(Map<String, Object> alert, String alertId) {
    throw unsupported("alert deployment");
  }

  @Override
  public Map<String, Object> getHealthReport() {
    throw unsupported("health reports");
  }

  @Override
  public void setupWebhook(String tenantId, String webhookUrl, String apiKey, boolean setupAlerts) {
    throw unsupported("webhook setup");
  }

  @Override
  public void cleanUp() {}

  @Override
  public void close() {}

  protected ProviderMethodException unsupported(String capability) {
    return new ProviderMethodException(
        UNSUPPORTED_STATUS,
        "provider " + providerType + "/" + providerId + " does not support " + capability);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + providerType + "/" + providerId + "]";
  }
}
