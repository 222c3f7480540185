package com.alerthub.providers.model;

import java.time.Instant;
import java.util.List;

/** プロバイダ単位の直近アラート件数 (時間毎) と最終受信時刻。 */
public record ProviderAlertDistribution(
    String providerId, String providerType, List<HourlyAlertCount> hourly, Instant lastAlertReceived) {

  public ProviderAlertDistribution {
    hourly = hourly == null ? List.of() : List.copyOf(hourly);
  }

  public static String key(String providerId, String providerType) {
    return providerId + "_" + providerType;
  }
}
