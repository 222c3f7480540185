package com.alerthub.providers.integration.console;

import com.alerthub.providers.spi.BaseProvider;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class ConsoleProvider extends BaseProvider {

  private static final Set<String> SEVERITIES = Set.of("info", "warning", "error");

  ConsoleProvider(
      ProviderContext context, String providerId, String providerType, ProviderConfig config) {
    super(context, providerId, providerType, config);
  }

  public Map<String, Object> notify(String message, String severity) {
    final String level = severity.toLowerCase(Locale.ROOT);
    if (!SEVERITIES.contains(level)) {
      throw new IllegalArgumentException("severity must be one of info, warning, error");
    }
    final String format = "console notification provider_id={} message={}";
    switch (level) {
      case "error" -> logger.error(format, providerId(), message);
      case "warning" -> logger.warn(format, providerId(), message);
      default -> logger.info(format, providerId(), message);
    }
    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("delivered", true);
    result.put("severity", level);
    result.put("message", message);
    return result;
  }

  @Override
  public Map<String, Object> getHealthReport() {
    return Map.of("status", "ok", "provider_type", providerType());
  }
}
