/*
 * どこで: 組み込みプロバイダ (http)
 * 何を: 設定された URL の REST 契約 (health/alert-rules/logs/webhooks/notify) を呼び出す
 * なぜ: 外部 HTTP 失敗をプロバイダ報告の失敗としてステータス付きで呼び出し側へ返すため
 */
package com.alerthub.providers.integration.http;

import com.alerthub.providers.spi.BaseProvider;
import com.alerthub.providers.spi.GetAlertException;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderLogEntry;
import com.alerthub.providers.spi.ProviderMethodException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

public class HttpProvider extends BaseProvider {

  private static final int BAD_GATEWAY = 502;
  private static final int GATEWAY_TIMEOUT = 504;

  private static final ParameterizedTypeReference<List<Map<String, Object>>> RULES_TYPE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<List<ProviderLogEntry>> LOGS_TYPE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<Map<String, Object>> OBJECT_TYPE =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;

  HttpProvider(
      ProviderContext context,
      String providerId,
      String providerType,
      ProviderConfig config,
      RestClient restClient) {
    super(context, providerId, providerType, config);
    this.restClient = restClient;
  }

  @Override
  public Map<String, Object> validateScopes() {
    final Map<String, Object> scopes = new LinkedHashMap<>();
    scopes.put(HttpProviderType.SCOPE_CONNECTIVITY, probe("/health"));
    scopes.put(HttpProviderType.SCOPE_ALERTS_READ, probe("/alert-rules"));
    return scopes;
  }

  @Override
  public List<Map<String, Object>> getAlertsConfiguration() {
    try {
      final List<Map<String, Object>> rules =
          authorized(restClient.get().uri(uri("/alert-rules", Map.of())))
              .retrieve()
              .body(RULES_TYPE);
      return rules == null ? List.of() : rules;
    } catch (RestClientResponseException ex) {
      logger.info(
          "http provider alert rules rejected provider_id={} status={}",
          providerId(),
          ex.getStatusCode().value());
      throw new GetAlertException(
          ex.getStatusCode().value(), "failed to get alert rules: " + ex.getStatusText(), ex);
    } catch (RestClientException ex) {
      throw new GetAlertException(BAD_GATEWAY, "failed to reach " + baseUrl(), ex);
    }
  }

  @Override
  public List<ProviderLogEntry> getLogs(int limit) {
    final List<ProviderLogEntry> logs =
        call(
            "logs",
            () ->
                authorized(restClient.get().uri(uri("/logs", Map.<String, Object>of("limit", limit))))
                    .retrieve()
                    .body(LOGS_TYPE));
    return logs == null ? List.of() : logs;
  }

  @Override
  public void deployAlert(Map<String, Object> alert, String alertId) {
    if (alertId == null || alertId.isBlank()) {
      call(
          "deploy alert",
          () ->
              authorized(restClient.post().uri(uri("/alert-rules", Map.of())))
                  .body(alert)
                  .retrieve()
                  .toBodilessEntity());
      return;
    }
    call(
        "deploy alert",
        () ->
            authorized(
                    restClient
                        .put()
                        .uri(
                            UriComponentsBuilder.fromUriString(baseUrl())
                                .path("/alert-rules/{alertId}")
                                .buildAndExpand(alertId)
                                .encode()
                                .toUri()))
                .body(alert)
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public Map<String, Object> getHealthReport() {
    final Map<String, Object> report =
        call(
            "health",
            () ->
                authorized(restClient.get().uri(uri("/health", Map.of())))
                    .retrieve()
                    .body(OBJECT_TYPE));
    return report == null ? Map.of() : report;
  }

  @Override
  public void setupWebhook(String tenantId, String webhookUrl, String apiKey, boolean setupAlerts) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("url", webhookUrl);
    body.put("api_key", apiKey);
    body.put("setup_alerts", setupAlerts);
    call(
        "webhook setup",
        () ->
            authorized(restClient.post().uri(uri("/webhooks", Map.of())))
                .body(body)
                .retrieve()
                .toBodilessEntity());
    logger.info(
        "http provider webhook registered provider_id={} tenant_id={}", providerId(), tenantId);
  }

  public Object query(String path, Map<String, Object> params) {
    if (path.contains("://")) {
      throw new IllegalArgumentException("path must be relative to the provider url");
    }
    return call(
        "query",
        () ->
            authorized(restClient.get().uri(uri(path, params)))
                .retrieve()
                .body(Object.class));
  }

  public Map<String, Object> notify(String message, String title) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", message);
    if (title != null) {
      body.put("title", title);
    }
    final Map<String, Object> response =
        call(
            "notify",
            () ->
                authorized(restClient.post().uri(uri("/notify", Map.of())))
                    .body(body)
                    .retrieve()
                    .body(OBJECT_TYPE));
    return response == null ? Map.of("delivered", true) : response;
  }

  private Object probe(String path) {
    try {
      authorized(restClient.get().uri(uri(path, Map.of()))).retrieve().toBodilessEntity();
      return true;
    } catch (RestClientResponseException ex) {
      return "http status " + ex.getStatusCode().value();
    } catch (RestClientException ex) {
      logger.info("http provider unreachable provider_id={} path={}", providerId(), path);
      return "unreachable";
    }
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      logger.info(
          "http provider request rejected provider_id={} operation={} status={}",
          providerId(),
          operation,
          ex.getStatusCode().value());
      throw new ProviderMethodException(
          ex.getStatusCode().value(), operation + " failed: " + ex.getStatusText(), ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new ProviderMethodException(GATEWAY_TIMEOUT, operation + " timed out", ex);
      }
      throw new ProviderMethodException(BAD_GATEWAY, operation + " connection failed", ex);
    } catch (RestClientException ex) {
      throw new ProviderMethodException(BAD_GATEWAY, operation + " returned invalid response", ex);
    }
  }

  private RestClient.RequestBodySpec authorized(RestClient.RequestBodySpec spec) {
    bearerToken().ifPresent(token -> spec.header(HttpHeaders.AUTHORIZATION, token));
    return spec;
  }

  private RestClient.RequestHeadersSpec<?> authorized(RestClient.RequestHeadersSpec<?> spec) {
    bearerToken().ifPresent(token -> spec.header(HttpHeaders.AUTHORIZATION, token));
    return spec;
  }

  private Optional<String> bearerToken() {
    final String apiKey = authentication(HttpProviderType.API_KEY);
    if (apiKey == null || apiKey.isBlank()) {
      return Optional.empty();
    }
    return Optional.of("Bearer " + apiKey);
  }

  private URI uri(String path, Map<String, Object> params) {
    final UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl()).path(path);
    if (params != null) {
      params.forEach((key, value) -> builder.queryParam(key, value));
    }
    return builder.encode().build().toUri();
  }

  private String baseUrl() {
    final String url = authentication(HttpProviderType.URL).trim();
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
