/*
 * どこで: 組み込みプロバイダ (http)
 * 何を: 汎用 HTTP アラートエンドポイントを対象とする種別のメタデータ/メソッド/OAuth2 交換を登録する
 * なぜ: 独自プロトコルを持たない外部システムを共通の REST 契約で連携できるようにするため
 */
package com.alerthub.providers.integration.http;

import com.alerthub.providers.spi.AuthField;
import com.alerthub.providers.spi.AuthFieldType;
import com.alerthub.providers.spi.MethodParameter;
import com.alerthub.providers.spi.ParameterType;
import com.alerthub.providers.spi.ProviderCapability;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderConfigurationException;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderMethodRegistry;
import com.alerthub.providers.spi.ProviderScope;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import com.alerthub.providers.spi.WebhookTemplates;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class HttpProviderType extends ProviderType<HttpProvider> {

  public static final String TYPE = "http";
  public static final String URL = "url";
  public static final String API_KEY = "api_key";
  public static final String SCOPE_CONNECTIVITY = "connectivity";
  public static final String SCOPE_ALERTS_READ = "alerts:read";

  private static final Logger logger = LoggerFactory.getLogger(HttpProviderType.class);

  private static final String WEBHOOK_DESCRIPTION =
      "Configure your system to send alerts to the URL below with the X-API-KEY header.";
  private static final String WEBHOOK_TEMPLATE =
      """
      {"url": "{webhook_url}", "headers": {"X-API-KEY": "{api_key}"}}
      """;
  private static final String WEBHOOK_MARKDOWN =
      """
      1. Open the notification settings of your system.
      2. Add a webhook pointing to `{webhook_url}`.
      3. Send the header `X-API-KEY: {api_key}`, or use `{webhook_url_with_auth}` directly.
      """;

  private final RestClient restClient;

  public HttpProviderType(RestClient.Builder restClientBuilder) {
    super(typeDescriptor(), methodRegistry());
    this.restClient = restClientBuilder.build();
  }

  @Override
  public HttpProvider create(ProviderContext context, String providerId, ProviderConfig config) {
    return new HttpProvider(context, providerId, TYPE, config, restClient);
  }

  /** 認可コードをアクセストークンへ交換し、認証項目の形で返す。 */
  @Override
  public Map<String, String> exchangeOAuth2(Map<String, Object> payload) {
    final String url = text(payload, URL);
    final String code = text(payload, "code");
    if (url == null || !AuthFieldType.URL.accepts(url)) {
      throw new ProviderConfigurationException(
          "oauth2 payload requires a valid url", List.of(URL));
    }
    if (code == null) {
      throw new ProviderConfigurationException("oauth2 payload requires code", List.of("code"));
    }
    final Map<String, Object> request = new LinkedHashMap<>();
    request.put("grant_type", "authorization_code");
    request.put("code", code);
    final String redirectUri = text(payload, "redirect_uri");
    if (redirectUri != null) {
      request.put("redirect_uri", redirectUri);
    }

    final Map<?, ?> response;
    try {
      response =
          restClient
              .post()
              .uri(UriComponentsBuilder.fromUriString(url).path("/oauth/token").build().toUri())
              .body(request)
              .retrieve()
              .body(Map.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "http provider oauth2 exchange rejected status={}", ex.getStatusCode().value());
      throw new ProviderConfigurationException("oauth2 code exchange was rejected", ex);
    } catch (RestClientException ex) {
      logger.warn("http provider oauth2 exchange failed", ex);
      throw new ProviderConfigurationException("oauth2 code exchange failed", ex);
    }
    final Object token = response == null ? null : response.get("access_token");
    if (token == null || token.toString().isBlank()) {
      throw new ProviderConfigurationException("oauth2 response has no access_token");
    }
    final Map<String, String> authentication = new LinkedHashMap<>();
    authentication.put(URL, url);
    authentication.put(API_KEY, token.toString());
    final Object name = response.get("name");
    if (name != null && !name.toString().isBlank()) {
      authentication.put("provider_name", name.toString());
    }
    return authentication;
  }

  private static String text(Map<String, Object> payload, String key) {
    final Object value = payload == null ? null : payload.get(key);
    return value == null || value.toString().isBlank() ? null : value.toString();
  }

  private static ProviderTypeDescriptor typeDescriptor() {
    return new ProviderTypeDescriptor(
        TYPE,
        "HTTP",
        List.of(
            AuthField.required(URL, "Base URL of the alerting endpoint", AuthFieldType.URL)
                .withHint("https://alerts.example.com/api"),
            AuthField.optional(
                    API_KEY, "Bearer token sent with every request", AuthFieldType.STRING)
                .asSensitive()),
        List.of(
            ProviderScope.mandatory(SCOPE_CONNECTIVITY, "The endpoint is reachable"),
            ProviderScope.optional(SCOPE_ALERTS_READ, "Read alert rules")),
        EnumSet.of(
            ProviderCapability.QUERY,
            ProviderCapability.NOTIFY,
            ProviderCapability.PULL_ALERTS,
            ProviderCapability.DEPLOY_ALERTS,
            ProviderCapability.WEBHOOK,
            ProviderCapability.HEALTH,
            ProviderCapability.LOGS,
            ProviderCapability.OAUTH2),
        List.of("alert", "data"),
        List.of("Monitoring"),
        Map.of(
            "name", "string",
            "expression", "string",
            "severity", "string",
            "labels", "object"),
        new WebhookTemplates(WEBHOOK_DESCRIPTION, WEBHOOK_TEMPLATE, WEBHOOK_MARKDOWN),
        false);
  }

  private static ProviderMethodRegistry<HttpProvider> methodRegistry() {
    return ProviderMethodRegistry.builder(HttpProvider.class)
        .method(
            "query",
            "GET a path relative to the endpoint URL",
            List.of(
                MethodParameter.required("path", ParameterType.STRING),
                MethodParameter.optional("params", ParameterType.OBJECT)),
            (provider, args) -> provider.query(args.string("path"), args.object("params")))
        .method(
            "notify",
            "POST a notification to the endpoint",
            List.of(
                MethodParameter.required("message", ParameterType.STRING),
                MethodParameter.optional("title", ParameterType.STRING)),
            (provider, args) -> provider.notify(args.string("message"), args.string("title", null)))
        .build();
  }
}
