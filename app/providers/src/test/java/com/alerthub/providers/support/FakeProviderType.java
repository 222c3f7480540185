/*
 * どこで: Providers テスト補助
 * 何を: scope 応答や失敗の仕方をテストから差し替えられるプロバイダ種別を提供する
 * なぜ: サービス層のテストを外部接続無しで組み立てるため
 */
package com.alerthub.providers.support;

import com.alerthub.providers.spi.AuthField;
import com.alerthub.providers.spi.AuthFieldType;
import com.alerthub.providers.spi.BaseProvider;
import com.alerthub.providers.spi.MethodParameter;
import com.alerthub.providers.spi.ParameterType;
import com.alerthub.providers.spi.ProviderCapability;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderMethodException;
import com.alerthub.providers.spi.ProviderMethodRegistry;
import com.alerthub.providers.spi.ProviderScope;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import com.alerthub.providers.spi.WebhookTemplates;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class FakeProviderType extends ProviderType<FakeProviderType.FakeProvider> {

  public static final String TYPE = "fake";
  public static final String TOKEN = "token";
  public static final String SCOPE_READ = "read";
  public static final String SCOPE_WRITE = "write";

  private final AtomicInteger created = new AtomicInteger();
  private final AtomicInteger closed = new AtomicInteger();
  private final List<String> webhookCalls = new ArrayList<>();
  private final List<ProviderConfig> configs = new ArrayList<>();
  private final List<Map<String, Object>> oauth2Payloads = new ArrayList<>();
  private Map<String, Object> scopes = Map.of(SCOPE_READ, true, SCOPE_WRITE, true);
  private RuntimeException webhookFailure;
  private RuntimeException cleanUpFailure;

  public FakeProviderType() {
    this(EnumSet.of(ProviderCapability.WEBHOOK, ProviderCapability.QUERY));
  }

  public FakeProviderType(EnumSet<ProviderCapability> capabilities) {
    super(typeDescriptor(capabilities), methodRegistry());
  }

  @Override
  public FakeProvider create(ProviderContext context, String providerId, ProviderConfig config) {
    created.incrementAndGet();
    configs.add(config);
    return new FakeProvider(this, context, providerId, config);
  }

  @Override
  public Map<String, String> exchangeOAuth2(Map<String, Object> payload) {
    oauth2Payloads.add(new LinkedHashMap<>(payload));
    final Map<String, String> authentication = new LinkedHashMap<>();
    authentication.put(TOKEN, "oauth-" + payload.get("code"));
    if (payload.containsKey("remote_name")) {
      authentication.put("provider_name", payload.get("remote_name").toString());
    }
    return authentication;
  }

  public FakeProviderType respondingWithScopes(Map<String, Object> newScopes) {
    this.scopes = newScopes;
    return this;
  }

  public FakeProviderType failingWebhookWith(RuntimeException failure) {
    this.webhookFailure = failure;
    return this;
  }

  public FakeProviderType failingCleanUpWith(RuntimeException failure) {
    this.cleanUpFailure = failure;
    return this;
  }

  public int createdCount() {
    return created.get();
  }

  public int closedCount() {
    return closed.get();
  }

  public List<String> webhookCalls() {
    return webhookCalls;
  }

  public List<Map<String, Object>> oauth2Payloads() {
    return oauth2Payloads;
  }

  public List<ProviderConfig> configs() {
    return configs;
  }

  private static ProviderTypeDescriptor typeDescriptor(EnumSet<ProviderCapability> capabilities) {
    return new ProviderTypeDescriptor(
        TYPE,
        "Fake",
        List.of(AuthField.required(TOKEN, "token", AuthFieldType.STRING).asSensitive()),
        List.of(
            ProviderScope.mandatory(SCOPE_READ, "read access"),
            ProviderScope.optional(SCOPE_WRITE, "write access")),
        capabilities,
        List.of("alert"),
        List.of("Testing"),
        Map.of("name", "string"),
        capabilities.contains(ProviderCapability.WEBHOOK)
            ? new WebhookTemplates(
                "send to {webhook_url}", "{\"key\":\"{api_key}\"}", "use {webhook_url_with_auth}")
            : null,
        false);
  }

  private static ProviderMethodRegistry<FakeProvider> methodRegistry() {
    return ProviderMethodRegistry.builder(FakeProvider.class)
        .method(
            "echo",
            "Echo text",
            List.of(
                MethodParameter.required("text", ParameterType.STRING),
                MethodParameter.optional("times", ParameterType.INTEGER)),
            (provider, args) -> args.string("text").repeat((int) args.integer("times", 1)))
        .method(
            "explode",
            "Fail unexpectedly",
            List.of(),
            (provider, args) -> {
              throw new IllegalStateException("connection pool secret leaked");
            })
        .method(
            "throttled",
            "Fail with a provider status",
            List.of(),
            (provider, args) -> {
              throw new ProviderMethodException(429, "rate limited");
            })
        .method(
            "reject",
            "Reject an argument",
            List.of(MethodParameter.optional("value", ParameterType.ANY)),
            (provider, args) -> {
              throw new IllegalArgumentException("value is out of range");
            })
        .build();
  }

  public static final class FakeProvider extends BaseProvider {

    private final FakeProviderType type;

    FakeProvider(
        FakeProviderType type, ProviderContext context, String providerId, ProviderConfig config) {
      super(context, providerId, TYPE, config);
      this.type = type;
    }

    @Override
    public Map<String, Object> validateScopes() {
      return type.scopes;
    }

    @Override
    public void setupWebhook(
        String tenantId, String webhookUrl, String apiKey, boolean setupAlerts) {
      if (type.webhookFailure != null) {
        throw type.webhookFailure;
      }
      type.webhookCalls.add(tenantId + "|" + webhookUrl + "|" + apiKey + "|" + setupAlerts);
    }

    @Override
    public void cleanUp() {
      if (type.cleanUpFailure != null) {
        throw type.cleanUpFailure;
      }
    }

    @Override
    public void close() {
      type.closed.incrementAndGet();
    }

    public String token() {
      return authentication(TOKEN);
    }
  }
}
