/*
 * どこで: Providers サービス層
 * 何を: インストール/呼び出し/scope 検証/webhook 登録の結果をメトリクスへ記録する
 * なぜ: プロバイダ連携の失敗率を種別ごとに運用で監視できるようにするため
 */
package com.alerthub.providers.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ProvidersMetrics {

  static final String METRIC_INSTALL_TOTAL = "providers.install.total";
  static final String METRIC_INVOKE_TOTAL = "providers.invoke.total";
  static final String METRIC_SCOPES_TOTAL = "providers.scopes.validation.total";
  static final String METRIC_WEBHOOK_TOTAL = "providers.webhook.install.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public ProvidersMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordInstall(String providerType, String result) {
    increment(
        METRIC_INSTALL_TOTAL,
        "Provider installations",
        Tags.of("type", providerType, "result", result));
  }

  public void recordInvoke(String method, String result) {
    increment(
        METRIC_INVOKE_TOTAL,
        "Provider method invocations",
        Tags.of("method", method, "result", result));
  }

  public void recordScopeValidation(String result) {
    increment(METRIC_SCOPES_TOTAL, "Provider scope validations", Tags.of("result", result));
  }

  public void recordWebhookInstall(String result) {
    increment(METRIC_WEBHOOK_TOTAL, "Provider webhook registrations", Tags.of("result", result));
  }

  private void increment(String name, String description, Tags tags) {
    final StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append(':').append(tag.getKey()).append('=').append(tag.getValue()));
    counters
        .computeIfAbsent(
            key.toString(),
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
