/*
 * どこで: Providers メトリクステスト
 * 何を: インストール/呼び出し/scope 検証/webhook 登録のカウンタが記録されることを検証する
 * なぜ: プロバイダ連携の失敗率指標の計測回帰を防ぐため
 */
package com.alerthub.providers.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class ProvidersMetricsTest {

  @Test
  void recordsProviderCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ProvidersMetrics metrics = new ProvidersMetrics(registry);

    metrics.recordInstall("http", "installed");
    metrics.recordInstall("http", "installed");
    metrics.recordInstall("http", "rejected");
    metrics.recordInvoke("query", "success");
    metrics.recordScopeValidation("validated");
    metrics.recordWebhookInstall("unsupported");

    assertThat(
            registry
                .get("providers.install.total")
                .tag("type", "http")
                .tag("result", "installed")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("providers.install.total")
                .tag("type", "http")
                .tag("result", "rejected")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("providers.invoke.total")
                .tag("method", "query")
                .tag("result", "success")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("providers.scopes.validation.total").tag("result", "validated").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("providers.webhook.install.total").tag("result", "unsupported").counter().count())
        .isEqualTo(1.0d);
  }
}
