package com.alerthub.providers.api.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderInstallRequestTest {

  @Test
  void remainingFieldsBecomeAuthentication() {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("provider_id", "prod");
    body.put("provider_name", "Prod");
    body.put("provider_type", "http");
    body.put("url", "https://example.com");
    body.put("port", 8443);
    body.put("ignored", null);

    final ProviderInstallRequest request = ProviderInstallRequest.fromBody(body);

    assertThat(request.providerId()).isEqualTo("prod");
    assertThat(request.providerName()).isEqualTo("Prod");
    assertThat(request.providerType()).isEqualTo("http");
    assertThat(request.authentication())
        .containsExactly(Map.entry("url", "https://example.com"), Map.entry("port", "8443"));
    assertThat(request.pullingEnabled()).isTrue();
    assertThat(request.installWebhook()).isFalse();
    // 呼び出し元の本文は変更しない
    assertThat(body).containsKey("provider_id");
  }

  @Test
  void providerTypeFallsBackToProviderId() {
    final ProviderInstallRequest request =
        ProviderInstallRequest.fromBody(Map.of("provider_id", "console", "provider_name", "c"));

    assertThat(request.providerType()).isEqualTo("console");
    assertThat(request.authentication()).isEmpty();
  }

  @Test
  void flagsAcceptBooleansAndStrings() {
    final Map<String, Object> body = new HashMap<>();
    body.put("provider_id", "prod");
    body.put("provider_name", "Prod");
    body.put("pulling_enabled", "false");
    body.put("install_webhook", true);

    final ProviderInstallRequest request = ProviderInstallRequest.fromBody(body);

    assertThat(request.pullingEnabled()).isFalse();
    assertThat(request.installWebhook()).isTrue();
    assertThat(ProviderInstallRequest.flag(" TRUE ", false)).isTrue();
    assertThat(ProviderInstallRequest.flag("", true)).isTrue();
    assertThat(ProviderInstallRequest.flag(1, false)).isFalse();
  }

  @Test
  void missingOrBlankRequiredFieldsAreRejected() {
    assertThatThrownBy(() -> ProviderInstallRequest.fromBody(Map.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("no valid data provided");
    assertThatThrownBy(
            () -> ProviderInstallRequest.fromBody(Map.of("provider_id", "p", "provider_name", " ")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("missing required field: provider_name");
  }
}
