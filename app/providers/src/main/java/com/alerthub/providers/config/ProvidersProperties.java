/*
 * どこで: Providers アプリの設定バインド
 * 何を: 公開 API の URL と一覧表示・デモ運用のフラグを保持する
 * なぜ: 起動時に一度だけ組み立てた設定を各サービスへ注入し、グローバル状態を持たないため
 */
package com.alerthub.providers.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "providers")
public record ProvidersProperties(
    @NotBlank String apiUrl,
    boolean readOnly,
    boolean distributionEnabled,
    Duration distributionWindow,
    String webhookCredentialUser) {

  private static final List<String> LOCAL_HOST_MARKERS = List.of("localhost", "127.0.0", "0.0.0.0");

  public ProvidersProperties {
    distributionWindow =
        distributionWindow == null || distributionWindow.isNegative() || distributionWindow.isZero()
            ? Duration.ofHours(24)
            : distributionWindow;
    webhookCredentialUser =
        webhookCredentialUser == null || webhookCredentialUser.isBlank()
            ? "api"
            : webhookCredentialUser;
  }

  /** 外部から webhook を受けられない URL で動いているかどうか。 */
  public boolean isLocalhost() {
    return apiUrl != null && LOCAL_HOST_MARKERS.stream().anyMatch(apiUrl::contains);
  }
}
