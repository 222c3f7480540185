package com.alerthub.providers.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alerthub.providers.secret.InMemorySecretStore;
import com.alerthub.providers.secret.SecretNotFoundException;
import com.alerthub.providers.spi.ProviderConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderConfigStoreTest {

  private final InMemorySecretStore secretStore = new InMemorySecretStore();
  private final ProviderConfigStore configStore =
      new ProviderConfigStore(secretStore, new ObjectMapper());

  @Test
  void configurationKeyJoinsTenantTypeAndId() {
    assertThat(ProviderConfigStore.configurationKey("tenant-a", "http", "prod"))
        .isEqualTo("tenant-a_http_prod");
  }

  @Test
  void writeThenReadReturnsSameConfig() {
    final ProviderConfig config =
        new ProviderConfig(Map.of("url", "https://alerts.example.com", "api_key", "k"), "prod");

    configStore.write("tenant-a_http_prod", config);

    assertThat(configStore.read("tenant-a_http_prod")).isEqualTo(config);
  }

  @Test
  void readJsonReturnsUntypedObject() {
    secretStore.write("k", "{\"authentication\":{\"url\":\"https://x.example\"},\"name\":\"prod\"}");

    final Map<String, Object> json = configStore.readJson("k");

    assertThat(json).containsEntry("name", "prod");
    assertThat(json.get("authentication")).isEqualTo(Map.of("url", "https://x.example"));
  }

  @Test
  void corruptedSecretIsIllegalState() {
    secretStore.write("k", "not json");

    assertThatThrownBy(() -> configStore.read("k")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void missingSecretPropagates() {
    assertThatThrownBy(() -> configStore.read("absent"))
        .isInstanceOf(SecretNotFoundException.class);
    assertThat(configStore.delete("absent")).isFalse();
  }
}
