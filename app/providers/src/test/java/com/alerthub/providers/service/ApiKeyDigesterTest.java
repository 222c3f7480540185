package com.alerthub.providers.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ApiKeyDigesterTest {

  private final ApiKeyDigester digester = new ApiKeyDigester();

  @Test
  void hashIsSha256Hex() {
    assertThat(digester.hash("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void lockKeyIsStablePerValue() {
    assertThat(digester.lockKey("tenant-a:webhook")).isEqualTo(digester.lockKey("tenant-a:webhook"));
    assertThat(digester.lockKey("tenant-a:webhook")).isNotEqualTo(digester.lockKey("tenant-b:webhook"));
  }

  @Test
  void newApiKeysAreRandom() {
    assertThat(digester.newApiKey()).hasSize(64).isNotEqualTo(digester.newApiKey());
  }
}
