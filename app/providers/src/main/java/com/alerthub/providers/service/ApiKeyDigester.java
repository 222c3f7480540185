/*
 * どこで: Providers サービス補助
 * 何を: API キーの保存用ハッシュと advisory lock 用の 64-bit キーを生成する
 * なぜ: 平文キーを DB に残さず、tenant 単位の発行処理を直列化するため
 */
package com.alerthub.providers.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import org.springframework.stereotype.Component;

@Component
public class ApiKeyDigester {

  static final int LOCK_KEY_BYTES = 8;
  private static final int API_KEY_BYTES = 32;

  private final SecureRandom secureRandom = new SecureRandom();

  public String newApiKey() {
    final byte[] bytes = new byte[API_KEY_BYTES];
    secureRandom.nextBytes(bytes);
    return toHex(bytes);
  }

  public String hash(String apiKey) {
    return toHex(sha256(apiKey));
  }

  public long lockKey(String value) {
    // ByteBuffer は Big Endian が既定。
    return ByteBuffer.wrap(sha256(value), 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] sha256(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
