/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: インストール時刻や分布集計の基準時刻をテストで固定できるようにするため
 */
package com.alerthub.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
