/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: 期日判定と次回請求日の計算を同じ時刻源で行い、テストで固定できるようにするため
 */
package com.example.common.config;

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
