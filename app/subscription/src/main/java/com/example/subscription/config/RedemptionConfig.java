/*
 * どこで: Subscription 設定
 * 何を: リトライ待機に使う BackoffSleeper を提供する
 * なぜ: 本番ではスレッドを実際に待機させ、テストでは待機を記録だけに差し替えるため
 */
package com.example.subscription.config;

import com.example.subscription.service.BackoffSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RedemptionConfig {

  @Bean
  BackoffSleeper backoffSleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
