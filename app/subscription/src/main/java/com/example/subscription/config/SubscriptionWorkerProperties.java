/*
 * どこで: Subscription アプリの設定バインド
 * 何を: 期日バッチを起動するワーカーの有効/間隔設定を保持する
 * なぜ: 環境ごとにポーリング間隔や停止を切り替えるため
 */
package com.example.subscription.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "subscription.worker")
public record SubscriptionWorkerProperties(boolean enabled, Duration pollInterval) {

  public SubscriptionWorkerProperties {
    pollInterval = pollInterval == null ? Duration.ofMinutes(5) : pollInterval;
  }
}
