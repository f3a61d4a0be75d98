/*
 * どこで: Subscription 設定
 * 何を: デリゲーション実行サービスの接続設定を保持する
 * なぜ: 実行サービスの URL とタイムアウトを外部化するため
 */
package com.example.subscription.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "subscription.delegation")
public record DelegationClientProperties(
    String mode,
    String baseUrl,
    String redeemPath,
    Duration connectTimeout,
    Duration readTimeout) {

  public DelegationClientProperties {
    mode = mode == null || mode.isBlank() ? "http" : mode;
    baseUrl = baseUrl == null ? "http://delegation-server:50051" : baseUrl;
    redeemPath =
        redeemPath == null || redeemPath.isBlank() ? "/v1/delegations/redeem" : redeemPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    // オンチェーン実行は確定まで時間がかかるため読み取りは長めに取る
    readTimeout = readTimeout == null ? Duration.ofMinutes(3) : readTimeout;
  }
}
