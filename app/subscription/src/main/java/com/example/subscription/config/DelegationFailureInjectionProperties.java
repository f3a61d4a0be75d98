/*
 * どこで: Subscription 設定
 * 何を: CI/Test で請求失敗を注入する対象と失敗理由を保持する
 * なぜ: 失敗させる受取アドレスを環境変数で切り替えて E2E シナリオを組むため
 */
package com.example.subscription.config;

import com.example.subscription.service.RedemptionFailureReason;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "subscription.delegation.failure-injection")
public record DelegationFailureInjectionProperties(
    boolean enabled, List<String> merchantAddressPrefixes, RedemptionFailureReason reason) {

  public DelegationFailureInjectionProperties {
    merchantAddressPrefixes =
        merchantAddressPrefixes == null
            ? List.of()
            : merchantAddressPrefixes.stream().filter(prefix -> !prefix.isBlank()).toList();
    reason = reason == null ? RedemptionFailureReason.INSUFFICIENT_FUNDS : reason;
  }
}
