/*
 * どこで: Subscription クライアント層
 * 何を: 受取アドレスが注入対象なら実行サービスを呼ばずに請求失敗を返すデコレータ
 * なぜ: 実行サービスの応答を作り込まずに恒久エラー/一時エラーの分岐を E2E で再現するため
 */
package com.example.subscription.client;

import com.example.subscription.config.DelegationFailureInjectionProperties;
import com.example.subscription.service.DelegationExecutor;
import com.example.subscription.service.DelegationRedemptionException;
import com.example.subscription.service.ExecutionParams;
import com.example.subscription.service.RedemptionFailureReason;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FailureInjectingDelegationExecutor implements DelegationExecutor {

  private static final Logger logger =
      LoggerFactory.getLogger(FailureInjectingDelegationExecutor.class);

  private final DelegationExecutor target;
  private final List<String> prefixes;
  private final RedemptionFailureReason reason;

  public FailureInjectingDelegationExecutor(
      DelegationExecutor target, DelegationFailureInjectionProperties properties) {
    this.target = target;
    // EIP-55 のチェックサム表記があるためアドレスは小文字で比較する
    this.prefixes =
        properties.merchantAddressPrefixes().stream()
            .map(prefix -> prefix.toLowerCase(Locale.ROOT))
            .toList();
    this.reason = properties.reason();
  }

  @Override
  public String redeem(byte[] delegationPayload, ExecutionParams params) {
    final String merchantAddress = params.merchantAddress();
    if (!matches(merchantAddress)) {
      return target.redeem(delegationPayload, params);
    }
    logger.info(
        "delegation failure injected merchant={} reason={} target={}",
        merchantAddress,
        reason,
        target.getClass().getSimpleName());
    // 実行サービスと同じ文言を返し、分類の経路も本番と揃える
    final String message =
        reason.messageSignature() == null
            ? "injected failure reason=" + reason.name()
            : reason.messageSignature();
    throw new DelegationRedemptionException(reason, message);
  }

  private boolean matches(String merchantAddress) {
    if (merchantAddress == null || prefixes.isEmpty()) {
      return false;
    }
    final String normalized = merchantAddress.toLowerCase(Locale.ROOT);
    return prefixes.stream().anyMatch(normalized::startsWith);
  }
}
