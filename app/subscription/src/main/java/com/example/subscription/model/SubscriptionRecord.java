/*
 * どこで: Subscription ドメインモデル
 * 何を: subscriptions テーブルの 1 行を表す
 * なぜ: 期日スキャンと冪等チェックで同じスナップショットを扱うため
 */
package com.example.subscription.model;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionRecord(
    UUID id,
    UUID customerId,
    UUID productId,
    UUID priceId,
    UUID productTokenId,
    long tokenAmount,
    UUID delegationId,
    UUID customerWalletId,
    SubscriptionStatus status,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    Instant nextRedemptionDate,
    int totalRedemptions,
    long totalAmountInCents,
    Integer totalTermLength,
    String metadataJson,
    Instant createdAt,
    Instant updatedAt) {

  /**
   * 最終回の支払いかどうかを判定する。
   * 単発価格は最初の請求で完了する。継続価格は現在の期間が終わっていて、期間数が管理されている場合は
   * 今回の請求で規定回数に達するときに true。
   */
  public boolean isFinalPayment(PriceRecord price, Instant now) {
    if (price.isOneTime()) {
      return totalRedemptions + 1 >= 1;
    }
    if (currentPeriodEnd == null || !currentPeriodEnd.isBefore(now)) {
      return false;
    }
    return totalTermLength == null || totalRedemptions + 1 >= totalTermLength;
  }
}
