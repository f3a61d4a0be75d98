/*
 * どこで: Subscription ドメインモデル
 * 何を: subscription_events へ追記するイベントの入力値を表す
 * なぜ: 成功/失敗イベントの生成箇所を問わず同じ形で保存するため
 */
package com.example.subscription.model;

import java.time.Instant;
import java.util.UUID;

public record NewSubscriptionEvent(
    UUID subscriptionId,
    SubscriptionEventType eventType,
    String transactionHash,
    long amountInCents,
    Instant occurredAt,
    String errorMessage,
    String metadataJson) {

  public static NewSubscriptionEvent success(
      UUID subscriptionId,
      SubscriptionEventType eventType,
      String transactionHash,
      long amountInCents,
      Instant occurredAt,
      String metadataJson) {
    return new NewSubscriptionEvent(
        subscriptionId, eventType, transactionHash, amountInCents, occurredAt, null, metadataJson);
  }

  public static NewSubscriptionEvent failedRedemption(
      UUID subscriptionId,
      long amountInCents,
      Instant occurredAt,
      String errorMessage,
      String metadataJson) {
    return new NewSubscriptionEvent(
        subscriptionId,
        SubscriptionEventType.FAILED_REDEMPTION,
        null,
        amountInCents,
        occurredAt,
        errorMessage,
        metadataJson);
  }
}
