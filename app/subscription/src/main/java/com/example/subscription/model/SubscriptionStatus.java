/*
 * どこで: Subscription ドメインモデル
 * 何を: サブスクリプションの状態を定義する
 * なぜ: DB の小文字表記と内部列挙型の対応を一箇所に固定するため
 */
package com.example.subscription.model;

public enum SubscriptionStatus {
  ACTIVE("active"),
  OVERDUE("overdue"),
  SUSPENDED("suspended"),
  CANCELED("canceled"),
  EXPIRED("expired"),
  FAILED("failed"),
  COMPLETED("completed");

  private final String value;

  SubscriptionStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 請求対象になるのは ACTIVE と OVERDUE のみ。 */
  public boolean isRedeemable() {
    return this == ACTIVE || this == OVERDUE;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static SubscriptionStatus fromValue(String status) {
    for (SubscriptionStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(status)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported subscription status: " + status);
  }
}
