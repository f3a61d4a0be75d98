/*
 * どこで: Subscription ドメインモデル
 * 何を: subscription_events に記録するイベント種別を定義する
 * なぜ: 監査ログの種別を DB の CHECK 制約と揃えるため
 */
package com.example.subscription.model;

public enum SubscriptionEventType {
  CREATED("created"),
  REDEEMED("redeemed"),
  FAILED_REDEMPTION("failed_redemption"),
  COMPLETED("completed"),
  FAILED_VALIDATION("failed_validation"),
  FAILED_CUSTOMER_CREATION("failed_customer_creation"),
  FAILED_WALLET_CREATION("failed_wallet_creation"),
  FAILED_DELEGATION_STORAGE("failed_delegation_storage"),
  FAILED_DUPLICATE("failed_duplicate"),
  FAILED_SUBSCRIPTION_DB("failed_subscription_db"),
  FAILED("failed"),
  CANCELED("canceled"),
  RESUMED("resumed");

  private final String value;

  SubscriptionEventType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static SubscriptionEventType fromValue(String eventType) {
    for (SubscriptionEventType candidate : values()) {
      if (candidate.value.equals(eventType)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported event type: " + eventType);
  }
}
