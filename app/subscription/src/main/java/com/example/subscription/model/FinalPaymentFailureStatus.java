/*
 * どこで: Subscription ドメインモデル
 * 何を: 最終回の請求失敗時に遷移させる状態の方針を表す
 * なぜ: OVERDUE と FAILED のどちらに寄せるかを設定で切り替えるため
 */
package com.example.subscription.model;

public enum FinalPaymentFailureStatus {
  OVERDUE(SubscriptionStatus.OVERDUE),
  FAILED(SubscriptionStatus.FAILED);

  private final SubscriptionStatus targetStatus;

  FinalPaymentFailureStatus(SubscriptionStatus targetStatus) {
    this.targetStatus = targetStatus;
  }

  public SubscriptionStatus targetStatus() {
    return targetStatus;
  }
}
