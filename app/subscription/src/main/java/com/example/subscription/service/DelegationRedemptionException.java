/*
 * どこで: Subscription サービス層
 * 何を: デリゲーション実行の失敗を分類付きで表現する
 * なぜ: リトライ判定とイベント記録で失敗理由を型のまま扱うため
 */
package com.example.subscription.service;

public class DelegationRedemptionException extends RuntimeException {

  private final RedemptionFailureReason reason;

  public DelegationRedemptionException(RedemptionFailureReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DelegationRedemptionException(
      RedemptionFailureReason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public RedemptionFailureReason reason() {
    return reason;
  }

  public boolean isPermanent() {
    return reason.isPermanent();
  }
}
