/*
 * どこで: Subscription サービス層
 * 何を: バッチ処理中の割り込み (キャンセル) を表す
 * なぜ: 請求失敗として記録せず、未コミットのトランザクションをロールバックさせるため
 */
package com.example.subscription.service;

public class RedemptionCancelledException extends RuntimeException {

  public RedemptionCancelledException(String message) {
    super(message);
  }

  public RedemptionCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
