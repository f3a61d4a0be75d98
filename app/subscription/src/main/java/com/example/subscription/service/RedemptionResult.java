/*
 * どこで: Subscription サービス層
 * 何を: バッチ実行の集計結果を表す
 * なぜ: 個別の失敗を HTTP ステータスではなくペイロードで返すため
 */
package com.example.subscription.service;

public record RedemptionResult(int total, int succeeded, int failed, int completed) {

  public static RedemptionResult empty() {
    return new RedemptionResult(0, 0, 0, 0);
  }
}
