/*
 * どこで: Subscription サービス層
 * 何を: リトライ込みのデリゲーション実行結果を表す
 * なぜ: トランザクションハッシュを共有状態ではなく戻り値で呼び出し元へ渡すため
 */
package com.example.subscription.service;

public record RedemptionOutcome(
    String transactionHash, DelegationRedemptionException failure, int attempts) {

  public static RedemptionOutcome success(String transactionHash, int attempts) {
    return new RedemptionOutcome(transactionHash, null, attempts);
  }

  public static RedemptionOutcome failure(DelegationRedemptionException failure, int attempts) {
    return new RedemptionOutcome(null, failure, attempts);
  }

  public boolean succeeded() {
    return failure == null;
  }

  /** サーキットブレーカーにより実行自体を見送った場合に true。 */
  public boolean deferred() {
    return failure != null && failure.reason() == RedemptionFailureReason.CIRCUIT_OPEN;
  }
}
