/*
 * どこで: Subscription サービス層
 * 何を: 署名済みデリゲーションをオンチェーンで実行する外部サービスの境界
 * なぜ: HTTP 実装/ローカル実装/障害注入実装を差し替えられるようにするため
 */
package com.example.subscription.service;

public interface DelegationExecutor {

  /**
   * 役割: デリゲーションを 1 回実行する。
   * 動作: 成功時はトランザクションハッシュを返し、失敗時は分類付きの
   * DelegationRedemptionException を送出する。リトライはしない。
   */
  String redeem(byte[] delegationPayload, ExecutionParams params);
}
