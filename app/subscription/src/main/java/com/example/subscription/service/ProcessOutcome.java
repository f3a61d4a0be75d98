/*
 * どこで: Subscription サービス層
 * 何を: 1 件のサブスクリプション処理結果を分類する
 * なぜ: 冪等チェックでの見送りも含め、実行回ごとのカウンタを 1 回だけ更新するため
 */
package com.example.subscription.service;

public enum ProcessOutcome {
  REDEEMED("succeeded", true, false, false),
  COMPLETED("completed", true, true, false),
  ALREADY_COMPLETED("already_completed", false, true, false),
  ALREADY_FAILED("already_failed", false, false, true),
  ALREADY_ADVANCED("already_advanced", true, false, false),
  NOT_REDEEMABLE("not_redeemable", false, false, false),
  FAILED("failed", false, false, true),
  BOOKKEEPING_FAILED("bookkeeping_failed", false, false, true),
  DEFERRED("deferred", false, false, true),
  UNRESOLVED("unresolved", false, false, true);

  private final String metricValue;
  private final boolean countsSucceeded;
  private final boolean countsCompleted;
  private final boolean countsFailed;

  ProcessOutcome(
      String metricValue, boolean countsSucceeded, boolean countsCompleted, boolean countsFailed) {
    this.metricValue = metricValue;
    this.countsSucceeded = countsSucceeded;
    this.countsCompleted = countsCompleted;
    this.countsFailed = countsFailed;
  }

  public String metricValue() {
    return metricValue;
  }

  public boolean countsSucceeded() {
    return countsSucceeded;
  }

  public boolean countsCompleted() {
    return countsCompleted;
  }

  public boolean countsFailed() {
    return countsFailed;
  }
}
