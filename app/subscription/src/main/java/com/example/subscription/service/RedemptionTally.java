package com.example.subscription.service;

/** 1 回のバッチ実行内でだけ使う集計器。スレッドセーフではない。 */
public final class RedemptionTally {

  private final int total;
  private int succeeded;
  private int failed;
  private int completed;

  public RedemptionTally(int total) {
    this.total = total;
  }

  public void record(ProcessOutcome outcome) {
    if (outcome.countsSucceeded()) {
      succeeded++;
    }
    if (outcome.countsCompleted()) {
      completed++;
    }
    if (outcome.countsFailed()) {
      failed++;
    }
  }

  public RedemptionResult toResult() {
    return new RedemptionResult(total, succeeded, failed, completed);
  }
}
