package com.example.subscription.service;

/** 予約変更 1 回分の適用件数。failed は DB 障害で打ち切った件数。 */
public record ScheduledChangeResult(int canceled, int resumed, int failed) {

  public int total() {
    return canceled + resumed + failed;
  }
}
