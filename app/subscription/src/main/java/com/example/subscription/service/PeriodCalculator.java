/*
 * どこで: Subscription サービス層
 * 何を: 請求間隔から次回請求日時と期間終了日時を計算する
 * なぜ: 暦上の月/年の加算を UTC で一貫させ、プロセッサから I/O なしで呼べるようにするため
 */
package com.example.subscription.service;

import com.example.subscription.model.IntervalType;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public final class PeriodCalculator {

  private PeriodCalculator() {}

  public static Instant nextRedemption(IntervalType interval, Instant from) {
    return addUnits(interval, from, 1);
  }

  /** termLength の検証は呼び出し側の責務。0 以下でもそのまま加算する。 */
  public static Instant periodEnd(Instant start, IntervalType interval, int termLength) {
    return addUnits(interval, start, termLength);
  }

  private static Instant addUnits(IntervalType interval, Instant from, long units) {
    // 月末/うるう年の丸めは ZonedDateTime の暦計算に任せる
    final ZonedDateTime base = from.atZone(ZoneOffset.UTC);
    final IntervalType resolved = interval == null ? IntervalType.MONTHLY : interval;
    final ZonedDateTime next =
        switch (resolved) {
          case ONE_MINUTE -> base.plusMinutes(units);
          case FIVE_MINUTES -> base.plusMinutes(units * 5);
          case DAILY -> base.plusDays(units);
          case WEEKLY -> base.plusDays(units * 7);
          case MONTHLY -> base.plusMonths(units);
          case YEARLY -> base.plusYears(units);
        };
    return next.toInstant();
  }
}
