package com.example.subscription.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.subscription.model.IntervalType;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PeriodCalculatorTest {

  private static final Instant FROM = Instant.parse("2026-01-15T10:30:00Z");

  @Test
  void nextRedemptionAddsOneIntervalUnit() {
    assertThat(PeriodCalculator.nextRedemption(IntervalType.ONE_MINUTE, FROM))
        .isEqualTo(Instant.parse("2026-01-15T10:31:00Z"));
    assertThat(PeriodCalculator.nextRedemption(IntervalType.FIVE_MINUTES, FROM))
        .isEqualTo(Instant.parse("2026-01-15T10:35:00Z"));
    assertThat(PeriodCalculator.nextRedemption(IntervalType.DAILY, FROM))
        .isEqualTo(Instant.parse("2026-01-16T10:30:00Z"));
    assertThat(PeriodCalculator.nextRedemption(IntervalType.WEEKLY, FROM))
        .isEqualTo(Instant.parse("2026-01-22T10:30:00Z"));
    assertThat(PeriodCalculator.nextRedemption(IntervalType.MONTHLY, FROM))
        .isEqualTo(Instant.parse("2026-02-15T10:30:00Z"));
    assertThat(PeriodCalculator.nextRedemption(IntervalType.YEARLY, FROM))
        .isEqualTo(Instant.parse("2027-01-15T10:30:00Z"));
  }

  @Test
  void unknownIntervalFallsBackToMonthly() {
    assertThat(PeriodCalculator.nextRedemption(null, FROM))
        .isEqualTo(Instant.parse("2026-02-15T10:30:00Z"));
    assertThat(PeriodCalculator.nextRedemption(IntervalType.fromValue("fortnight"), FROM))
        .isEqualTo(Instant.parse("2026-02-15T10:30:00Z"));
  }

  @Test
  void monthEndIsClampedToLastDayOfShorterMonth() {
    assertThat(
            PeriodCalculator.nextRedemption(
                IntervalType.MONTHLY, Instant.parse("2026-01-31T00:00:00Z")))
        .isEqualTo(Instant.parse("2026-02-28T00:00:00Z"));
    assertThat(
            PeriodCalculator.nextRedemption(
                IntervalType.YEARLY, Instant.parse("2028-02-29T00:00:00Z")))
        .isEqualTo(Instant.parse("2029-02-28T00:00:00Z"));
  }

  @Test
  void periodEndMultipliesIntervalByTermLength() {
    assertThat(PeriodCalculator.periodEnd(FROM, IntervalType.MONTHLY, 12))
        .isEqualTo(Instant.parse("2027-01-15T10:30:00Z"));
    assertThat(PeriodCalculator.periodEnd(FROM, IntervalType.WEEKLY, 4))
        .isEqualTo(Instant.parse("2026-02-12T10:30:00Z"));
    assertThat(PeriodCalculator.periodEnd(FROM, IntervalType.FIVE_MINUTES, 3))
        .isEqualTo(Instant.parse("2026-01-15T10:45:00Z"));
  }

  @Test
  void periodEndWithZeroTermReturnsStart() {
    assertThat(PeriodCalculator.periodEnd(FROM, IntervalType.DAILY, 0)).isEqualTo(FROM);
  }
}
