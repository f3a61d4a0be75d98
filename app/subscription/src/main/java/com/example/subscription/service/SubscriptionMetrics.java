/*
 * どこで: Subscription サービス層
 * 何を: 請求結果/試行回数/バッチ所要時間などのメトリクス記録を集約する
 * なぜ: 請求失敗率と実行サービスの健全性を運用で継続監視できるようにするため
 */
package com.example.subscription.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SubscriptionMetrics {

  private static final String METRIC_REDEMPTION_TOTAL = "subscription.redemption.total";
  private static final String METRIC_REDEMPTION_ATTEMPTS = "subscription.redemption.attempts";
  private static final String METRIC_BOOKKEEPING_FAILURES =
      "subscription.redemption.bookkeeping.failures";
  private static final String METRIC_BATCH_DURATION = "subscription.batch.duration";
  private static final String METRIC_CIRCUIT_OPEN = "subscription.redemption.circuit.open";
  private static final String METRIC_SCHEDULED_CHANGE_TOTAL = "subscription.scheduled_change.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger circuitOpen = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> redemptionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> scheduledChangeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> batchTimers = new ConcurrentHashMap<>();
  private final Counter bookkeepingFailures;

  public SubscriptionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CIRCUIT_OPEN, circuitOpen, AtomicInteger::get)
        .description("1 while the delegation circuit breaker is open")
        .register(meterRegistry);
    this.bookkeepingFailures =
        Counter.builder(METRIC_BOOKKEEPING_FAILURES)
            .description("Redemptions that succeeded on-chain but failed to update the subscription")
            .register(meterRegistry);
  }

  public void recordRedemption(String result) {
    redemptionCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_REDEMPTION_TOTAL)
                    .description("Subscription redemption outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAttempt(String outcome) {
    attemptCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_REDEMPTION_ATTEMPTS)
                    .description("Delegation executor invocations")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordScheduledChange(String result) {
    scheduledChangeCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_SCHEDULED_CHANGE_TOTAL)
                    .description("Scheduled cancellations and resumptions applied")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordBookkeepingFailure() {
    bookkeepingFailures.increment();
  }

  public void recordBatch(String mode, Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    batchTimers
        .computeIfAbsent(
            mode,
            ignored ->
                Timer.builder(METRIC_BATCH_DURATION)
                    .description("Wall time of a redemption batch")
                    .tags(Tags.of("mode", mode))
                    .register(meterRegistry))
        .record(duration);
  }

  public void updateCircuitOpen(boolean open) {
    circuitOpen.set(open ? 1 : 0);
  }
}
