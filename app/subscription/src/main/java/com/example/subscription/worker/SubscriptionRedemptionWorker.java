/*
 * どこで: Subscription 請求ワーカー
 * 何を: 一定間隔で予約変更の適用と期日到来分のバッチ請求を起動する
 * なぜ: 外部スケジューラなしでも請求が滞らないようにするため
 */
package com.example.subscription.worker;

import com.example.subscription.config.SubscriptionWorkerProperties;
import com.example.subscription.service.RedemptionResult;
import com.example.subscription.service.ScheduledChangesProcessor;
import com.example.subscription.service.SubscriptionMetrics;
import com.example.subscription.service.SubscriptionRedemptionService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "subscription.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SubscriptionRedemptionWorker {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionRedemptionWorker.class);

  private final ScheduledChangesProcessor scheduledChanges;
  private final SubscriptionRedemptionService redemptionService;
  private final SubscriptionMetrics metrics;
  private final SubscriptionWorkerProperties properties;
  private final Clock clock;

  public SubscriptionRedemptionWorker(
      ScheduledChangesProcessor scheduledChanges,
      SubscriptionRedemptionService redemptionService,
      SubscriptionMetrics metrics,
      SubscriptionWorkerProperties properties,
      Clock clock) {
    this.scheduledChanges = scheduledChanges;
    this.redemptionService = redemptionService;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${subscription.worker.poll-interval}")
  public void run() {
    final Instant startedAt = Instant.now(clock);
    // 期間終了で解約予約されたものを請求する前に CANCELED へ移す
    try {
      scheduledChanges.processDue(startedAt);
    } catch (RuntimeException ex) {
      logger.warn("scheduled changes run failed", ex);
      metrics.recordScheduledChange("run_error");
    }
    try {
      final RedemptionResult result = redemptionService.processDue();
      if (result.total() > 0) {
        logger.info(
            "scheduled redemption finished total={} succeeded={} failed={} completed={}",
            result.total(),
            result.succeeded(),
            result.failed(),
            result.completed());
      }
    } catch (RuntimeException ex) {
      // 次回ポーリングで同じ対象が再スキャンされるため、スケジューラは止めない
      logger.warn("scheduled redemption batch failed", ex);
      metrics.recordRedemption("batch_error");
    }
    final Duration elapsed = Duration.between(startedAt, Instant.now(clock));
    if (elapsed.compareTo(properties.pollInterval()) > 0) {
      logger.warn(
          "scheduled redemption exceeded poll interval elapsedMs={} pollIntervalMs={}",
          elapsed.toMillis(),
          properties.pollInterval().toMillis());
    }
  }
}
