/*
 * どこで: Subscription サービス層
 * 何を: 期日を迎えた解約予約と一時停止明けの再開を適用する
 * なぜ: 期間終了で解約すべきものを請求せず、停止期間が明けたものを請求対象へ戻すため
 */
package com.example.subscription.service;

import com.example.subscription.model.IntervalType;
import com.example.subscription.model.NewSubscriptionEvent;
import com.example.subscription.model.PriceRecord;
import com.example.subscription.model.ScheduledChangeRecord;
import com.example.subscription.model.SubscriptionEventType;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.repository.SubscriptionStore;
import com.example.subscription.repository.SubscriptionStores;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledChangesProcessor {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledChangesProcessor.class);

  private final SubscriptionStores stores;
  private final SubscriptionMetrics metrics;
  private final ObjectMapper objectMapper;

  /**
   * 役割: now 時点で期日を迎えた解約と再開をすべて適用する。
   * 動作: 1 件ごとに状態更新とイベント記録を同じトランザクションでコミットする。
   * DB 障害で失敗した分は failed に数えて残りを続行し、次回の実行で再度拾う。
   */
  public ScheduledChangeResult processDue(Instant now) {
    int canceled = 0;
    int resumed = 0;
    int failed = 0;
    // 解約を先に適用し、同じ実行内で再開させない
    for (ScheduledChangeRecord change : stores.direct().listDueCancellations(now)) {
      try {
        if (stores.inTransaction(store -> applyCancellation(store, change, now))) {
          canceled++;
        }
      } catch (DataAccessException ex) {
        logger.error(
            "scheduled cancellation failed id={} cancelAt={}",
            change.subscriptionId(),
            change.effectiveAt(),
            ex);
        metrics.recordScheduledChange("cancel_error");
        failed++;
      }
    }
    for (ScheduledChangeRecord change : stores.direct().listDueResumptions(now)) {
      try {
        if (stores.inTransaction(store -> applyResumption(store, change, now))) {
          resumed++;
        }
      } catch (DataAccessException ex) {
        logger.error(
            "scheduled resumption failed id={} pauseEndsAt={}",
            change.subscriptionId(),
            change.effectiveAt(),
            ex);
        metrics.recordScheduledChange("resume_error");
        failed++;
      }
    }
    final ScheduledChangeResult result = new ScheduledChangeResult(canceled, resumed, failed);
    if (result.total() > 0) {
      logger.info(
          "scheduled changes applied canceled={} resumed={} failed={} now={}",
          canceled,
          resumed,
          failed,
          now);
    }
    return result;
  }

  private boolean applyCancellation(
      SubscriptionStore store, ScheduledChangeRecord change, Instant now) {
    final Optional<SubscriptionRecord> canceled =
        store.cancelScheduled(change.subscriptionId(), now);
    if (canceled.isEmpty()) {
      logger.info("scheduled cancellation no longer applicable id={}", change.subscriptionId());
      return false;
    }
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("from_status", change.status().value());
    metadata.put("cancel_at", change.effectiveAt().toString());
    metadata.put("reason", change.cancellationReason());
    metadata.put("initiated_by", "system");
    store.createSubscriptionEvent(
        NewSubscriptionEvent.success(
            change.subscriptionId(),
            SubscriptionEventType.CANCELED,
            null,
            0L,
            now,
            toJson(metadata)));
    metrics.recordScheduledChange("canceled");
    logger.info(
        "subscription canceled as scheduled id={} fromStatus={} cancelAt={}",
        change.subscriptionId(),
        change.status().value(),
        change.effectiveAt());
    return true;
  }

  private boolean applyResumption(
      SubscriptionStore store, ScheduledChangeRecord change, Instant now) {
    final IntervalType interval = resolveInterval(store, change);
    final Instant periodEnd = PeriodCalculator.nextRedemption(interval, now);
    // 再開後の最初の期間分は次のスキャンですぐに請求する
    final Optional<SubscriptionRecord> resumed =
        store.resumeSuspended(change.subscriptionId(), now, periodEnd, now);
    if (resumed.isEmpty()) {
      logger.info("scheduled resumption no longer applicable id={}", change.subscriptionId());
      return false;
    }
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("pause_ends_at", change.effectiveAt().toString());
    metadata.put("period_start", now.toString());
    metadata.put("period_end", periodEnd.toString());
    metadata.put("initiated_by", "system");
    store.createSubscriptionEvent(
        NewSubscriptionEvent.success(
            change.subscriptionId(),
            SubscriptionEventType.RESUMED,
            null,
            0L,
            now,
            toJson(metadata)));
    metrics.recordScheduledChange("resumed");
    logger.info(
        "subscription resumed as scheduled id={} periodStart={} periodEnd={}",
        change.subscriptionId(),
        now,
        periodEnd);
    return true;
  }

  /** 価格が見つからないか単発価格の場合は月次で期間を切る。 */
  private IntervalType resolveInterval(SubscriptionStore store, ScheduledChangeRecord change) {
    if (change.priceId() == null) {
      return IntervalType.MONTHLY;
    }
    return store
        .findPrice(change.priceId())
        .filter(price -> !price.isOneTime())
        .map(PriceRecord::intervalType)
        .orElse(IntervalType.MONTHLY);
  }

  private String toJson(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("event metadata serialization failed", ex);
    }
  }
}
