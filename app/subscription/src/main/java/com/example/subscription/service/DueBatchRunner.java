/*
 * どこで: Subscription サービス層
 * 何を: 期日到来サブスクリプションを順に処理し、結果を集計する
 * なぜ: 定期バッチ (共有トランザクション) と手動の ID 指定請求 (1 件ずつコミット) を同じ手順で扱うため
 */
package com.example.subscription.service;

import com.example.common.CorrelationIds;
import com.example.subscription.model.RedemptionContext;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.repository.SubscriptionStore;
import com.example.subscription.repository.SubscriptionStores;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DueBatchRunner {

  private static final Logger logger = LoggerFactory.getLogger(DueBatchRunner.class);
  private static final String MDC_BATCH_ID = "batch_id";
  private static final String MDC_SUBSCRIPTION_ID = "subscription_id";

  private final SubscriptionStores stores;
  private final RedemptionContextLoader contextLoader;
  private final SubscriptionProcessor processor;
  private final SubscriptionMetrics metrics;

  /**
   * 役割: 期日到来分を 1 つのトランザクションで処理する。
   * 動作: 個別の請求失敗はイベントとカウンタに変換して続行し、DB 障害やキャンセルではバッチ全体をロールバックする。
   */
  public RedemptionResult processDue(Instant now) {
    final List<SubscriptionRecord> due = stores.direct().listDueForRedemption(now);
    if (due.isEmpty()) {
      logger.debug("no subscriptions due for redemption now={}", now);
      return RedemptionResult.empty();
    }
    final long startedAt = System.nanoTime();
    MDC.put(MDC_BATCH_ID, CorrelationIds.newBatchId());
    try {
      logger.info("due redemption batch started count={} now={}", due.size(), now);
      // 外部呼び出しを含めてバッチ全体を 1 トランザクションに載せ、コミットは最後の 1 回のみ
      final RedemptionResult result = stores.inTransaction(store -> processAll(store, due, now));
      logResult("due redemption batch committed", result);
      return result;
    } catch (RuntimeException ex) {
      logger.error("due redemption batch rolled back count={}", due.size(), ex);
      throw ex;
    } finally {
      metrics.recordBatch("transactional", Duration.ofNanos(System.nanoTime() - startedAt));
      MDC.remove(MDC_BATCH_ID);
    }
  }

  /** 現在の期日到来分を、トランザクションを共有せずに 1 件ずつ請求する。 */
  public RedemptionResult redeemDue(Instant now) {
    final List<UUID> ids =
        stores.direct().listDueForRedemption(now).stream().map(SubscriptionRecord::id).toList();
    return redeemDue(ids, now);
  }

  /**
   * 役割: 指定 ID のサブスクリプションを 1 件ずつ請求する。
   * 動作: 各サブスクリプションの更新は個別にコミットされ、途中で中断しても確定済みの請求は取り消さない。
   */
  public RedemptionResult redeemDue(List<UUID> subscriptionIds, Instant now) {
    if (subscriptionIds.isEmpty()) {
      return RedemptionResult.empty();
    }
    final SubscriptionStore store = stores.direct();
    final RedemptionTally tally = new RedemptionTally(subscriptionIds.size());
    final long startedAt = System.nanoTime();
    MDC.put(MDC_BATCH_ID, CorrelationIds.newBatchId());
    try {
      logger.info("manual redemption started count={} now={}", subscriptionIds.size(), now);
      for (UUID subscriptionId : subscriptionIds) {
        ensureNotCancelled();
        MDC.put(MDC_SUBSCRIPTION_ID, subscriptionId.toString());
        try {
          final Optional<SubscriptionRecord> subscription = store.findSubscription(subscriptionId);
          if (subscription.isEmpty()) {
            logger.warn("subscription not found for manual redemption id={}", subscriptionId);
            tally.record(ProcessOutcome.UNRESOLVED);
            continue;
          }
          tally.record(processOne(store, subscription.get(), now).outcome());
        } catch (DataAccessException ex) {
          // 1 件分の作業単位だけを打ち切り、他のサブスクリプションは続行する
          logger.error("manual redemption aborted for subscription id={}", subscriptionId, ex);
          tally.record(ProcessOutcome.UNRESOLVED);
        } finally {
          MDC.remove(MDC_SUBSCRIPTION_ID);
        }
      }
      final RedemptionResult result = tally.toResult();
      logResult("manual redemption finished", result);
      return result;
    } finally {
      metrics.recordBatch("direct", Duration.ofNanos(System.nanoTime() - startedAt));
      MDC.remove(MDC_BATCH_ID);
    }
  }

  /** 単発の手動請求。1 件分を 1 トランザクションで処理する。 */
  public ProcessResult redeemOne(UUID subscriptionId, Instant now) {
    MDC.put(MDC_SUBSCRIPTION_ID, subscriptionId.toString());
    try {
      return stores.inTransaction(
          store -> {
            final SubscriptionRecord subscription =
                store
                    .findSubscription(subscriptionId)
                    .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
            return processOne(store, subscription, now);
          });
    } finally {
      MDC.remove(MDC_SUBSCRIPTION_ID);
    }
  }

  private RedemptionResult processAll(
      SubscriptionStore store, List<SubscriptionRecord> due, Instant now) {
    final RedemptionTally tally = new RedemptionTally(due.size());
    for (SubscriptionRecord subscription : due) {
      ensureNotCancelled();
      MDC.put(MDC_SUBSCRIPTION_ID, subscription.id().toString());
      try {
        tally.record(processOne(store, subscription, now).outcome());
      } finally {
        MDC.remove(MDC_SUBSCRIPTION_ID);
      }
    }
    return tally.toResult();
  }

  private ProcessResult processOne(
      SubscriptionStore store, SubscriptionRecord subscription, Instant now) {
    final RedemptionContext context;
    try {
      context = contextLoader.load(store, subscription);
    } catch (RedemptionContextException ex) {
      logger.error("redemption context unresolved id={}", subscription.id(), ex);
      metrics.recordRedemption(ProcessOutcome.UNRESOLVED.metricValue());
      return ProcessResult.skipped(ProcessOutcome.UNRESOLVED, subscription);
    }
    return processor.process(store, context, now);
  }

  private void ensureNotCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new RedemptionCancelledException("redemption batch cancelled");
    }
  }

  private void logResult(String message, RedemptionResult result) {
    logger.info(
        "{} total={} succeeded={} failed={} completed={}",
        message,
        result.total(),
        result.succeeded(),
        result.failed(),
        result.completed());
  }
}
