/*
 * どこで: Subscription サービス層
 * 何を: 1 件のサブスクリプションに対し冪等チェック → 請求 → 状態遷移とイベント記録を行う
 * なぜ: リトライや重複バッチが走っても 1 請求期間につき 1 回だけ状態を進めるため
 */
package com.example.subscription.service;

import com.example.subscription.config.SubscriptionRedemptionProperties;
import com.example.subscription.model.NewSubscriptionEvent;
import com.example.subscription.model.PriceRecord;
import com.example.subscription.model.RedemptionContext;
import com.example.subscription.model.SubscriptionEventType;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.model.SubscriptionStatus;
import com.example.subscription.repository.SubscriptionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionProcessor {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionProcessor.class);

  private final RetryingRedeemer redeemer;
  private final SubscriptionRedemptionProperties properties;
  private final SubscriptionMetrics metrics;
  private final ObjectMapper objectMapper;

  /**
   * 役割: 期日スキャン時点のスナップショットと解決済み参照データから 1 件を処理する。
   * 動作: 必ず store から再取得して冪等チェックを行い、通過した場合のみ請求する。
   * 前提: store は呼び出し側が選んだ直接更新用またはトランザクション束縛用のもの。
   */
  public ProcessResult process(SubscriptionStore store, RedemptionContext context, Instant now) {
    final UUID subscriptionId = context.subscription().id();
    final Optional<SubscriptionRecord> refetched = store.findSubscription(subscriptionId);
    if (refetched.isEmpty()) {
      logger.warn("subscription disappeared before redemption id={}", subscriptionId);
      return record(ProcessResult.skipped(ProcessOutcome.UNRESOLVED, context.subscription()));
    }
    final SubscriptionRecord current = refetched.get();
    final Optional<ProcessOutcome> skipped = checkIdempotency(current, now);
    if (skipped.isPresent()) {
      return record(ProcessResult.skipped(skipped.get(), current));
    }

    final boolean finalPayment = current.isFinalPayment(context.price(), now);
    final RedemptionOutcome outcome = redeemDelegation(context, current);
    if (outcome.deferred()) {
      // 実行サービス停止中は状態もイベントも触らず、次回スキャンで再度拾わせる
      logger.warn("subscription redemption deferred by open circuit id={}", subscriptionId);
      return record(
          new ProcessResult(
              ProcessOutcome.DEFERRED, current, null, outcome.failure().getMessage()));
    }
    if (outcome.succeeded()) {
      return record(applySuccess(store, context.price(), current, outcome, finalPayment, now));
    }
    return record(applyFailure(store, context.price(), current, outcome, finalPayment, now));
  }

  private Optional<ProcessOutcome> checkIdempotency(SubscriptionRecord current, Instant now) {
    if (current.status() == SubscriptionStatus.COMPLETED) {
      logger.info("subscription already completed; skipped id={}", current.id());
      return Optional.of(ProcessOutcome.ALREADY_COMPLETED);
    }
    if (current.status() == SubscriptionStatus.FAILED) {
      logger.info("subscription already failed; skipped id={}", current.id());
      return Optional.of(ProcessOutcome.ALREADY_FAILED);
    }
    if (current.nextRedemptionDate() != null && current.nextRedemptionDate().isAfter(now)) {
      // 並行/再実行されたバッチが既に次回請求日を進めている
      logger.info(
          "subscription already advanced; skipped id={} nextRedemptionDate={}",
          current.id(),
          current.nextRedemptionDate());
      return Optional.of(ProcessOutcome.ALREADY_ADVANCED);
    }
    if (!current.status().isRedeemable()) {
      logger.info(
          "subscription not redeemable; skipped id={} status={}",
          current.id(),
          current.status().value());
      return Optional.of(ProcessOutcome.NOT_REDEEMABLE);
    }
    return Optional.empty();
  }

  private RedemptionOutcome redeemDelegation(
      RedemptionContext context, SubscriptionRecord current) {
    final byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(context.delegation());
    } catch (JsonProcessingException ex) {
      return RedemptionOutcome.failure(
          new DelegationRedemptionException(
              RedemptionFailureReason.INVALID_DELEGATION_FORMAT,
              "delegation payload could not be serialized",
              ex),
          0);
    }
    final ExecutionParams params =
        new ExecutionParams(
            context.merchantWallet().walletAddress(),
            context.token().contractAddress(),
            context.token().decimals(),
            current.tokenAmount(),
            context.network().chainId(),
            context.network().name());
    return redeemer.redeem(payload, params);
  }

  private ProcessResult applySuccess(
      SubscriptionStore store,
      PriceRecord price,
      SubscriptionRecord current,
      RedemptionOutcome outcome,
      boolean finalPayment,
      Instant now) {
    final UUID subscriptionId = current.id();
    final String transactionHash = outcome.transactionHash();
    final long amountInCents = price.unitAmountInPennies();
    // 最終回は次回請求日を持たない
    final Instant nextRedemptionDate =
        finalPayment ? null : PeriodCalculator.nextRedemption(price.intervalType(), now);
    final SubscriptionRecord updated;
    try {
      updated =
          store.runIsolated(
              () -> {
                final SubscriptionRecord incremented =
                    store.incrementRedemption(subscriptionId, amountInCents, nextRedemptionDate);
                return finalPayment
                    ? store.updateStatus(subscriptionId, SubscriptionStatus.COMPLETED)
                    : incremented;
              });
    } catch (DataAccessException ex) {
      return recordBookkeepingFailure(store, current, amountInCents, transactionHash, ex, now);
    }

    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(
        "next_redemption", nextRedemptionDate == null ? null : nextRedemptionDate.toString());
    metadata.put("is_final", finalPayment);
    metadata.put("attempts", outcome.attempts());
    final SubscriptionEventType eventType =
        finalPayment ? SubscriptionEventType.COMPLETED : SubscriptionEventType.REDEEMED;
    store.createSubscriptionEvent(
        NewSubscriptionEvent.success(
            subscriptionId, eventType, transactionHash, amountInCents, now, toJson(metadata)));
    logger.info(
        "subscription redeemed id={} txHash={} final={} totalRedemptions={} nextRedemptionDate={}",
        subscriptionId,
        transactionHash,
        finalPayment,
        updated.totalRedemptions(),
        nextRedemptionDate);
    return new ProcessResult(
        finalPayment ? ProcessOutcome.COMPLETED : ProcessOutcome.REDEEMED,
        updated,
        transactionHash,
        null);
  }

  private ProcessResult recordBookkeepingFailure(
      SubscriptionStore store,
      SubscriptionRecord current,
      long amountInCents,
      String transactionHash,
      DataAccessException ex,
      Instant now) {
    // 資金は移動済みなので握りつぶさず、照合用のイベントを残す
    metrics.recordBookkeepingFailure();
    logger.error(
        "delegation redeemed but subscription update failed; reconciliation required id={} txHash={}",
        current.id(),
        transactionHash,
        ex);
    final String message =
        truncateError(
            String.format(
                "Redemption succeeded on-chain (tx %s) but updating subscription %s failed: %s",
                transactionHash,
                current.id(),
                ex.getMessage()));
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("transaction_hash", transactionHash);
    metadata.put("reason", "bookkeeping");
    store.createFailedRedemptionEvent(
        current.id(), amountInCents, message, toJson(metadata), now);
    return new ProcessResult(ProcessOutcome.BOOKKEEPING_FAILED, current, transactionHash, message);
  }

  private ProcessResult applyFailure(
      SubscriptionStore store,
      PriceRecord price,
      SubscriptionRecord current,
      RedemptionOutcome outcome,
      boolean finalPayment,
      Instant now) {
    final DelegationRedemptionException failure = outcome.failure();
    SubscriptionRecord after = current;
    if (finalPayment) {
      final SubscriptionStatus target = properties.finalPaymentFailureStatus().targetStatus();
      after = store.updateStatus(current.id(), target);
      logger.warn(
          "final payment failed; subscription moved id={} status={}", current.id(), target.value());
    }
    final String message =
        truncateError(
            String.format(
                "Failed to redeem delegation for subscription %s: %s",
                current.id(),
                failure.getMessage()));
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("reason", failure.reason().name());
    metadata.put("attempts", outcome.attempts());
    metadata.put("is_final", finalPayment);
    store.createFailedRedemptionEvent(
        current.id(), price.unitAmountInPennies(), message, toJson(metadata), now);
    logger.warn(
        "subscription redemption failed id={} reason={} attempts={}",
        current.id(),
        failure.reason(),
        outcome.attempts());
    return new ProcessResult(ProcessOutcome.FAILED, after, null, message);
  }

  private ProcessResult record(ProcessResult result) {
    metrics.recordRedemption(result.outcome().metricValue());
    return result;
  }

  private String toJson(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("event metadata serialization failed", ex);
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
