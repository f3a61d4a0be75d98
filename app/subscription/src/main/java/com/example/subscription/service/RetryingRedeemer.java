/*
 * どこで: Subscription サービス層
 * 何を: デリゲーション実行を指数バックオフ付きで最大 N 回試行する
 * なぜ: 一時障害 (ノンス衝突やネットワーク断) を吸収しつつ、恒久エラーでは即座に諦めるため
 */
package com.example.subscription.service;

import com.example.subscription.config.SubscriptionRedemptionProperties;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetryingRedeemer {

  private static final Logger logger = LoggerFactory.getLogger(RetryingRedeemer.class);

  private final DelegationExecutor executor;
  private final CircuitBreaker circuitBreaker;
  private final SubscriptionRedemptionProperties properties;
  private final SubscriptionMetrics metrics;
  private final BackoffSleeper sleeper;

  public RedemptionOutcome redeem(byte[] delegationPayload, ExecutionParams params) {
    if (!circuitBreaker.tryAcquirePermission()) {
      logger.warn("delegation circuit open; redemption deferred network={}", params.networkName());
      return RedemptionOutcome.failure(
          new DelegationRedemptionException(
              RedemptionFailureReason.CIRCUIT_OPEN, "delegation executor circuit is open"),
          0);
    }
    final long startedAt = System.nanoTime();
    final int maxAttempts = properties.maxAttempts();
    DelegationRedemptionException lastFailure = null;
    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      if (attempt > 0) {
        final Duration backoff = computeBackoffDuration(attempt);
        logger.info(
            "delegation redemption retry scheduled attempt={} backoffMs={}",
            attempt + 1,
            backoff.toMillis());
        pause(backoff);
      }
      try {
        final String transactionHash = executor.redeem(delegationPayload, params);
        metrics.recordAttempt("success");
        circuitBreaker.onSuccess(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS);
        return RedemptionOutcome.success(transactionHash, attempt + 1);
      } catch (DelegationRedemptionException ex) {
        lastFailure = ex;
      } catch (RuntimeException ex) {
        // 分類されていない例外は一時障害として扱いリトライ枠を消費する
        lastFailure =
            new DelegationRedemptionException(
                RedemptionFailureReason.TRANSIENT, String.valueOf(ex.getMessage()), ex);
      }
      if (lastFailure.isPermanent()) {
        // 恒久エラーは顧客側の問題なので実行サービスの失敗には数えない
        circuitBreaker.releasePermission();
        metrics.recordAttempt("permanent");
        logger.warn(
            "delegation redemption failed permanently attempt={} reason={}",
            attempt + 1,
            lastFailure.reason(),
            lastFailure);
        return RedemptionOutcome.failure(lastFailure, attempt + 1);
      }
      metrics.recordAttempt("transient");
      logger.warn(
          "delegation redemption attempt failed attempt={} maxAttempts={} reason={}",
          attempt + 1,
          maxAttempts,
          lastFailure.reason(),
          lastFailure);
    }
    // リトライを使い切った一時障害のみをブレーカーへ記録する
    circuitBreaker.onError(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS, lastFailure);
    logger.warn("delegation redemption retries exhausted attempts={}", maxAttempts);
    return RedemptionOutcome.failure(lastFailure, maxAttempts);
  }

  /** attempt は 1 始まりのリトライ番号。attempt=1 が 2 回目の試行前の待機。 */
  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double maxMillis = properties.backoffMax().toMillis();
    final double capped = Math.min(exp, maxMillis);
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    // ジッター後も上限は超えない
    final long backoffMillis = (long) Math.min(Math.ceil(capped * jitter), maxMillis);
    return Duration.ofMillis(backoffMillis);
  }

  private void pause(Duration backoff) {
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      circuitBreaker.releasePermission();
      throw new RedemptionCancelledException("redemption interrupted during backoff", ex);
    }
  }
}
