/*
 * どこで: Subscription リトライ層のユニットテスト
 * 何を: 試行回数・バックオフ間隔・恒久エラー時の打ち切りを検証する
 * なぜ: 一時障害の吸収と無駄なリトライの抑止を両立させるため
 */
package com.example.subscription.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.subscription.config.SubscriptionRedemptionProperties;
import com.example.subscription.model.FinalPaymentFailureStatus;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetryingRedeemerTest {

  private static final byte[] PAYLOAD = "{\"delegate\":\"0x1\"}".getBytes();
  private static final ExecutionParams PARAMS =
      new ExecutionParams(
          RedemptionFixtures.MERCHANT_ADDRESS,
          RedemptionFixtures.TOKEN_ADDRESS,
          6,
          1_000_000L,
          11155111L,
          "sepolia");

  @Mock private DelegationExecutor executor;

  private final List<Duration> waits = new ArrayList<>();
  private final SubscriptionRedemptionProperties properties =
      RedemptionFixtures.properties(FinalPaymentFailureStatus.OVERDUE);
  private SimpleMeterRegistry registry;
  private CircuitBreaker circuitBreaker;
  private RetryingRedeemer redeemer;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    final SubscriptionMetrics metrics = new SubscriptionMetrics(registry);
    circuitBreaker = RedemptionFixtures.circuitBreaker(properties, metrics);
    redeemer = new RetryingRedeemer(executor, circuitBreaker, properties, metrics, waits::add);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void returnsTransactionHashOnFirstSuccess() {
    when(executor.redeem(any(), any())).thenReturn("0xhash");

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.succeeded()).isTrue();
    assertThat(outcome.transactionHash()).isEqualTo("0xhash");
    assertThat(outcome.attempts()).isEqualTo(1);
    assertThat(waits).isEmpty();
  }

  @Test
  void transientFailuresAreRetriedWithExponentialBackoff() {
    when(executor.redeem(any(), any()))
        .thenThrow(
            new DelegationRedemptionException(RedemptionFailureReason.TIMEOUT, "timeout"));

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.succeeded()).isFalse();
    assertThat(outcome.attempts()).isEqualTo(3);
    assertThat(outcome.failure().reason()).isEqualTo(RedemptionFailureReason.TIMEOUT);
    verify(executor, times(3)).redeem(any(), any());
    // 1 秒 → 2 秒を基準に ±20% のジッター
    assertThat(waits).hasSize(2);
    assertThat(waits.get(0)).isBetween(Duration.ofMillis(800), Duration.ofMillis(1200));
    assertThat(waits.get(1)).isBetween(Duration.ofMillis(1600), Duration.ofMillis(2400));
    assertThat(
            registry
                .get("subscription.redemption.attempts")
                .tag("outcome", "transient")
                .counter()
                .count())
        .isEqualTo(3.0d);
  }

  @Test
  void succeedsAfterTransientFailure() {
    when(executor.redeem(any(), any()))
        .thenThrow(
            new DelegationRedemptionException(
                RedemptionFailureReason.NONCE_COLLISION, "nonce too low"))
        .thenReturn("0xhash");

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.succeeded()).isTrue();
    assertThat(outcome.attempts()).isEqualTo(2);
    assertThat(waits).hasSize(1);
  }

  @Test
  void permanentFailureStopsImmediately() {
    when(executor.redeem(any(), any()))
        .thenThrow(
            new DelegationRedemptionException(
                RedemptionFailureReason.INVALID_SIGNATURE, "invalid signature"));

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.attempts()).isEqualTo(1);
    assertThat(outcome.failure().isPermanent()).isTrue();
    verify(executor, times(1)).redeem(any(), any());
    assertThat(waits).isEmpty();
    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
  }

  @Test
  void unclassifiedExceptionIsTreatedAsTransient() {
    when(executor.redeem(any(), any())).thenThrow(new IllegalStateException("socket closed"));

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.failure().reason()).isEqualTo(RedemptionFailureReason.TRANSIENT);
    verify(executor, times(3)).redeem(any(), any());
  }

  @Test
  void exhaustedRetriesOpenCircuitAfterThreshold() {
    when(executor.redeem(any(), any()))
        .thenThrow(
            new DelegationRedemptionException(RedemptionFailureReason.TRANSIENT, "unavailable"));

    redeemer.redeem(PAYLOAD, PARAMS);
    redeemer.redeem(PAYLOAD, PARAMS);
    redeemer.redeem(PAYLOAD, PARAMS);
    final RedemptionOutcome deferred = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    assertThat(deferred.deferred()).isTrue();
    assertThat(deferred.attempts()).isZero();
    verify(executor, times(9)).redeem(any(), any());
  }

  @Test
  void interruptDuringBackoffCancelsRedemption() {
    when(executor.redeem(any(), any()))
        .thenThrow(
            new DelegationRedemptionException(RedemptionFailureReason.TIMEOUT, "timeout"));
    final RetryingRedeemer interrupted =
        new RetryingRedeemer(
            executor,
            circuitBreaker,
            properties,
            new SubscriptionMetrics(registry),
            duration -> {
              throw new InterruptedException("shutdown");
            });

    assertThatThrownBy(() -> interrupted.redeem(PAYLOAD, PARAMS))
        .isInstanceOf(RedemptionCancelledException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
    verify(executor, times(1)).redeem(any(), any());
  }

  @Test
  void computeBackoffDurationIsCappedAfterJitter() {
    for (int attempt = 1; attempt <= 10; attempt++) {
      assertThat(redeemer.computeBackoffDuration(attempt))
          .isLessThanOrEqualTo(properties.backoffMax());
    }
    assertThat(redeemer.computeBackoffDuration(8))
        .isBetween(Duration.ofMillis(8000), Duration.ofSeconds(10));
  }

  @Test
  void openCircuitSkipsExecutor() {
    RedemptionFixtures.recordExhaustedFailures(circuitBreaker, 3);

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.deferred()).isTrue();
    verify(executor, never()).redeem(any(), any());
  }

  @Test
  void permanentFailureInHalfOpenReleasesTrialPermission() {
    circuitBreaker.transitionToOpenState();
    circuitBreaker.transitionToHalfOpenState();
    when(executor.redeem(any(), any()))
        .thenThrow(
            new DelegationRedemptionException(
                RedemptionFailureReason.INVALID_SIGNATURE, "invalid signature"))
        .thenReturn("0xhash");

    redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

    final RedemptionOutcome outcome = redeemer.redeem(PAYLOAD, PARAMS);

    assertThat(outcome.succeeded()).isTrue();
    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
  }
}
