/*
 * どこで: Subscription 設定のユニットテスト
 * 何を: デリゲーション用サーキットブレーカーの開閉とゲージ連動を検証する
 * なぜ: 実行サービス障害時に請求を止め、復旧後に自動で再開できることを保証するため
 */
package com.example.subscription.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.subscription.service.DelegationRedemptionException;
import com.example.subscription.service.RedemptionFailureReason;
import com.example.subscription.service.SubscriptionMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DelegationCircuitBreakerConfigTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final SubscriptionMetrics metrics = new SubscriptionMetrics(registry);

  @Test
  void buildsCountBasedBreakerFromSettings() {
    final CircuitBreaker circuitBreaker = create(true, 3, Duration.ofMinutes(5));
    final CircuitBreakerConfig config = circuitBreaker.getCircuitBreakerConfig();

    assertThat(circuitBreaker.getName())
        .isEqualTo(DelegationCircuitBreakerConfig.DELEGATION_CIRCUIT_BREAKER);
    assertThat(config.getSlidingWindowType())
        .isEqualTo(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED);
    assertThat(config.getSlidingWindowSize()).isEqualTo(3);
    assertThat(config.getMinimumNumberOfCalls()).isEqualTo(3);
    assertThat(config.getWaitIntervalFunctionInOpenState().apply(1)).isEqualTo(300_000L);
  }

  @Test
  void opensAfterConsecutiveFailuresAndReportsGauge() {
    final CircuitBreaker circuitBreaker = create(true, 3, Duration.ofMinutes(5));

    recordFailure(circuitBreaker);
    recordFailure(circuitBreaker);
    assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
    circuitBreaker.releasePermission();

    recordFailure(circuitBreaker);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
    assertThat(registry.get("subscription.redemption.circuit.open").gauge().value())
        .isEqualTo(1.0d);
  }

  @Test
  void successInWindowKeepsBreakerClosed() {
    final CircuitBreaker circuitBreaker = create(true, 3, Duration.ofMinutes(5));

    recordFailure(circuitBreaker);
    recordFailure(circuitBreaker);
    circuitBreaker.onSuccess(0L, TimeUnit.MILLISECONDS);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
  }

  @Test
  void halfOpenAfterResetTimeoutAndReopensOnNextFailure() throws InterruptedException {
    final CircuitBreaker circuitBreaker = create(true, 3, Duration.ofMillis(50));
    openCircuit(circuitBreaker);
    Thread.sleep(120);

    assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    assertThat(registry.get("subscription.redemption.circuit.open").gauge().value()).isZero();

    recordFailure(circuitBreaker);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
  }

  @Test
  void halfOpenClosesOnSuccess() throws InterruptedException {
    final CircuitBreaker circuitBreaker = create(true, 3, Duration.ofMillis(50));
    openCircuit(circuitBreaker);
    Thread.sleep(120);
    assertThat(circuitBreaker.tryAcquirePermission()).isTrue();

    circuitBreaker.onSuccess(0L, TimeUnit.MILLISECONDS);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
  }

  @Test
  void disabledBreakerNeverOpens() {
    final CircuitBreaker circuitBreaker = create(false, 1, Duration.ofMinutes(5));

    recordFailure(circuitBreaker);
    recordFailure(circuitBreaker);

    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.DISABLED);
    assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
  }

  private CircuitBreaker create(boolean enabled, int failureThreshold, Duration resetTimeout) {
    return DelegationCircuitBreakerConfig.createDelegationCircuitBreaker(
        CircuitBreakerRegistry.ofDefaults(),
        new SubscriptionRedemptionProperties.CircuitBreaker(
            enabled, failureThreshold, resetTimeout),
        metrics);
  }

  private void openCircuit(CircuitBreaker circuitBreaker) {
    recordFailure(circuitBreaker);
    recordFailure(circuitBreaker);
    recordFailure(circuitBreaker);
    assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
  }

  private void recordFailure(CircuitBreaker circuitBreaker) {
    circuitBreaker.onError(
        0L,
        TimeUnit.MILLISECONDS,
        new DelegationRedemptionException(RedemptionFailureReason.TRANSIENT, "unavailable"));
  }
}
