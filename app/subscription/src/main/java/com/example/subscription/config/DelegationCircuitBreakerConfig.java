/*
 * どこで: Subscription 設定
 * 何を: デリゲーション実行サービス用の Resilience4j サーキットブレーカーを構築する
 * なぜ: 実行サービス停止中にバッチ全件がリトライ待機で詰まるのを避けるため
 */
package com.example.subscription.config;

import com.example.subscription.service.SubscriptionMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DelegationCircuitBreakerConfig {

  public static final String DELEGATION_CIRCUIT_BREAKER = "delegationExecutor";

  private static final Logger logger =
      LoggerFactory.getLogger(DelegationCircuitBreakerConfig.class);

  @Bean
  CircuitBreakerRegistry circuitBreakerRegistry() {
    return CircuitBreakerRegistry.ofDefaults();
  }

  @Bean
  CircuitBreaker delegationCircuitBreaker(
      CircuitBreakerRegistry circuitBreakerRegistry,
      SubscriptionRedemptionProperties properties,
      SubscriptionMetrics metrics) {
    return createDelegationCircuitBreaker(
        circuitBreakerRegistry, properties.circuitBreaker(), metrics);
  }

  /**
   * 役割: 連続 failure-threshold 回の失敗で open になるブレーカーを登録する。
   * 動作: 直近 failure-threshold 件が全て失敗のときだけ open。reset-timeout 経過後の 1 件で
   * closed へ戻るか再度 open になるかを決める。
   */
  public static CircuitBreaker createDelegationCircuitBreaker(
      CircuitBreakerRegistry circuitBreakerRegistry,
      SubscriptionRedemptionProperties.CircuitBreaker settings,
      SubscriptionMetrics metrics) {
    final CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(settings.failureThreshold())
            .minimumNumberOfCalls(settings.failureThreshold())
            .failureRateThreshold(100.0f)
            // オンチェーン確定待ちで長くなるため遅延は判定に使わない
            .slowCallRateThreshold(100.0f)
            .slowCallDurationThreshold(Duration.ofDays(1))
            .permittedNumberOfCallsInHalfOpenState(1)
            .waitDurationInOpenState(settings.resetTimeout())
            .build();
    final CircuitBreaker circuitBreaker =
        circuitBreakerRegistry.circuitBreaker(DELEGATION_CIRCUIT_BREAKER, config);
    circuitBreaker
        .getEventPublisher()
        .onStateTransition(
            event -> {
              final CircuitBreaker.State toState = event.getStateTransition().getToState();
              metrics.updateCircuitOpen(toState == CircuitBreaker.State.OPEN);
              logger.warn(
                  "delegation circuit transition name={} transition={} resetTimeout={}",
                  event.getCircuitBreakerName(),
                  event.getStateTransition(),
                  settings.resetTimeout());
            });
    if (!settings.enabled()) {
      circuitBreaker.transitionToDisabledState();
    }
    return circuitBreaker;
  }
}
