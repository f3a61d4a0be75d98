/*
 * どこで: Subscription アプリの設定バインド
 * 何を: 請求リトライ/バックオフ/最終回失敗時の方針/サーキットブレーカー設定を保持する
 * なぜ: 運用パラメータを外部化し、テストで短い値へ差し替えられるようにするため
 */
package com.example.subscription.config;

import com.example.subscription.model.FinalPaymentFailureStatus;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "subscription.redemption")
public record SubscriptionRedemptionProperties(
    int maxAttempts,
    Duration backoffBase,
    double backoffExponentBase,
    Duration backoffMax,
    double backoffJitterMin,
    double backoffJitterMax,
    FinalPaymentFailureStatus finalPaymentFailureStatus,
    int errorMessageMaxLength,
    CircuitBreaker circuitBreaker) {

  public SubscriptionRedemptionProperties {
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofSeconds(1) : backoffBase;
    backoffExponentBase = backoffExponentBase <= 0 ? 2.0d : backoffExponentBase;
    backoffMax = backoffMax == null ? Duration.ofSeconds(10) : backoffMax;
    // ±20% のジッターを既定値とする
    backoffJitterMin = backoffJitterMin <= 0 ? 0.8d : backoffJitterMin;
    backoffJitterMax = backoffJitterMax <= 0 ? 1.2d : backoffJitterMax;
    finalPaymentFailureStatus =
        finalPaymentFailureStatus == null
            ? FinalPaymentFailureStatus.OVERDUE
            : finalPaymentFailureStatus;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    circuitBreaker = circuitBreaker == null ? new CircuitBreaker(true, 3, null) : circuitBreaker;
  }

  public record CircuitBreaker(boolean enabled, int failureThreshold, Duration resetTimeout) {

    public CircuitBreaker {
      failureThreshold = failureThreshold <= 0 ? 3 : failureThreshold;
      resetTimeout = resetTimeout == null ? Duration.ofMinutes(5) : resetTimeout;
    }
  }
}
