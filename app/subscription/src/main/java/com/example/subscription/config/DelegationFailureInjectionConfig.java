/*
 * どこで: Subscription 設定
 * 何を: ci/test プロファイルで有効な DelegationExecutor を失敗注入デコレータで包む
 * なぜ: http/local どちらのモードでも同じ注入設定で失敗シナリオを再現するため
 */
package com.example.subscription.config;

import com.example.subscription.client.FailureInjectingDelegationExecutor;
import com.example.subscription.client.HttpDelegationExecutor;
import com.example.subscription.client.LocalDelegationExecutor;
import com.example.subscription.service.DelegationExecutor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "subscription.delegation.failure-injection",
    name = "enabled",
    havingValue = "true")
public class DelegationFailureInjectionConfig {

  @Bean
  @Primary
  DelegationExecutor failureInjectingDelegationExecutor(
      ObjectProvider<HttpDelegationExecutor> httpExecutor,
      ObjectProvider<LocalDelegationExecutor> localExecutor,
      DelegationFailureInjectionProperties properties) {
    return new FailureInjectingDelegationExecutor(
        activeExecutor(httpExecutor, localExecutor), properties);
  }

  /** subscription.delegation.mode で有効になっている方を返す。 */
  static DelegationExecutor activeExecutor(
      ObjectProvider<HttpDelegationExecutor> httpExecutor,
      ObjectProvider<LocalDelegationExecutor> localExecutor) {
    final HttpDelegationExecutor http = httpExecutor.getIfAvailable();
    if (http != null) {
      return http;
    }
    final LocalDelegationExecutor local = localExecutor.getIfAvailable();
    if (local != null) {
      return local;
    }
    throw new IllegalStateException(
        "no delegation executor to wrap for failure injection; check subscription.delegation.mode");
  }
}
