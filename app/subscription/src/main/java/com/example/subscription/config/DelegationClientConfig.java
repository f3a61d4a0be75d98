/*
 * どこで: Subscription 設定
 * 何を: デリゲーション実行サービス呼び出し専用の RestClient を提供する
 * なぜ: baseUrl とタイムアウトを他の HTTP 呼び出しと分離するため
 */
package com.example.subscription.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class DelegationClientConfig {

  @Bean
  @ConditionalOnProperty(
      name = "subscription.delegation.mode",
      havingValue = "http",
      matchIfMissing = true)
  RestClient delegationRestClient(
      RestClient.Builder builder, DelegationClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
