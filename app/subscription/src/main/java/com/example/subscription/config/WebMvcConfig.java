/*
 * どこで: Subscription Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: 手動請求/バッチ起動のログへ request_id と subscription_id を埋め込むため
 */
package com.example.subscription.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/subscriptions/**");
  }
}
