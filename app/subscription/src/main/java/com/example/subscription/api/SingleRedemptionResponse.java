/*
 * どこで: Subscription API
 * 何を: 単一サブスクリプション請求の結果を返す
 * なぜ: 見送り/成功/失敗をクライアントが分岐できるようにするため
 */
package com.example.subscription.api;

import com.example.subscription.service.ProcessResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SingleRedemptionResponse(
    UUID subscriptionId,
    String outcome,
    String status,
    Instant nextRedemptionDate,
    String transactionHash,
    String errorMessage) {

  public static SingleRedemptionResponse from(UUID subscriptionId, ProcessResult result) {
    final var subscription = result.subscription();
    return new SingleRedemptionResponse(
        subscriptionId,
        result.outcome().metricValue(),
        subscription == null ? null : subscription.status().value(),
        subscription == null ? null : subscription.nextRedemptionDate(),
        result.transactionHash(),
        result.errorMessage());
  }
}
