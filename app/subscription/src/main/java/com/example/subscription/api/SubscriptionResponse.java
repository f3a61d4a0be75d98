package com.example.subscription.api;

import com.example.subscription.model.SubscriptionRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionResponse(
    UUID subscriptionId,
    UUID customerId,
    UUID productId,
    UUID priceId,
    String status,
    long tokenAmount,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    Instant nextRedemptionDate,
    int totalRedemptions,
    long totalAmountInCents,
    Integer totalTermLength,
    Instant updatedAt) {

  public static SubscriptionResponse from(SubscriptionRecord record) {
    return new SubscriptionResponse(
        record.id(),
        record.customerId(),
        record.productId(),
        record.priceId(),
        record.status().value(),
        record.tokenAmount(),
        record.currentPeriodStart(),
        record.currentPeriodEnd(),
        record.nextRedemptionDate(),
        record.totalRedemptions(),
        record.totalAmountInCents(),
        record.totalTermLength(),
        record.updatedAt());
  }
}
