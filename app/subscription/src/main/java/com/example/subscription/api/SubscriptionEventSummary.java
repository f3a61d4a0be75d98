package com.example.subscription.api;

import com.example.subscription.model.SubscriptionEventRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionEventSummary(
    UUID eventId,
    String eventType,
    String transactionHash,
    long amountInCents,
    Instant occurredAt,
    String errorMessage) {

  public static SubscriptionEventSummary from(SubscriptionEventRecord record) {
    return new SubscriptionEventSummary(
        record.id(),
        record.eventType().value(),
        record.transactionHash(),
        record.amountInCents(),
        record.occurredAt(),
        record.errorMessage());
  }
}
