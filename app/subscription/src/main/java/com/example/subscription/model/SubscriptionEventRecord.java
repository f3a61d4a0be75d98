package com.example.subscription.model;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionEventRecord(
    UUID id,
    UUID subscriptionId,
    SubscriptionEventType eventType,
    String transactionHash,
    long amountInCents,
    Instant occurredAt,
    String errorMessage,
    String metadataJson) {}
