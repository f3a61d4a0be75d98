package com.example.subscription.model;

import java.util.UUID;

public record PriceRecord(
    UUID id,
    UUID productId,
    String type,
    String currency,
    long unitAmountInPennies,
    IntervalType intervalType,
    Integer termLength) {

  public static final String TYPE_RECURRING = "recurring";
  public static final String TYPE_ONE_TIME = "one_time";

  public boolean isOneTime() {
    return TYPE_ONE_TIME.equals(type);
  }
}
