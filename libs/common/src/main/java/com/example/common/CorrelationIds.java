package com.example.common;

import java.util.UUID;

public final class CorrelationIds {
  private CorrelationIds() {}

  public static String newBatchId() {
    return "batch-" + UUID.randomUUID();
  }

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }
}
