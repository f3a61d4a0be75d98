package com.example.subscription.service;

import java.util.UUID;

public class SubscriptionNotFoundException extends RuntimeException {

  public SubscriptionNotFoundException(UUID subscriptionId) {
    super("subscription not found: " + subscriptionId);
  }
}
