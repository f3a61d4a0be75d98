package com.example.subscription.service;

import com.example.subscription.model.SubscriptionRecord;

/** transactionHash は REDEEMED/COMPLETED/BOOKKEEPING_FAILED のときだけ入る。 */
public record ProcessResult(
    ProcessOutcome outcome,
    SubscriptionRecord subscription,
    String transactionHash,
    String errorMessage) {

  public static ProcessResult skipped(ProcessOutcome outcome, SubscriptionRecord subscription) {
    return new ProcessResult(outcome, subscription, null, null);
  }
}
