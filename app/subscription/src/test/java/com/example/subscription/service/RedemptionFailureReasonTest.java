package com.example.subscription.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RedemptionFailureReasonTest {

  @Test
  void fromCodeIsCaseInsensitive() {
    assertThat(RedemptionFailureReason.fromCode("insufficient_funds"))
        .isEqualTo(RedemptionFailureReason.INSUFFICIENT_FUNDS);
    assertThat(RedemptionFailureReason.fromCode(" DELEGATION_EXPIRED "))
        .isEqualTo(RedemptionFailureReason.DELEGATION_EXPIRED);
  }

  @Test
  void unknownOrMissingCodeIsTransient() {
    assertThat(RedemptionFailureReason.fromCode(null)).isEqualTo(RedemptionFailureReason.TRANSIENT);
    assertThat(RedemptionFailureReason.fromCode("")).isEqualTo(RedemptionFailureReason.TRANSIENT);
    assertThat(RedemptionFailureReason.fromCode("RATE_LIMITED"))
        .isEqualTo(RedemptionFailureReason.TRANSIENT);
  }

  @Test
  void onlyCredentialAndPayloadErrorsArePermanent() {
    assertThat(RedemptionFailureReason.INVALID_SIGNATURE.isPermanent()).isTrue();
    assertThat(RedemptionFailureReason.INSUFFICIENT_FUNDS.isPermanent()).isTrue();
    assertThat(RedemptionFailureReason.NONCE_COLLISION.isPermanent()).isFalse();
    assertThat(RedemptionFailureReason.TIMEOUT.isPermanent()).isFalse();
    assertThat(RedemptionFailureReason.TRANSIENT.isPermanent()).isFalse();
  }

  @Test
  void fromMessageMatchesKnownSignaturesIgnoringCase() {
    assertThat(RedemptionFailureReason.fromMessage("execution reverted: Insufficient Funds"))
        .contains(RedemptionFailureReason.INSUFFICIENT_FUNDS);
    assertThat(RedemptionFailureReason.fromMessage("INVALID ACCOUNT NONCE"))
        .contains(RedemptionFailureReason.NONCE_COLLISION);
    assertThat(RedemptionFailureReason.fromMessage("connection reset by peer")).isEmpty();
    assertThat(RedemptionFailureReason.fromMessage(null)).isEmpty();
  }
}
