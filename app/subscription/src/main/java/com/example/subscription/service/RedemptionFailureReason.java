/*
 * どこで: Subscription サービス層
 * 何を: デリゲーション実行失敗の分類を定義する
 * なぜ: エラーメッセージの文字列一致ではなく型でリトライ可否を判定するため
 */
package com.example.subscription.service;

import java.util.Locale;
import java.util.Optional;

public enum RedemptionFailureReason {
  INVALID_SIGNATURE(true, "invalid signature"),
  DELEGATION_EXPIRED(true, "delegation expired"),
  INVALID_DELEGATION_FORMAT(true, "invalid delegation format"),
  INVALID_TOKEN(true, "invalid token"),
  UNAUTHORIZED(true, "unauthorized"),
  INSUFFICIENT_FUNDS(true, "insufficient funds"),
  INVALID_REQUEST(true, null),
  NONCE_COLLISION(false, "invalid account nonce"),
  TIMEOUT(false, null),
  CIRCUIT_OPEN(false, null),
  TRANSIENT(false, null);

  private final boolean permanent;
  private final String messageSignature;

  RedemptionFailureReason(boolean permanent, String messageSignature) {
    this.permanent = permanent;
    this.messageSignature = messageSignature;
  }

  /** 実行サービスのエラーメッセージに含まれる文言。コード専用の理由は null。 */
  public String messageSignature() {
    return messageSignature;
  }

  public boolean isPermanent() {
    return permanent;
  }

  /**
   * 役割: 実行サービスが返すエラーコードを分類へ変換する。
   * 動作: 未知のコードや null は TRANSIENT とみなす。
   */
  public static RedemptionFailureReason fromCode(String code) {
    return parseCode(code).orElse(TRANSIENT);
  }

  public static Optional<RedemptionFailureReason> parseCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    for (RedemptionFailureReason candidate : values()) {
      if (candidate.name().equalsIgnoreCase(code.trim())) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  /**
   * 役割: エラーコードを持たない応答のメッセージから分類を推定する。
   * 動作: 既知の文言を大文字小文字を区別せず部分一致で探し、見つからなければ empty。
   */
  public static Optional<RedemptionFailureReason> fromMessage(String message) {
    if (message == null || message.isBlank()) {
      return Optional.empty();
    }
    final String normalized = message.toLowerCase(Locale.ROOT);
    for (RedemptionFailureReason candidate : values()) {
      if (candidate.messageSignature != null && normalized.contains(candidate.messageSignature)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
