/*
 * どこで: Subscription ドメインモデル
 * 何を: 価格の請求間隔を定義する
 * なぜ: prices.interval_type の文字列を期間計算で安全に扱うため
 */
package com.example.subscription.model;

public enum IntervalType {
  ONE_MINUTE("1min"),
  FIVE_MINUTES("5mins"),
  DAILY("daily"),
  WEEKLY("week"),
  MONTHLY("month"),
  YEARLY("year");

  private final String value;

  IntervalType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: DB の interval_type 文字列を列挙型へ変換する。
   * 動作: 未知の値や null は MONTHLY として扱い、例外は送出しない。
   */
  public static IntervalType fromValue(String interval) {
    if (interval == null) {
      return MONTHLY;
    }
    for (IntervalType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(interval)) {
        return candidate;
      }
    }
    return MONTHLY;
  }
}
