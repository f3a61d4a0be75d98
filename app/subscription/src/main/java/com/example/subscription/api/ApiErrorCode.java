/*
 * どこで: Subscription API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.subscription.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  SUBSCRIPTION_NOT_FOUND,
  INTERNAL_ERROR
}
