/*
 * どこで: Subscription ドメインモデル
 * 何を: 期日を迎えた解約予約または一時停止明けの 1 件を表す
 * なぜ: 予約の適用に必要な列だけを SubscriptionRecord と切り離して受け渡すため
 */
package com.example.subscription.model;

import java.time.Instant;
import java.util.UUID;

/** effectiveAt は解約予約なら cancel_at、再開なら pause_ends_at。 */
public record ScheduledChangeRecord(
    UUID subscriptionId,
    UUID priceId,
    SubscriptionStatus status,
    Instant effectiveAt,
    String cancellationReason) {}
