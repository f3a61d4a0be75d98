/*
 * どこで: Subscription サービス層
 * 何を: API/ワーカーからの請求要求と参照要求を受け付ける
 * なぜ: 現在時刻の決定と入力検証を入口で一度だけ行い、エンジンへ渡すため
 */
package com.example.subscription.service;

import com.example.subscription.model.SubscriptionEventRecord;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.repository.SubscriptionStores;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionRedemptionService {

  private final DueBatchRunner batchRunner;
  private final SubscriptionStores stores;
  private final Clock clock;

  public ProcessResult redeem(UUID subscriptionId) {
    return batchRunner.redeemOne(subscriptionId, Instant.now(clock));
  }

  public RedemptionResult processDue() {
    return batchRunner.processDue(Instant.now(clock));
  }

  /** subscriptionIds が null の場合は現在の期日到来分を対象にする。 */
  public RedemptionResult redeemDue(List<UUID> subscriptionIds) {
    final Instant now = Instant.now(clock);
    if (subscriptionIds == null) {
      return batchRunner.redeemDue(now);
    }
    return batchRunner.redeemDue(subscriptionIds.stream().distinct().toList(), now);
  }

  public SubscriptionRecord getSubscription(UUID subscriptionId) {
    return stores
        .direct()
        .findSubscription(subscriptionId)
        .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
  }

  public List<SubscriptionEventRecord> listEvents(UUID subscriptionId) {
    // 存在確認をしてから一覧を返し、未知の ID は 404 にする
    getSubscription(subscriptionId);
    return stores.direct().listEvents(subscriptionId);
  }
}
