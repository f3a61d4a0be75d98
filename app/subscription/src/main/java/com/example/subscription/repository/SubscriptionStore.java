/*
 * どこで: Subscription データアクセス
 * 何を: 請求エンジンが使う DB 操作の契約を定義する
 * なぜ: 直接更新とバッチ共有トランザクションの実装を呼び出し側で選べるようにするため
 */
package com.example.subscription.repository;

import com.example.subscription.model.DelegationDatum;
import com.example.subscription.model.NetworkRecord;
import com.example.subscription.model.NewSubscriptionEvent;
import com.example.subscription.model.PriceRecord;
import com.example.subscription.model.ProductRecord;
import com.example.subscription.model.ProductTokenRecord;
import com.example.subscription.model.ScheduledChangeRecord;
import com.example.subscription.model.SubscriptionEventRecord;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.model.SubscriptionStatus;
import com.example.subscription.model.TokenRecord;
import com.example.subscription.model.WalletRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

public interface SubscriptionStore {

  Optional<SubscriptionRecord> findSubscription(UUID subscriptionId);

  /** ACTIVE/OVERDUE かつ next_redemption_date が now 以前の未削除サブスクリプションを古い順に返す。 */
  List<SubscriptionRecord> listDueForRedemption(Instant now);

  SubscriptionRecord incrementRedemption(
      UUID subscriptionId, long amountInCents, Instant nextRedemptionDate);

  SubscriptionRecord updateStatus(UUID subscriptionId, SubscriptionStatus status);

  SubscriptionEventRecord createSubscriptionEvent(NewSubscriptionEvent event);

  /** 未解約かつ cancel_at が now 以前の ACTIVE/OVERDUE/SUSPENDED を cancel_at の古い順に返す。 */
  List<ScheduledChangeRecord> listDueCancellations(Instant now);

  /** pause_ends_at が now 以前の SUSPENDED を pause_ends_at の古い順に返す。 */
  List<ScheduledChangeRecord> listDueResumptions(Instant now);

  /**
   * 役割: 解約予約を確定させ CANCELED にする。
   * 動作: 取得後に状態が変わって対象外になっていた場合は更新せず empty を返す。
   */
  Optional<SubscriptionRecord> cancelScheduled(UUID subscriptionId, Instant now);

  /**
   * 役割: 一時停止中のサブスクリプションを新しい請求期間で ACTIVE に戻す。
   * 動作: SUSPENDED でないか再開日時が未到来なら更新せず empty を返す。
   */
  Optional<SubscriptionRecord> resumeSuspended(
      UUID subscriptionId, Instant periodStart, Instant periodEnd, Instant nextRedemptionDate);

  SubscriptionEventRecord createFailedRedemptionEvent(
      UUID subscriptionId,
      long amountInCents,
      String errorMessage,
      String metadataJson,
      Instant occurredAt);

  List<SubscriptionEventRecord> listEvents(UUID subscriptionId);

  Optional<ProductRecord> findProduct(UUID productId);

  Optional<PriceRecord> findPrice(UUID priceId);

  Optional<ProductTokenRecord> findProductToken(UUID productTokenId);

  Optional<TokenRecord> findToken(UUID tokenId);

  Optional<NetworkRecord> findNetwork(UUID networkId);

  Optional<WalletRecord> findWallet(UUID walletId);

  Optional<DelegationDatum> findDelegation(UUID delegationId);

  /**
   * 役割: 請求成功後の帳簿更新をひとまとまりで実行する。
   * 動作: 直接更新ではそのまま実行する。共有トランザクションではセーブポイントで囲み、
   * 失敗時はその分だけを巻き戻してバッチ全体のトランザクションを生かす。
   */
  default <T> T runIsolated(Supplier<T> work) {
    return work.get();
  }
}
