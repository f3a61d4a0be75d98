/*
 * どこで: Subscription データアクセス
 * 何を: バッチ全体で共有するトランザクションに束縛された SubscriptionStore
 * なぜ: 期日バッチを all-or-nothing でコミットしつつ、帳簿更新の失敗を 1 件単位に閉じ込めるため
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
import org.springframework.transaction.TransactionStatus;

public class TransactionalSubscriptionStore implements SubscriptionStore {

  private final SubscriptionStore delegate;
  private final TransactionStatus transactionStatus;

  TransactionalSubscriptionStore(SubscriptionStore delegate, TransactionStatus transactionStatus) {
    this.delegate = delegate;
    this.transactionStatus = transactionStatus;
  }

  @Override
  public Optional<SubscriptionRecord> findSubscription(UUID subscriptionId) {
    ensureActive();
    return delegate.findSubscription(subscriptionId);
  }

  @Override
  public List<SubscriptionRecord> listDueForRedemption(Instant now) {
    ensureActive();
    return delegate.listDueForRedemption(now);
  }

  @Override
  public SubscriptionRecord incrementRedemption(
      UUID subscriptionId, long amountInCents, Instant nextRedemptionDate) {
    ensureActive();
    return delegate.incrementRedemption(subscriptionId, amountInCents, nextRedemptionDate);
  }

  @Override
  public SubscriptionRecord updateStatus(UUID subscriptionId, SubscriptionStatus status) {
    ensureActive();
    return delegate.updateStatus(subscriptionId, status);
  }

  @Override
  public SubscriptionEventRecord createSubscriptionEvent(NewSubscriptionEvent event) {
    ensureActive();
    return delegate.createSubscriptionEvent(event);
  }

  @Override
  public List<ScheduledChangeRecord> listDueCancellations(Instant now) {
    ensureActive();
    return delegate.listDueCancellations(now);
  }

  @Override
  public List<ScheduledChangeRecord> listDueResumptions(Instant now) {
    ensureActive();
    return delegate.listDueResumptions(now);
  }

  @Override
  public Optional<SubscriptionRecord> cancelScheduled(UUID subscriptionId, Instant now) {
    ensureActive();
    return delegate.cancelScheduled(subscriptionId, now);
  }

  @Override
  public Optional<SubscriptionRecord> resumeSuspended(
      UUID subscriptionId, Instant periodStart, Instant periodEnd, Instant nextRedemptionDate) {
    ensureActive();
    return delegate.resumeSuspended(subscriptionId, periodStart, periodEnd, nextRedemptionDate);
  }

  @Override
  public SubscriptionEventRecord createFailedRedemptionEvent(
      UUID subscriptionId,
      long amountInCents,
      String errorMessage,
      String metadataJson,
      Instant occurredAt) {
    ensureActive();
    return delegate.createFailedRedemptionEvent(
        subscriptionId, amountInCents, errorMessage, metadataJson, occurredAt);
  }

  @Override
  public List<SubscriptionEventRecord> listEvents(UUID subscriptionId) {
    ensureActive();
    return delegate.listEvents(subscriptionId);
  }

  @Override
  public Optional<ProductRecord> findProduct(UUID productId) {
    ensureActive();
    return delegate.findProduct(productId);
  }

  @Override
  public Optional<PriceRecord> findPrice(UUID priceId) {
    ensureActive();
    return delegate.findPrice(priceId);
  }

  @Override
  public Optional<ProductTokenRecord> findProductToken(UUID productTokenId) {
    ensureActive();
    return delegate.findProductToken(productTokenId);
  }

  @Override
  public Optional<TokenRecord> findToken(UUID tokenId) {
    ensureActive();
    return delegate.findToken(tokenId);
  }

  @Override
  public Optional<NetworkRecord> findNetwork(UUID networkId) {
    ensureActive();
    return delegate.findNetwork(networkId);
  }

  @Override
  public Optional<WalletRecord> findWallet(UUID walletId) {
    ensureActive();
    return delegate.findWallet(walletId);
  }

  @Override
  public Optional<DelegationDatum> findDelegation(UUID delegationId) {
    ensureActive();
    return delegate.findDelegation(delegationId);
  }

  @Override
  public <T> T runIsolated(Supplier<T> work) {
    ensureActive();
    // PostgreSQL は失敗した文以降のトランザクションを無効化するため、セーブポイントまで戻して継続する
    final Object savepoint = transactionStatus.createSavepoint();
    final T result;
    try {
      result = work.get();
    } catch (RuntimeException ex) {
      transactionStatus.rollbackToSavepoint(savepoint);
      throw ex;
    }
    transactionStatus.releaseSavepoint(savepoint);
    return result;
  }

  private void ensureActive() {
    if (transactionStatus.isCompleted()) {
      throw new IllegalStateException("batch transaction is already completed");
    }
  }
}
