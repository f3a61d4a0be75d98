/*
 * どこで: Subscription データアクセス
 * 何を: 直接更新用とトランザクション束縛用の SubscriptionStore を払い出す
 * なぜ: 実行時の型判定ではなく、呼び出し側が明示的にトランザクション境界を選ぶため
 */
package com.example.subscription.repository;

import java.util.function.Function;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class SubscriptionStores {

  private final SubscriptionStore directStore;
  private final PlatformTransactionManager transactionManager;

  public SubscriptionStores(
      SubscriptionStore directStore, PlatformTransactionManager transactionManager) {
    this.directStore = directStore;
    this.transactionManager = transactionManager;
  }

  /** 各書き込みが個別にコミットされるストア。 */
  public SubscriptionStore direct() {
    return directStore;
  }

  /**
   * 役割: 1 つのトランザクション内で work を実行する。
   * 動作: work が RuntimeException を送出した場合はロールバックし、例外をそのまま伝播する。
   */
  public <T> T inTransaction(Function<SubscriptionStore, T> work) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    return transactionTemplate.execute(
        status -> work.apply(new TransactionalSubscriptionStore(directStore, status)));
  }
}
