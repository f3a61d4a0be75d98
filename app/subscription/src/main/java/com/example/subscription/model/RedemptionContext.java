/*
 * どこで: Subscription ドメインモデル
 * 何を: 1 件の請求に必要な参照データ一式を束ねる
 * なぜ: プロセッサが store を個別に引き直さずに実行パラメータを組み立てられるようにするため
 */
package com.example.subscription.model;

public record RedemptionContext(
    SubscriptionRecord subscription,
    ProductRecord product,
    PriceRecord price,
    TokenRecord token,
    NetworkRecord network,
    WalletRecord merchantWallet,
    DelegationDatum delegation) {}
