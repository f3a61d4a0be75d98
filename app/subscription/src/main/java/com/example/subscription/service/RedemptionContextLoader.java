/*
 * どこで: Subscription サービス層
 * 何を: サブスクリプションから商品/価格/トークン/ネットワーク/ウォレット/デリゲーションを解決する
 * なぜ: 実行パラメータに必要な参照データを渡されたストア (直接 or トランザクション) から読むため
 */
package com.example.subscription.service;

import com.example.subscription.model.DelegationDatum;
import com.example.subscription.model.NetworkRecord;
import com.example.subscription.model.PriceRecord;
import com.example.subscription.model.ProductRecord;
import com.example.subscription.model.ProductTokenRecord;
import com.example.subscription.model.RedemptionContext;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.model.TokenRecord;
import com.example.subscription.model.WalletRecord;
import com.example.subscription.repository.SubscriptionStore;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class RedemptionContextLoader {

  public RedemptionContext load(SubscriptionStore store, SubscriptionRecord subscription) {
    final ProductRecord product =
        store
            .findProduct(subscription.productId())
            .orElseThrow(() -> missing("product", subscription.productId(), subscription));
    final PriceRecord price =
        store
            .findPrice(require("price", subscription.priceId(), subscription))
            .orElseThrow(() -> missing("price", subscription.priceId(), subscription));
    final ProductTokenRecord productToken =
        store
            .findProductToken(require("product token", subscription.productTokenId(), subscription))
            .orElseThrow(
                () -> missing("product token", subscription.productTokenId(), subscription));
    final TokenRecord token =
        store
            .findToken(productToken.tokenId())
            .orElseThrow(() -> missing("token", productToken.tokenId(), subscription));
    final NetworkRecord network =
        store
            .findNetwork(productToken.networkId())
            .orElseThrow(() -> missing("network", productToken.networkId(), subscription));
    final WalletRecord merchantWallet =
        store
            .findWallet(product.walletId())
            .orElseThrow(() -> missing("merchant wallet", product.walletId(), subscription));
    final DelegationDatum delegation =
        store
            .findDelegation(subscription.delegationId())
            .orElseThrow(() -> missing("delegation", subscription.delegationId(), subscription));
    return new RedemptionContext(
        subscription, product, price, token, network, merchantWallet, delegation);
  }

  private UUID require(String kind, UUID id, SubscriptionRecord subscription) {
    if (id == null) {
      throw new RedemptionContextException(
          kind + " is not set for subscription " + subscription.id());
    }
    return id;
  }

  private RedemptionContextException missing(
      String kind, UUID id, SubscriptionRecord subscription) {
    return new RedemptionContextException(
        kind + " " + id + " not found for subscription " + subscription.id());
  }
}
