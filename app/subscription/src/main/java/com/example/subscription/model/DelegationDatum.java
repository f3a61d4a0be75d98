/*
 * どこで: Subscription ドメインモデル
 * 何を: 署名済みデリゲーションの保存形式を表す
 * なぜ: 実行サービスへ渡すペイロードを DB 行から組み立てるため
 */
package com.example.subscription.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonRawValue;
import java.util.UUID;

public record DelegationDatum(
    @JsonIgnore UUID id,
    String delegate,
    String delegator,
    String authority,
    @JsonRawValue String caveats,
    String salt,
    String signature) {}
