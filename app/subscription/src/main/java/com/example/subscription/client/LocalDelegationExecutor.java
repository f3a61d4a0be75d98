/*
 * どこで: Subscription クライアント層
 * 何を: ローカル開発用に請求を模擬し、擬似トランザクションハッシュを返す
 * なぜ: 実行サービスなしで請求フローを動作確認できるようにするため
 */
package com.example.subscription.client;

import com.example.subscription.service.DelegationExecutor;
import com.example.subscription.service.ExecutionParams;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "subscription.delegation.mode", havingValue = "local")
public class LocalDelegationExecutor implements DelegationExecutor {

  private static final Logger logger = LoggerFactory.getLogger(LocalDelegationExecutor.class);

  @Override
  public String redeem(byte[] delegationPayload, ExecutionParams params) {
    final String transactionHash =
        "0x"
            + Hashing.sha256()
                .newHasher()
                .putBytes(delegationPayload)
                .putString(params.merchantAddress(), StandardCharsets.UTF_8)
                .putLong(params.tokenAmount())
                .putString(UUID.randomUUID().toString(), StandardCharsets.UTF_8)
                .hash();
    logger.info(
        "delegation redeem simulated network={} chainId={} merchant={} amount={} txHash={}",
        params.networkName(),
        params.chainId(),
        params.merchantAddress(),
        params.tokenAmount(),
        transactionHash);
    return transactionHash;
  }
}
