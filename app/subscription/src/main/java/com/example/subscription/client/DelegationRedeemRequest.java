package com.example.subscription.client;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** delegationData は JSON 上では Base64 文字列になる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DelegationRedeemRequest(
    byte[] delegationData,
    String merchantAddress,
    String tokenContractAddress,
    String tokenAmount,
    int tokenDecimals,
    long chainId,
    String networkName) {}
