package com.example.subscription.service;

public record ExecutionParams(
    String merchantAddress,
    String tokenContractAddress,
    int tokenDecimals,
    long tokenAmount,
    long chainId,
    String networkName) {}
