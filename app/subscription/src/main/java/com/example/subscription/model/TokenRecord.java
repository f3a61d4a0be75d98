package com.example.subscription.model;

import java.util.UUID;

public record TokenRecord(
    UUID id, UUID networkId, String contractAddress, String symbol, int decimals) {}
