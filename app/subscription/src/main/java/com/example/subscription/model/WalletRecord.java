package com.example.subscription.model;

import java.util.UUID;

public record WalletRecord(UUID id, String walletAddress) {}
