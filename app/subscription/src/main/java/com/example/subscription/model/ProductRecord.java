package com.example.subscription.model;

import java.util.UUID;

public record ProductRecord(UUID id, UUID walletId, String name, boolean active) {}
