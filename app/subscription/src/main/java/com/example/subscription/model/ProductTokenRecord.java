package com.example.subscription.model;

import java.util.UUID;

public record ProductTokenRecord(UUID id, UUID productId, UUID networkId, UUID tokenId) {}
