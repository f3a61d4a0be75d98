package com.example.subscription.model;

import java.util.UUID;

public record NetworkRecord(UUID id, String name, long chainId) {}
