package com.example.subscription.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

/** subscriptionIds を省略した場合は期日到来分すべてが対象になる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RedeemDueRequest(
    @Size(max = 1000, message = "subscription_ids must have at most 1000 entries")
        List<@NotNull(message = "subscription_ids must not contain null") UUID> subscriptionIds) {}
