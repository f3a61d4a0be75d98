/*
 * どこで: Subscription 統合テストの支援
 * 何を: 商品/価格/トークン/デリゲーション/サブスクリプションの行を投入・削除する
 * なぜ: 実 DB を使うテストで参照関係を毎回組み立てる手間を省くため
 */
package com.example.subscription;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class SubscriptionTestData {

  public static final long PRICE_IN_CENTS = 999L;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public SubscriptionTestData(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public record Catalog(UUID productId, UUID priceId, UUID productTokenId, long chainId) {}

  public void cleanup() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM subscription_events", none);
    jdbcTemplate.update("DELETE FROM subscriptions", none);
    jdbcTemplate.update("DELETE FROM delegation_data", none);
    jdbcTemplate.update("DELETE FROM products_tokens", none);
    jdbcTemplate.update("DELETE FROM prices", none);
    jdbcTemplate.update("DELETE FROM products", none);
    jdbcTemplate.update("DELETE FROM tokens", none);
    jdbcTemplate.update("DELETE FROM networks", none);
    jdbcTemplate.update("DELETE FROM wallets", none);
  }

  /** 指定の受取アドレスを持つ月額 12 回の商品一式を作る。 */
  public Catalog seedCatalog(String merchantAddress) {
    final UUID walletId = insertReturningId(
        "INSERT INTO wallets (wallet_address) VALUES (:address) RETURNING id",
        new MapSqlParameterSource().addValue("address", merchantAddress));
    final long chainId = ThreadLocalRandom.current().nextLong(1, 1_000_000_000L);
    final UUID networkId = insertReturningId(
        "INSERT INTO networks (name, chain_id) VALUES ('sepolia', :chainId) RETURNING id",
        new MapSqlParameterSource().addValue("chainId", chainId));
    final UUID tokenId = insertReturningId(
        """
        INSERT INTO tokens (network_id, contract_address, symbol, decimals)
        VALUES (:networkId, '0x2222222222222222222222222222222222222222', 'USDC', 6)
        RETURNING id
        """,
        new MapSqlParameterSource().addValue("networkId", networkId));
    final UUID productId = insertReturningId(
        "INSERT INTO products (wallet_id, name) VALUES (:walletId, 'Pro plan') RETURNING id",
        new MapSqlParameterSource().addValue("walletId", walletId));
    final UUID priceId = insertReturningId(
        """
        INSERT INTO prices (
          product_id, type, currency, unit_amount_in_pennies, interval_type, term_length
        ) VALUES (:productId, 'recurring', 'USD', :amount, 'month', 12)
        RETURNING id
        """,
        new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("amount", PRICE_IN_CENTS));
    final UUID productTokenId = insertReturningId(
        """
        INSERT INTO products_tokens (product_id, network_id, token_id)
        VALUES (:productId, :networkId, :tokenId)
        RETURNING id
        """,
        new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("networkId", networkId)
            .addValue("tokenId", tokenId));
    return new Catalog(productId, priceId, productTokenId, chainId);
  }

  public UUID insertSubscription(
      Catalog catalog,
      String status,
      Instant periodEnd,
      Instant nextRedemptionDate,
      int totalRedemptions,
      String metadataJson) {
    final UUID delegationId = insertReturningId(
        """
        INSERT INTO delegation_data (delegate, delegator, authority, caveats, salt, signature)
        VALUES ('0x3333', '0x4444', '0xffff', '[{"enforcer":"0x5555","terms":"0x"}]'::jsonb,
                '0x01', '0xsig')
        RETURNING id
        """,
        new MapSqlParameterSource());
    return insertReturningId(
        """
        INSERT INTO subscriptions (
          customer_id, product_id, price_id, product_token_id, token_amount, delegation_id,
          status, current_period_start, current_period_end, next_redemption_date,
          total_redemptions, total_amount_in_cents, total_term_length, metadata
        ) VALUES (
          :customerId, :productId, :priceId, :productTokenId, 1000000, :delegationId,
          :status, :periodStart, :periodEnd, :nextRedemptionDate,
          :totalRedemptions, :totalAmount, 12, :metadata::jsonb
        )
        RETURNING id
        """,
        new MapSqlParameterSource()
            .addValue("customerId", UUID.randomUUID())
            .addValue("productId", catalog.productId())
            .addValue("priceId", catalog.priceId())
            .addValue("productTokenId", catalog.productTokenId())
            .addValue("delegationId", delegationId)
            .addValue("status", status)
            .addValue("periodStart", toTimestamp(periodEnd.minusSeconds(365L * 24 * 3600)))
            .addValue("periodEnd", toTimestamp(periodEnd))
            .addValue("nextRedemptionDate", toTimestamp(nextRedemptionDate))
            .addValue("totalRedemptions", totalRedemptions)
            .addValue("totalAmount", totalRedemptions * PRICE_IN_CENTS)
            .addValue("metadata", metadataJson));
  }

  /** 解約予約を入れる。 */
  public void scheduleCancellation(UUID subscriptionId, Instant cancelAt, String reason) {
    jdbcTemplate.update(
        """
        UPDATE subscriptions
        SET cancel_at = :cancelAt,
            cancellation_reason = :reason
        WHERE id = :id
        """,
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("cancelAt", toTimestamp(cancelAt))
            .addValue("reason", reason));
  }

  /** pauseEndsAt が null の場合は無期限の一時停止になる。 */
  public void pause(UUID subscriptionId, Instant pausedAt, Instant pauseEndsAt) {
    jdbcTemplate.update(
        """
        UPDATE subscriptions
        SET status = 'suspended',
            paused_at = :pausedAt,
            pause_ends_at = :pauseEndsAt
        WHERE id = :id
        """,
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("pausedAt", toTimestamp(pausedAt))
            .addValue("pauseEndsAt", toTimestamp(pauseEndsAt)));
  }

  private UUID insertReturningId(String sql, MapSqlParameterSource params) {
    return jdbcTemplate.queryForObject(sql, params, UUID.class);
  }
}
