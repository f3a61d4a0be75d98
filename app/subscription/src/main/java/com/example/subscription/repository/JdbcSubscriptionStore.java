/*
 * どこで: Subscription データアクセス
 * 何を: subscriptions / subscription_events と参照テーブルへの JDBC アクセスを担う
 * なぜ: 請求エンジンの DB 契約を NamedParameterJdbcTemplate で素直に実装するため
 */
package com.example.subscription.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.subscription.model.DelegationDatum;
import com.example.subscription.model.IntervalType;
import com.example.subscription.model.NetworkRecord;
import com.example.subscription.model.NewSubscriptionEvent;
import com.example.subscription.model.PriceRecord;
import com.example.subscription.model.ProductRecord;
import com.example.subscription.model.ProductTokenRecord;
import com.example.subscription.model.ScheduledChangeRecord;
import com.example.subscription.model.SubscriptionEventRecord;
import com.example.subscription.model.SubscriptionEventType;
import com.example.subscription.model.SubscriptionRecord;
import com.example.subscription.model.SubscriptionStatus;
import com.example.subscription.model.TokenRecord;
import com.example.subscription.model.WalletRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcSubscriptionStore implements SubscriptionStore {

  private static final String SUBSCRIPTION_COLUMNS =
      """
      id,
      customer_id,
      product_id,
      price_id,
      product_token_id,
      token_amount,
      delegation_id,
      customer_wallet_id,
      status,
      current_period_start,
      current_period_end,
      next_redemption_date,
      total_redemptions,
      total_amount_in_cents,
      total_term_length,
      metadata::text AS metadata_text,
      created_at,
      updated_at
      """;

  private static final String EVENT_COLUMNS =
      """
      id,
      subscription_id,
      event_type,
      transaction_hash,
      amount_in_cents,
      occurred_at,
      error_message,
      metadata::text AS metadata_text
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public JdbcSubscriptionStore(NamedParameterJdbcTemplate jdbcTemplate) {
    // SpotBugs の EI_EXPOSE_REP2 対応: 外部参照を直接保持せず、ラッパを作り直す
    this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate.getJdbcTemplate());
  }

  @Override
  public Optional<SubscriptionRecord> findSubscription(UUID subscriptionId) {
    final String sql =
        "SELECT "
            + SUBSCRIPTION_COLUMNS
            + """
            FROM subscriptions
            WHERE id = :id
              AND deleted_at IS NULL
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", subscriptionId);
    return jdbcTemplate.query(sql, params, this::mapSubscription).stream().findFirst();
  }

  @Override
  public List<SubscriptionRecord> listDueForRedemption(Instant now) {
    final String sql =
        "SELECT "
            + SUBSCRIPTION_COLUMNS
            + """
            FROM subscriptions
            WHERE status IN ('active', 'overdue')
              AND next_redemption_date <= :now
              AND deleted_at IS NULL
            ORDER BY next_redemption_date ASC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapSubscription);
  }

  @Override
  public SubscriptionRecord incrementRedemption(
      UUID subscriptionId, long amountInCents, Instant nextRedemptionDate) {
    // 回数と累計金額は DB 側で加算し、読み取りとの競合で取りこぼさないようにする
    final String sql =
        """
        UPDATE subscriptions
        SET total_redemptions = total_redemptions + 1,
            total_amount_in_cents = total_amount_in_cents + :amountInCents,
            next_redemption_date = :nextRedemptionDate,
            updated_at = CURRENT_TIMESTAMP
        WHERE id = :id
          AND deleted_at IS NULL
        RETURNING
        """
            + SUBSCRIPTION_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("amountInCents", amountInCents)
            .addValue("nextRedemptionDate", toTimestamp(nextRedemptionDate));
    return requireSingle(jdbcTemplate.query(sql, params, this::mapSubscription), subscriptionId);
  }

  @Override
  public SubscriptionRecord updateStatus(UUID subscriptionId, SubscriptionStatus status) {
    final String sql =
        """
        UPDATE subscriptions
        SET status = :status,
            updated_at = CURRENT_TIMESTAMP
        WHERE id = :id
          AND deleted_at IS NULL
        RETURNING
        """
            + SUBSCRIPTION_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("status", status.value());
    return requireSingle(jdbcTemplate.query(sql, params, this::mapSubscription), subscriptionId);
  }

  @Override
  public SubscriptionEventRecord createSubscriptionEvent(NewSubscriptionEvent event) {
    final String sql =
        """
        INSERT INTO subscription_events (
          subscription_id,
          event_type,
          transaction_hash,
          amount_in_cents,
          occurred_at,
          error_message,
          metadata
        ) VALUES (
          :subscriptionId,
          :eventType,
          :transactionHash,
          :amountInCents,
          :occurredAt,
          :errorMessage,
          :metadata::jsonb
        )
        RETURNING
        """
            + EVENT_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", event.subscriptionId())
            .addValue("eventType", event.eventType().value())
            .addValue("transactionHash", event.transactionHash())
            .addValue("amountInCents", event.amountInCents())
            .addValue("occurredAt", toTimestamp(event.occurredAt()))
            .addValue("errorMessage", event.errorMessage())
            .addValue("metadata", event.metadataJson() == null ? "{}" : event.metadataJson());
    return jdbcTemplate.queryForObject(sql, params, this::mapEvent);
  }

  @Override
  public List<ScheduledChangeRecord> listDueCancellations(Instant now) {
    final String sql =
        """
        SELECT id, price_id, status, cancel_at AS effective_at, cancellation_reason
        FROM subscriptions
        WHERE status IN ('active', 'overdue', 'suspended')
          AND cancel_at IS NOT NULL
          AND cancel_at <= :now
          AND canceled_at IS NULL
          AND deleted_at IS NULL
        ORDER BY cancel_at ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapScheduledChange);
  }

  @Override
  public List<ScheduledChangeRecord> listDueResumptions(Instant now) {
    final String sql =
        """
        SELECT id, price_id, status, pause_ends_at AS effective_at, cancellation_reason
        FROM subscriptions
        WHERE status = 'suspended'
          AND pause_ends_at IS NOT NULL
          AND pause_ends_at <= :now
          AND deleted_at IS NULL
        ORDER BY pause_ends_at ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapScheduledChange);
  }

  @Override
  public Optional<SubscriptionRecord> cancelScheduled(UUID subscriptionId, Instant now) {
    // 一覧取得後に再開や手動解約が挟まっても、条件を満たす行だけを更新する
    final String sql =
        """
        UPDATE subscriptions
        SET status = 'canceled',
            canceled_at = :now,
            next_redemption_date = NULL,
            updated_at = CURRENT_TIMESTAMP
        WHERE id = :id
          AND status IN ('active', 'overdue', 'suspended')
          AND cancel_at IS NOT NULL
          AND cancel_at <= :now
          AND canceled_at IS NULL
          AND deleted_at IS NULL
        RETURNING
        """
            + SUBSCRIPTION_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapSubscription).stream().findFirst();
  }

  @Override
  public Optional<SubscriptionRecord> resumeSuspended(
      UUID subscriptionId, Instant periodStart, Instant periodEnd, Instant nextRedemptionDate) {
    final String sql =
        """
        UPDATE subscriptions
        SET status = 'active',
            paused_at = NULL,
            pause_ends_at = NULL,
            current_period_start = :periodStart,
            current_period_end = :periodEnd,
            next_redemption_date = :nextRedemptionDate,
            updated_at = CURRENT_TIMESTAMP
        WHERE id = :id
          AND status = 'suspended'
          AND pause_ends_at IS NOT NULL
          AND pause_ends_at <= :periodStart
          AND deleted_at IS NULL
        RETURNING
        """
            + SUBSCRIPTION_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("periodStart", toTimestamp(periodStart))
            .addValue("periodEnd", toTimestamp(periodEnd))
            .addValue("nextRedemptionDate", toTimestamp(nextRedemptionDate));
    return jdbcTemplate.query(sql, params, this::mapSubscription).stream().findFirst();
  }

  @Override
  public SubscriptionEventRecord createFailedRedemptionEvent(
      UUID subscriptionId,
      long amountInCents,
      String errorMessage,
      String metadataJson,
      Instant occurredAt) {
    return createSubscriptionEvent(
        NewSubscriptionEvent.failedRedemption(
            subscriptionId, amountInCents, occurredAt, errorMessage, metadataJson));
  }

  @Override
  public List<SubscriptionEventRecord> listEvents(UUID subscriptionId) {
    final String sql =
        "SELECT "
            + EVENT_COLUMNS
            + """
            FROM subscription_events
            WHERE subscription_id = :subscriptionId
            ORDER BY occurred_at DESC, created_at DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriptionId", subscriptionId);
    return jdbcTemplate.query(sql, params, this::mapEvent);
  }

  @Override
  public Optional<ProductRecord> findProduct(UUID productId) {
    final String sql =
        """
        SELECT id, wallet_id, name, active
        FROM products
        WHERE id = :id
          AND deleted_at IS NULL
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", productId),
            (rs, rowNum) ->
                new ProductRecord(
                    rs.getObject("id", UUID.class),
                    rs.getObject("wallet_id", UUID.class),
                    rs.getString("name"),
                    rs.getBoolean("active")))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<PriceRecord> findPrice(UUID priceId) {
    final String sql =
        """
        SELECT id, product_id, type, currency, unit_amount_in_pennies, interval_type, term_length
        FROM prices
        WHERE id = :id
          AND deleted_at IS NULL
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", priceId),
            (rs, rowNum) ->
                new PriceRecord(
                    rs.getObject("id", UUID.class),
                    rs.getObject("product_id", UUID.class),
                    rs.getString("type"),
                    rs.getString("currency"),
                    rs.getLong("unit_amount_in_pennies"),
                    IntervalType.fromValue(rs.getString("interval_type")),
                    rs.getObject("term_length", Integer.class)))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<ProductTokenRecord> findProductToken(UUID productTokenId) {
    final String sql =
        """
        SELECT id, product_id, network_id, token_id
        FROM products_tokens
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", productTokenId),
            (rs, rowNum) ->
                new ProductTokenRecord(
                    rs.getObject("id", UUID.class),
                    rs.getObject("product_id", UUID.class),
                    rs.getObject("network_id", UUID.class),
                    rs.getObject("token_id", UUID.class)))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<TokenRecord> findToken(UUID tokenId) {
    final String sql =
        """
        SELECT id, network_id, contract_address, symbol, decimals
        FROM tokens
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", tokenId),
            (rs, rowNum) ->
                new TokenRecord(
                    rs.getObject("id", UUID.class),
                    rs.getObject("network_id", UUID.class),
                    rs.getString("contract_address"),
                    rs.getString("symbol"),
                    rs.getInt("decimals")))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<NetworkRecord> findNetwork(UUID networkId) {
    final String sql =
        """
        SELECT id, name, chain_id
        FROM networks
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", networkId),
            (rs, rowNum) ->
                new NetworkRecord(
                    rs.getObject("id", UUID.class), rs.getString("name"), rs.getLong("chain_id")))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<WalletRecord> findWallet(UUID walletId) {
    final String sql =
        """
        SELECT id, wallet_address
        FROM wallets
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", walletId),
            (rs, rowNum) ->
                new WalletRecord(rs.getObject("id", UUID.class), rs.getString("wallet_address")))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<DelegationDatum> findDelegation(UUID delegationId) {
    final String sql =
        """
        SELECT id, delegate, delegator, authority, caveats::text AS caveats_text, salt, signature
        FROM delegation_data
        WHERE id = :id
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("id", delegationId),
            (rs, rowNum) ->
                new DelegationDatum(
                    rs.getObject("id", UUID.class),
                    rs.getString("delegate"),
                    rs.getString("delegator"),
                    rs.getString("authority"),
                    rs.getString("caveats_text"),
                    rs.getString("salt"),
                    rs.getString("signature")))
        .stream()
        .findFirst();
  }

  private SubscriptionRecord requireSingle(List<SubscriptionRecord> rows, UUID subscriptionId) {
    if (rows.isEmpty()) {
      throw new EmptyResultDataAccessException(
          "subscription not found for update id=" + subscriptionId, 1);
    }
    return rows.get(0);
  }

  private SubscriptionRecord mapSubscription(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriptionRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("customer_id", UUID.class),
        rs.getObject("product_id", UUID.class),
        rs.getObject("price_id", UUID.class),
        rs.getObject("product_token_id", UUID.class),
        rs.getLong("token_amount"),
        rs.getObject("delegation_id", UUID.class),
        rs.getObject("customer_wallet_id", UUID.class),
        SubscriptionStatus.fromValue(rs.getString("status")),
        getInstant(rs, "current_period_start"),
        getInstant(rs, "current_period_end"),
        getInstant(rs, "next_redemption_date"),
        rs.getInt("total_redemptions"),
        rs.getLong("total_amount_in_cents"),
        rs.getObject("total_term_length", Integer.class),
        rs.getString("metadata_text"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }

  private ScheduledChangeRecord mapScheduledChange(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduledChangeRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("price_id", UUID.class),
        SubscriptionStatus.fromValue(rs.getString("status")),
        getInstant(rs, "effective_at"),
        rs.getString("cancellation_reason"));
  }

  private SubscriptionEventRecord mapEvent(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriptionEventRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("subscription_id", UUID.class),
        SubscriptionEventType.fromValue(rs.getString("event_type")),
        rs.getString("transaction_hash"),
        rs.getLong("amount_in_cents"),
        getInstant(rs, "occurred_at"),
        rs.getString("error_message"),
        rs.getString("metadata_text"));
  }
}
