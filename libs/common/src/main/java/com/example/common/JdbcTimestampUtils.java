/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant と Timestamp を相互に明示変換する
 * なぜ: PostgreSQL JDBC の型推論と NULL 列の扱いを各リポジトリで揃えるため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC 前提のため Timestamp.from でそのまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // NULL 許容カラム (next_redemption_date など) は null のまま返す
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    final Timestamp timestamp = rs.getTimestamp(column);
    return timestamp == null ? null : timestamp.toInstant();
  }
}
