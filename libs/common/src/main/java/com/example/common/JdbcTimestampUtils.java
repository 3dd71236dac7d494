/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp を Instant に明示変換する
 * なぜ: NULL 許容の時刻カラムを行マッピングで安全に扱うため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: TIMESTAMPTZ は UTC の絶対時刻として読み出す
  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
