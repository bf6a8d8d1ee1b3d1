/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp を相互変換する
 * なぜ: TIMESTAMPTZ 列の読み書きをドライバの型推論に任せず UTC で固定するため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  /** Binds an instant as a UTC timestamp; null stays null so nullable columns can be cleared. */
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
