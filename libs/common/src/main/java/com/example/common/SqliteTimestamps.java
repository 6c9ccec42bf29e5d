/*
 * どこで: 共通ユーティリティ
 * 何を: Instant / LocalDate と SQLite の TEXT 列を相互変換する
 * なぜ: SQLite には日時型がなく、CURRENT_TIMESTAMP と同じ書式で UTC 文字列を揃えるため
 */
package com.example.common;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class SqliteTimestamps {

  private static final DateTimeFormatter WRITE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

  private SqliteTimestamps() {}

  public static String toText(Instant instant) {
    return instant == null ? null : WRITE_FORMAT.format(instant);
  }

  /**
   * SQLite に保存された日時文字列を Instant に戻す。
   *
   * <p>CURRENT_TIMESTAMP 形式 ("2024-01-01 12:00:00") と ISO-8601 形式 ("2024-01-01T12:00:00.123456",
   * オフセット付き含む) の両方を受け付ける。オフセットが無い値は UTC とみなす。
   */
  public static Instant fromText(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    final String normalized = text.trim().replace(' ', 'T');
    try {
      if (hasOffset(normalized)) {
        return OffsetDateTime.parse(normalized).toInstant();
      }
      return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("unparseable timestamp: " + text, ex);
    }
  }

  public static String toDateText(LocalDate date) {
    return date == null ? null : date.toString();
  }

  public static LocalDate fromDateText(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    // DATE 列に日時が入っている旧データは先頭 10 文字だけを使う
    final String trimmed = text.trim();
    return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
  }

  private static boolean hasOffset(String value) {
    if (value.endsWith("Z")) {
      return true;
    }
    final int timeStart = value.indexOf('T');
    if (timeStart < 0) {
      return false;
    }
    final String time = value.substring(timeStart);
    return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
  }
}
