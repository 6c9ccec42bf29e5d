package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class SqliteTimestampsTest {

  @Test
  void toTextUsesCurrentTimestampShapeInUtc() {
    assertThat(SqliteTimestamps.toText(Instant.parse("2026-01-02T03:04:05.678Z")))
        .isEqualTo("2026-01-02 03:04:05.678");
    assertThat(SqliteTimestamps.toText(null)).isNull();
  }

  @Test
  void fromTextReadsSqliteDefaultFormat() {
    assertThat(SqliteTimestamps.fromText("2026-01-02 03:04:05"))
        .isEqualTo(Instant.parse("2026-01-02T03:04:05Z"));
  }

  @Test
  void fromTextReadsLegacyIsoFormats() {
    assertThat(SqliteTimestamps.fromText("2026-01-02T03:04:05.123456"))
        .isEqualTo(Instant.parse("2026-01-02T03:04:05.123456Z"));
    assertThat(SqliteTimestamps.fromText("2026-01-02T12:04:05+09:00"))
        .isEqualTo(Instant.parse("2026-01-02T03:04:05Z"));
    assertThat(SqliteTimestamps.fromText("2026-01-02T03:04:05Z"))
        .isEqualTo(Instant.parse("2026-01-02T03:04:05Z"));
  }

  @Test
  void roundTripKeepsMillisecondPrecision() {
    final Instant instant = Instant.parse("2026-05-06T07:08:09.010Z");

    assertThat(SqliteTimestamps.fromText(SqliteTimestamps.toText(instant))).isEqualTo(instant);
  }

  @Test
  void fromTextReturnsNullForBlank() {
    assertThat(SqliteTimestamps.fromText(null)).isNull();
    assertThat(SqliteTimestamps.fromText(" ")).isNull();
  }

  @Test
  void fromTextRejectsGarbage() {
    assertThatThrownBy(() -> SqliteTimestamps.fromText("yesterday"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unparseable timestamp");
  }

  @Test
  void dateTextAcceptsDateTimeValues() {
    assertThat(SqliteTimestamps.fromDateText("2026-03-04")).isEqualTo(LocalDate.of(2026, 3, 4));
    assertThat(SqliteTimestamps.fromDateText("2026-03-04 10:00:00"))
        .isEqualTo(LocalDate.of(2026, 3, 4));
    assertThat(SqliteTimestamps.toDateText(LocalDate.of(2026, 3, 4))).isEqualTo("2026-03-04");
  }
}
