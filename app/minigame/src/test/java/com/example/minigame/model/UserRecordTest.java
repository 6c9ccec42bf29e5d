package com.example.minigame.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class UserRecordTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void newcomerStartsAtLevelOneWithDefaultTitle() {
    final UserRecord user = UserRecord.newcomer("u1", "alice", 1000, NOW);

    assertThat(user.coins()).isEqualTo(1000);
    assertThat(user.level()).isEqualTo(1);
    assertThat(user.title()).isEqualTo(UserRecord.DEFAULT_TITLE);
    assertThat(user.lastCheckIn()).isNull();
  }

  @Test
  void experienceCarriesOverAcrossLevels() {
    final UserRecord user = UserRecord.newcomer("u1", "alice", 1000, NOW);

    // Lv1→2 に 100、Lv2→3 に 200 を消費する
    final UserRecord updated = user.withExperienceGained(350, NOW);

    assertThat(updated.level()).isEqualTo(3);
    assertThat(updated.experience()).isEqualTo(50);
  }

  @Test
  void checkInUpdatesStreakAndTotal() {
    final UserRecord user = UserRecord.newcomer("u1", "alice", 1000, NOW);

    final UserRecord updated = user.withCheckIn(4, NOW);

    assertThat(updated.checkInCount()).isEqualTo(4);
    assertThat(updated.totalCheckIns()).isEqualTo(1);
    assertThat(updated.lastCheckIn()).isEqualTo(NOW);
  }

  @Test
  void profitRateIsZeroWithoutSpending() {
    final UserRecord user = UserRecord.newcomer("u1", "alice", 1000, NOW);
    final UserRecord trader =
        new UserRecord("u2", "bob", 1500, 300, 200, 0, null, 0, 1, 0, "新人", NOW, NOW);

    assertThat(user.profitRate()).isZero();
    assertThat(trader.profitRate()).isEqualTo(0.5);
    assertThat(trader.canAfford(1500)).isTrue();
    assertThat(trader.canAfford(1501)).isFalse();
  }
}
