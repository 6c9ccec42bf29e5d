/*
 * どこで: Minigame ドメインモデル
 * 何を: users テーブル相当のプレイヤー残高/プロフィール
 * なぜ: Service/Repository 間で残高・レベル・チェックイン状態を一括で受け渡すため
 */
package com.example.minigame.model;

import java.time.Instant;

public record UserRecord(
    String userId,
    String username,
    long coins,
    long totalEarned,
    long totalSpent,
    int checkInCount,
    Instant lastCheckIn,
    int totalCheckIns,
    int level,
    int experience,
    String title,
    Instant createdAt,
    Instant updatedAt) {

  public static final String DEFAULT_TITLE = "新人";

  public static UserRecord newcomer(
      String userId, String username, long initialCoins, Instant now) {
    return new UserRecord(
        userId, username, initialCoins, 0, 0, 0, null, 0, 1, 0, DEFAULT_TITLE, now, now);
  }

  public UserRecord withUsername(String newUsername, Instant now) {
    return new UserRecord(
        userId,
        newUsername,
        coins,
        totalEarned,
        totalSpent,
        checkInCount,
        lastCheckIn,
        totalCheckIns,
        level,
        experience,
        title,
        createdAt,
        now);
  }

  public UserRecord withTitle(String newTitle, Instant now) {
    return new UserRecord(
        userId,
        username,
        coins,
        totalEarned,
        totalSpent,
        checkInCount,
        lastCheckIn,
        totalCheckIns,
        level,
        experience,
        newTitle,
        createdAt,
        now);
  }

  public UserRecord withCheckIn(int consecutiveDays, Instant checkedInAt) {
    return new UserRecord(
        userId,
        username,
        coins,
        totalEarned,
        totalSpent,
        consecutiveDays,
        checkedInAt,
        totalCheckIns + 1,
        level,
        experience,
        title,
        createdAt,
        checkedInAt);
  }

  /** 1 レベル上がるごとに 100 * level の経験値を消費する。 */
  public UserRecord withExperienceGained(int gained, Instant now) {
    int newLevel = level;
    int newExperience = experience + Math.max(0, gained);
    while (newExperience >= 100 * newLevel) {
      newExperience -= 100 * newLevel;
      newLevel++;
    }
    return new UserRecord(
        userId,
        username,
        coins,
        totalEarned,
        totalSpent,
        checkInCount,
        lastCheckIn,
        totalCheckIns,
        newLevel,
        newExperience,
        title,
        createdAt,
        now);
  }

  public boolean canAfford(long amount) {
    return coins >= amount;
  }

  /** 収支率。支出が無い場合は 0。 */
  public double profitRate() {
    if (totalSpent <= 0) {
      return 0.0;
    }
    return (double) (totalEarned - totalSpent) / totalSpent;
  }
}
