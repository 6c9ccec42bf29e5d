package com.example.minigame.model;

import java.time.Instant;

public record AchievementRecord(
    String id,
    String name,
    String description,
    String category,
    String conditionType,
    int conditionValue,
    long rewardCoins,
    String rewardTitle,
    String icon,
    boolean hidden,
    Instant createdAt) {

  public static AchievementRecord of(
      String id,
      String name,
      String description,
      String category,
      String conditionType,
      int conditionValue,
      long rewardCoins,
      String rewardTitle) {
    return new AchievementRecord(
        id,
        name,
        description,
        category,
        conditionType,
        conditionValue,
        rewardCoins,
        rewardTitle,
        null,
        false,
        null);
  }
}
