package com.example.minigame.api.response;

import com.example.minigame.model.AchievementRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AchievementResponse(
    String id,
    String name,
    String description,
    String category,
    String conditionType,
    int conditionValue,
    long rewardCoins,
    String rewardTitle,
    String icon,
    boolean hidden) {

  public static AchievementResponse from(AchievementRecord record) {
    return new AchievementResponse(
        record.id(),
        record.name(),
        record.description(),
        record.category(),
        record.conditionType(),
        record.conditionValue(),
        record.rewardCoins(),
        record.rewardTitle(),
        record.icon(),
        record.hidden());
  }
}
