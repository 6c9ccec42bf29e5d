package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserAchievementsResponse(String userId, int totalAchievements, List<Item> achieved) {

  public UserAchievementsResponse {
    achieved = List.copyOf(achieved);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Item(
      String achievementId, String name, String category, String achievedAt, boolean notified) {}
}
