package com.example.minigame.api.response;

import com.example.minigame.model.UserRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserProfileResponse(
    String userId,
    String username,
    long coins,
    long totalEarned,
    long totalSpent,
    int level,
    int experience,
    String title,
    int checkInCount,
    int totalCheckIns,
    String lastCheckIn,
    Integer rank,
    double profitRate) {

  public static UserProfileResponse from(UserRecord user, Integer rank) {
    return new UserProfileResponse(
        user.userId(),
        user.username(),
        user.coins(),
        user.totalEarned(),
        user.totalSpent(),
        user.level(),
        user.experience(),
        user.title(),
        user.checkInCount(),
        user.totalCheckIns(),
        user.lastCheckIn() == null ? null : user.lastCheckIn().toString(),
        rank,
        user.profitRate());
  }
}
