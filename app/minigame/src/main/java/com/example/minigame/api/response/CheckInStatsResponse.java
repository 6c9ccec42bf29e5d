package com.example.minigame.api.response;

import com.example.minigame.model.CheckInRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInStatsResponse(
    String userId,
    int consecutiveDays,
    int totalCheckIns,
    boolean canCheckIn,
    String nextCheckInDate,
    long recentCoinsEarned,
    List<Item> recentRecords) {

  public CheckInStatsResponse {
    recentRecords = List.copyOf(recentRecords);
  }

  public static Item toItem(CheckInRecord record) {
    return new Item(
        record.checkInDate().toString(),
        record.coinsEarned(),
        record.bonusCoins(),
        record.consecutiveDays());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Item(String checkInDate, long coinsEarned, long bonusCoins, int consecutiveDays) {}
}
