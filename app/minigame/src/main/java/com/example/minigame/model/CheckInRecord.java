package com.example.minigame.model;

import java.time.LocalDate;

public record CheckInRecord(
    String userId,
    LocalDate checkInDate,
    long coinsEarned,
    int consecutiveDays,
    long bonusCoins) {

  public long totalCoins() {
    return coinsEarned + bonusCoins;
  }
}
