package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckInResponse(
    String userId,
    String checkInDate,
    long coinsEarned,
    long bonusCoins,
    long totalReward,
    int consecutiveDays,
    int totalCheckIns,
    long currentCoins,
    boolean newUser) {}
