package com.example.minigame.api.response;

import com.example.minigame.model.GameStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameStatsResponse(
    String userId,
    String gameType,
    long totalGames,
    long wins,
    long losses,
    double winRate,
    long totalBet,
    long totalWon,
    long netProfit,
    double avgProfit,
    long maxWin,
    long worstLoss) {

  public static GameStatsResponse from(String userId, String gameType, GameStats stats) {
    return new GameStatsResponse(
        userId,
        gameType,
        stats.totalGames(),
        stats.wins(),
        stats.totalGames() - stats.wins(),
        stats.winRate(),
        stats.totalBet(),
        stats.totalWon(),
        stats.netProfit(),
        stats.avgProfit(),
        stats.maxWin(),
        stats.worstLoss());
  }
}
