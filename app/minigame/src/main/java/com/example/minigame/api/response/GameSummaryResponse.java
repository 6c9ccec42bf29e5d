package com.example.minigame.api.response;

import com.example.minigame.engine.GameEngine;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameSummaryResponse(
    String type,
    String name,
    int minPlayers,
    int maxPlayers,
    long minBet,
    long maxBet,
    String rules) {

  public static GameSummaryResponse from(GameEngine engine) {
    return new GameSummaryResponse(
        engine.gameType(),
        engine.displayName(),
        engine.minPlayers(),
        engine.maxPlayers(),
        engine.minBet(),
        engine.maxBet(),
        engine.rules());
  }
}
