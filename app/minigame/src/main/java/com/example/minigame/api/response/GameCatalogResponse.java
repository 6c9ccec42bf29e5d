package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameCatalogResponse(List<GameSummaryResponse> games) {

  public GameCatalogResponse {
    games = List.copyOf(games);
  }
}
