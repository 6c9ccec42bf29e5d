package com.example.minigame.api.response;

import com.example.minigame.model.GameResultRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameRecordsResponse(String userId, String gameType, List<Item> records) {

  public GameRecordsResponse {
    records = List.copyOf(records);
  }

  public static GameRecordsResponse from(
      String userId, String gameType, List<GameResultRecord> rows) {
    final List<Item> items =
        rows.stream()
            .map(
                row ->
                    new Item(
                        row.id(),
                        row.coinsBet(),
                        row.coinsWon(),
                        row.result().value(),
                        row.details(),
                        row.createdAt() == null ? null : row.createdAt().toString()))
            .toList();
    return new GameRecordsResponse(userId, gameType, items);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @SuppressFBWarnings(
      value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
      justification = "details はシリアライズ専用の読み取り値のため")
  public record Item(
      Long id, long coinsBet, long coinsWon, String result, JsonNode details, String createdAt) {}
}
