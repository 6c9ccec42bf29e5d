package com.example.minigame.api.response;

import com.example.minigame.model.LeaderboardEntry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeaderboardResponse(List<Entry> entries, int limit, int offset) {

  public LeaderboardResponse {
    entries = List.copyOf(entries);
  }

  public static LeaderboardResponse from(List<LeaderboardEntry> rows, int limit, int offset) {
    final List<Entry> entries =
        rows.stream()
            .map(
                row ->
                    new Entry(
                        row.rank(), row.userId(), row.username(), row.score(), row.title()))
            .toList();
    return new LeaderboardResponse(entries, limit, offset);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(int rank, String userId, String username, long coins, String title) {}
}
