package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** 終局時の配当。prizePerWinner は pot を勝者数で割った切り捨て値。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettlementResponse(long pot, long prizePerWinner, List<String> winners) {

  public SettlementResponse {
    winners = List.copyOf(winners);
  }
}
