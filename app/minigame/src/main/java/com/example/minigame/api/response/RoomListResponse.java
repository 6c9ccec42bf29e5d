package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RoomListResponse(List<RoomResponse> rooms) {

  public RoomListResponse {
    rooms = List.copyOf(rooms);
  }
}
