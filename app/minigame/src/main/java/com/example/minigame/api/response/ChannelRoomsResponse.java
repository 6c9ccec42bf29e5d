package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChannelRoomsResponse(
    String channelId, List<RoomResponse> playing, List<RoomResponse> waiting) {

  public ChannelRoomsResponse {
    playing = List.copyOf(playing);
    waiting = List.copyOf(waiting);
  }
}
