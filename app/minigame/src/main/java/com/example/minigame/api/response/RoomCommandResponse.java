/*
 * どこで: Minigame API レスポンス DTO
 * 何を: create/join/start/action/cancel 共通の成功応答を定義する
 * なぜ: ボットがそのまま投稿できるメッセージと、最新のルーム状態を一度に返すため
 */
package com.example.minigame.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomCommandResponse(
    String message, RoomResponse room, Boolean gameContinues, SettlementResponse settlement) {

  public static RoomCommandResponse of(String message, RoomResponse room) {
    return new RoomCommandResponse(message, room, null, null);
  }
}
