/*
 * どこで: Minigame API レスポンス DTO
 * 何を: ルームの公開ビューを定義する
 * なぜ: game_data (弾の位置など) を隠したまま、参加者と進行状況だけを返すため
 */
package com.example.minigame.api.response;

import com.example.minigame.model.GameRoomRecord;
import com.example.minigame.model.RoomStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "players はシリアライズ専用のコピーを保持するため")
public record RoomResponse(
    String roomId,
    String gameType,
    String gameName,
    String channelId,
    String creatorId,
    String creatorName,
    long betAmount,
    String status,
    int minPlayers,
    int maxPlayers,
    int playerCount,
    long pot,
    boolean canStart,
    JsonNode players,
    String statusText,
    String createdAt,
    String startedAt,
    String finishedAt) {

  public static RoomResponse of(GameRoomRecord room, String gameName, String statusText) {
    return new RoomResponse(
        room.id(),
        room.gameType(),
        gameName,
        room.channelId(),
        room.creatorId(),
        room.creatorName(),
        room.betAmount(),
        room.status().value(),
        room.minPlayers(),
        room.maxPlayers(),
        room.playerCount(),
        room.pot(),
        room.status() == RoomStatus.WAITING && room.playerCount() >= room.minPlayers(),
        room.players() == null ? null : room.players().deepCopy(),
        statusText,
        toIsoOrNull(room.createdAt()),
        toIsoOrNull(room.startedAt()),
        toIsoOrNull(room.finishedAt()));
  }

  private static String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
