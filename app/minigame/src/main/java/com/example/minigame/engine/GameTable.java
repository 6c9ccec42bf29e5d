/*
 * どこで: Minigame エンジン層
 * 何を: エンジンが編集するルーム状態の作業コピー
 * なぜ: エンジンが拒否/例外で中断しても永続化済みのルームレコードを汚さないため
 */
package com.example.minigame.engine;

import com.example.minigame.model.GameRoomRecord;
import com.example.minigame.model.RoomStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "エンジンが players/game_data を直接編集することがこのクラスの役割のため")
public final class GameTable {

  private final String roomId;
  private final long betAmount;
  private final RoomStatus status;
  private ArrayNode players;
  private ObjectNode gameData;

  private GameTable(
      String roomId, long betAmount, RoomStatus status, ArrayNode players, ObjectNode gameData) {
    this.roomId = roomId;
    this.betAmount = betAmount;
    this.status = status;
    this.players = players;
    this.gameData = gameData;
  }

  public static GameTable from(GameRoomRecord room) {
    final ArrayNode players =
        room.players() == null ? JsonNodeFactory.instance.arrayNode() : room.players().deepCopy();
    final ObjectNode gameData =
        room.gameData() == null
            ? JsonNodeFactory.instance.objectNode()
            : room.gameData().deepCopy();
    return new GameTable(room.id(), room.betAmount(), room.status(), players, gameData);
  }

  public String roomId() {
    return roomId;
  }

  public long betAmount() {
    return betAmount;
  }

  public RoomStatus status() {
    return status;
  }

  public ArrayNode players() {
    return players;
  }

  public ObjectNode gameData() {
    return gameData;
  }

  public void replaceGameData(ObjectNode newGameData) {
    this.gameData = newGameData;
  }

  public void replacePlayers(List<? extends JsonNode> ordered) {
    final ArrayNode reordered = JsonNodeFactory.instance.arrayNode();
    reordered.addAll(new ArrayList<JsonNode>(ordered));
    this.players = reordered;
  }

  public int playerCount() {
    return players.size();
  }

  public ObjectNode player(int index) {
    return (ObjectNode) players.get(index);
  }

  public long pot() {
    return betAmount * playerCount();
  }
}
