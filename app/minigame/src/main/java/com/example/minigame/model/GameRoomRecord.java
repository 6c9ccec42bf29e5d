/*
 * どこで: Minigame ドメインモデル
 * 何を: game_rooms テーブルの 1 行 (1 セッション) を表す
 * なぜ: ゲーム種別に依存しない共通列と、エンジン所有の JSON 列をまとめて扱うため
 */
package com.example.minigame.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * ゲームルーム。
 *
 * <p>{@code players} の各要素は最低限 {@code user_id}/{@code username}/{@code joined_at} を持ち、
 * エンジンが独自フィールドを追加する。{@code gameData} と {@code settings} の中身はエンジンが所有し、
 * スキーマ側では解釈しない。{@code version} は楽観ロック用で、更新のたびに 1 増える。
 */
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "JSON 列は変更前に GameTable へ deepCopy してから編集するため")
public record GameRoomRecord(
    String id,
    String gameType,
    String channelId,
    String creatorId,
    String creatorName,
    long betAmount,
    RoomStatus status,
    int maxPlayers,
    int minPlayers,
    ArrayNode players,
    ObjectNode gameData,
    ObjectNode settings,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    long version) {

  public int playerCount() {
    return players == null ? 0 : players.size();
  }

  public boolean hasPlayer(String userId) {
    return playerIds().contains(userId);
  }

  public List<String> playerIds() {
    final List<String> ids = new ArrayList<>();
    if (players == null) {
      return ids;
    }
    for (JsonNode player : players) {
      ids.add(player.path("user_id").asText());
    }
    return ids;
  }

  public boolean isFull() {
    return playerCount() >= maxPlayers;
  }

  public long pot() {
    return betAmount * playerCount();
  }

  public boolean isCreatedBy(String userId) {
    return creatorId.equals(userId);
  }

  public GameRoomRecord withState(
      RoomStatus newStatus,
      ArrayNode newPlayers,
      ObjectNode newGameData,
      Instant newStartedAt,
      Instant newFinishedAt) {
    return new GameRoomRecord(
        id,
        gameType,
        channelId,
        creatorId,
        creatorName,
        betAmount,
        newStatus,
        maxPlayers,
        minPlayers,
        newPlayers,
        newGameData,
        settings,
        createdAt,
        newStartedAt,
        newFinishedAt,
        version);
  }

  public GameRoomRecord withStatus(RoomStatus newStatus) {
    return withState(newStatus, players, gameData, startedAt, finishedAt);
  }

  public GameRoomRecord nextVersion() {
    return new GameRoomRecord(
        id,
        gameType,
        channelId,
        creatorId,
        creatorName,
        betAmount,
        status,
        maxPlayers,
        minPlayers,
        players,
        gameData,
        settings,
        createdAt,
        startedAt,
        finishedAt,
        version + 1);
  }
}
