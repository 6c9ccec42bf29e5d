/*
 * どこで: GameRoomRepository の統合テスト
 * 何を: JSON 列の往復、version 条件付き更新、参加者検索を検証する
 * なぜ: 同時更新の負け側が必ず検出され、players 配列からルームを引けることを保証するため
 */
package com.example.minigame.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.minigame.AbstractSqliteTest;
import com.example.minigame.model.GameRoomRecord;
import com.example.minigame.model.RoomStatus;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class GameRoomRepositoryTest extends AbstractSqliteTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

  @Autowired private GameRoomRepository roomRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    TestTables.truncate(jdbcTemplate);
  }

  @Test
  void insertAndFindRoundTripsJsonColumns() {
    final ObjectNode gameData = JSON.objectNode().put("bullet_position", 4);
    roomRepository.insert(room("room0001", "ch-1", RoomStatus.WAITING, players("u1"), gameData));

    final GameRoomRecord found = roomRepository.findById("room0001").orElseThrow();

    assertThat(found.playerIds()).containsExactly("u1");
    assertThat(found.gameData()).isEqualTo(gameData);
    assertThat(found.status()).isEqualTo(RoomStatus.WAITING);
    assertThat(found.createdAt()).isEqualTo(NOW);
    assertThat(found.version()).isZero();
  }

  @Test
  void staleVersionUpdateIsRejected() {
    final GameRoomRecord room =
        room("room0001", "ch-1", RoomStatus.WAITING, players("u1"), JSON.objectNode());
    roomRepository.insert(room);

    final boolean first =
        roomRepository.updateIfVersionMatches(
            room.withState(RoomStatus.WAITING, players("u1", "u2"), room.gameData(), null, null));
    final boolean stale =
        roomRepository.updateIfVersionMatches(
            room.withState(RoomStatus.WAITING, players("u1", "u3"), room.gameData(), null, null));

    final GameRoomRecord found = roomRepository.findById("room0001").orElseThrow();
    assertThat(first).isTrue();
    assertThat(stale).isFalse();
    assertThat(found.playerIds()).containsExactly("u1", "u2");
    assertThat(found.version()).isEqualTo(1);
  }

  @Test
  void findByUserMatchesParticipantsAndCreator() {
    roomRepository.insert(
        room("room0001", "ch-1", RoomStatus.WAITING, players("u1", "u2"), JSON.objectNode()));
    roomRepository.insert(
        room("room0002", "ch-1", RoomStatus.FINISHED, players("u3", "u2"), JSON.objectNode()));
    roomRepository.insert(
        room("room0003", "ch-2", RoomStatus.WAITING, players("u4"), JSON.objectNode()));

    final List<GameRoomRecord> all = roomRepository.findByUser("u2", null);
    final List<GameRoomRecord> waiting = roomRepository.findByUser("u2", RoomStatus.WAITING);

    assertThat(all)
        .extracting(GameRoomRecord::id)
        .containsExactlyInAnyOrder("room0001", "room0002");
    assertThat(waiting).extracting(GameRoomRecord::id).containsExactly("room0001");
    assertThat(roomRepository.findByUser("u22", null)).isEmpty();
  }

  @Test
  void findByChannelFiltersByStatusAndType() {
    roomRepository.insert(
        room("room0001", "ch-1", RoomStatus.WAITING, players("u1"), JSON.objectNode()));
    roomRepository.insert(
        room("room0002", "ch-1", RoomStatus.PLAYING, players("u2", "u3"), JSON.objectNode()));

    assertThat(roomRepository.findByChannel("ch-1", "russian_roulette", RoomStatus.PLAYING))
        .extracting(GameRoomRecord::id)
        .containsExactly("room0002");
    assertThat(roomRepository.findByChannel("ch-1", "poker", null)).isEmpty();
    assertThat(roomRepository.findByChannel("ch-1", null, null)).hasSize(2);
  }

  @Test
  void corruptJsonColumnsReadAsEmpty() {
    roomRepository.insert(
        room("room0001", "ch-1", RoomStatus.WAITING, players("u1"), JSON.objectNode()));
    jdbcTemplate.update(
        "UPDATE game_rooms SET players = 'not json', game_data = '{broken' WHERE id = 'room0001'");

    final GameRoomRecord found = roomRepository.findById("room0001").orElseThrow();

    assertThat(found.players()).isEmpty();
    assertThat(found.gameData()).isEmpty();
    assertThat(roomRepository.findByUser("u9", null)).isEmpty();
  }

  private ArrayNode players(String... userIds) {
    final ArrayNode players = JSON.arrayNode();
    for (String userId : userIds) {
      players.add(JSON.objectNode().put("user_id", userId).put("username", "name-" + userId));
    }
    return players;
  }

  private GameRoomRecord room(
      String id, String channelId, RoomStatus status, ArrayNode players, ObjectNode gameData) {
    return new GameRoomRecord(
        id,
        "russian_roulette",
        channelId,
        players.get(0).path("user_id").asText(),
        "creator",
        200,
        status,
        6,
        2,
        players,
        gameData,
        JSON.objectNode(),
        NOW,
        null,
        null,
        0);
  }
}
