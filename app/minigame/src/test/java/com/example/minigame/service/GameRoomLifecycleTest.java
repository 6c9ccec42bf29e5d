package com.example.minigame.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.minigame.AbstractSqliteTest;
import com.example.minigame.api.InvalidRoomTransitionException;
import com.example.minigame.api.request.CreateRoomRequest;
import com.example.minigame.api.request.GameActionRequest;
import com.example.minigame.api.response.RoomCommandResponse;
import com.example.minigame.model.GameRoomRecord;
import com.example.minigame.model.RoomStatus;
import com.example.minigame.repository.GameRecordRepository;
import com.example.minigame.repository.GameRoomRepository;
import com.example.minigame.repository.TestTables;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class GameRoomLifecycleTest extends AbstractSqliteTest {

  private static final List<String> PLAYERS = List.of("u1", "u2", "u3");

  @Autowired private GameRoomService gameRoomService;
  @Autowired private UserService userService;
  @Autowired private GameRoomRepository roomRepository;
  @Autowired private GameRecordRepository recordRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    TestTables.truncate(jdbcTemplate);
  }

  @Test
  void roomPlaysToSettlementAndConservesCoins() {
    final long before = PLAYERS.stream().mapToLong(this::coinsOfNewPlayer).sum();

    final String roomId =
        gameRoomService
            .createRoom("u1", "user-u1", new CreateRoomRequest("russian_roulette", "c1", 200L))
            .room()
            .roomId();
    gameRoomService.joinRoom(roomId, "u2", "user-u2");
    gameRoomService.joinRoom(roomId, "u3", "user-u3");
    gameRoomService.startRoom(roomId, "u1");

    RoomCommandResponse last = null;
    for (int turn = 0; turn < 20; turn++) {
      last =
          gameRoomService.processAction(
              roomId, currentPlayer(roomId), new GameActionRequest("shoot", null));
      if (last.settlement() != null) {
        break;
      }
    }

    assertThat(last).isNotNull();
    assertThat(last.gameContinues()).isFalse();
    assertThat(last.settlement().pot()).isEqualTo(600);
    assertThat(last.settlement().winners()).hasSize(2);
    assertThat(last.settlement().prizePerWinner()).isEqualTo(300);

    final GameRoomRecord finished = roomRepository.findById(roomId).orElseThrow();
    assertThat(finished.status()).isEqualTo(RoomStatus.FINISHED);
    assertThat(finished.finishedAt()).isNotNull();
    assertThat(finished.playerCount()).isBetween(finished.minPlayers(), finished.maxPlayers());

    final long after =
        PLAYERS.stream().mapToLong(userId -> userService.getUser(userId).coins()).sum();
    assertThat(after).isEqualTo(before);
    for (String userId : PLAYERS) {
      assertThat(recordRepository.findByUser(userId, "russian_roulette", 10)).hasSize(1);
    }

    assertThatThrownBy(
            () ->
                gameRoomService.processAction(
                    roomId, "u1", new GameActionRequest("shoot", null)))
        .isInstanceOf(InvalidRoomTransitionException.class);
  }

  @Test
  void cancelledRoomRefundsEveryPlayer() {
    final long initial = coinsOfNewPlayer("u1");
    coinsOfNewPlayer("u2");

    final String roomId =
        gameRoomService
            .createRoom("u1", "user-u1", new CreateRoomRequest("russian_roulette", "c1", 300L))
            .room()
            .roomId();
    gameRoomService.joinRoom(roomId, "u2", "user-u2");
    assertThat(userService.getUser("u2").coins()).isEqualTo(initial - 300);

    gameRoomService.cancelRoom(roomId, "u1");

    assertThat(userService.getUser("u1").coins()).isEqualTo(initial);
    assertThat(userService.getUser("u2").coins()).isEqualTo(initial);
    assertThat(roomRepository.findById(roomId).orElseThrow().status())
        .isEqualTo(RoomStatus.CANCELLED);
  }

  private long coinsOfNewPlayer(String userId) {
    return userService.getOrCreate(userId, "user-" + userId).coins();
  }

  private String currentPlayer(String roomId) {
    final GameRoomRecord room = roomRepository.findById(roomId).orElseThrow();
    final int index = room.gameData().path("current_player_index").asInt();
    return room.players().get(index).path("user_id").asText();
  }
}
