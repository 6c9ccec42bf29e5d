/*
 * どこで: Minigame サービス層
 * 何を: ルームの作成/参加/開始/行動/精算/取消を、game_type に対応するエンジンへ振り分ける
 * なぜ: 掛け金の移動とルーム更新を同一トランザクションで確定させ、ゲーム種別ごとの実装を持たないため
 */
package com.example.minigame.service;

import com.example.common.Ids;
import com.example.minigame.api.ActiveRoomExistsException;
import com.example.minigame.api.GameActionRejectedException;
import com.example.minigame.api.InsufficientCoinsException;
import com.example.minigame.api.InvalidRoomTransitionException;
import com.example.minigame.api.RoomAccessDeniedException;
import com.example.minigame.api.RoomConcurrentModificationException;
import com.example.minigame.api.RoomNotFoundException;
import com.example.minigame.api.RoomNotJoinableException;
import com.example.minigame.api.UnsupportedGameTypeException;
import com.example.minigame.api.request.CreateRoomRequest;
import com.example.minigame.api.request.GameActionRequest;
import com.example.minigame.api.response.ChannelRoomsResponse;
import com.example.minigame.api.response.GameCatalogResponse;
import com.example.minigame.api.response.GameSummaryResponse;
import com.example.minigame.api.response.RoomCommandResponse;
import com.example.minigame.api.response.RoomListResponse;
import com.example.minigame.api.response.RoomResponse;
import com.example.minigame.api.response.SettlementResponse;
import com.example.minigame.config.MinigameProperties;
import com.example.minigame.engine.GameActionResult;
import com.example.minigame.engine.GameEngine;
import com.example.minigame.engine.GameEngineRegistry;
import com.example.minigame.engine.GameResult;
import com.example.minigame.engine.GameTable;
import com.example.minigame.model.GameOutcome;
import com.example.minigame.model.GameResultRecord;
import com.example.minigame.model.GameRoomRecord;
import com.example.minigame.model.RoomStatus;
import com.example.minigame.model.UserRecord;
import com.example.minigame.repository.GameRecordRepository;
import com.example.minigame.repository.GameRoomRepository;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class GameRoomService {

  private static final Logger logger = LoggerFactory.getLogger(GameRoomService.class);
  private static final int ROOM_ID_LENGTH = 8;
  private static final int ROOM_ID_ATTEMPTS = 5;

  private final GameEngineRegistry engineRegistry;
  private final GameRoomRepository roomRepository;
  private final GameRecordRepository recordRepository;
  private final UserService userService;
  private final GameRoomMetrics metrics;
  private final MinigameProperties properties;
  private final Clock clock;

  public GameCatalogResponse availableGames() {
    final List<GameSummaryResponse> games =
        engineRegistry.all().stream().map(GameSummaryResponse::from).toList();
    return new GameCatalogResponse(games);
  }

  @Transactional
  public RoomCommandResponse createRoom(
      String creatorId, String creatorName, CreateRoomRequest request) {
    final GameEngine engine = requireEngine(request.gameType());
    final long bet = request.betAmount();
    if (bet < engine.minBet() || bet > engine.maxBet()) {
      throw new IllegalArgumentException(
          "bet_amount must be between " + engine.minBet() + " and " + engine.maxBet());
    }
    final UserRecord creator = userService.getOrCreate(creatorId, creatorName);
    if (!creator.canAfford(bet)) {
      throw new InsufficientCoinsException(creatorId, creator.coins(), bet);
    }
    // 1 人が同時に持てる進行中ルームは 1 つ (チャンネル単位ではなく個人単位)
    if (!roomRepository.findByUser(creatorId, RoomStatus.WAITING).isEmpty()
        || !roomRepository.findByUser(creatorId, RoomStatus.PLAYING).isEmpty()) {
      throw new ActiveRoomExistsException(creatorId);
    }

    final Instant now = Instant.now(clock);
    final ArrayNode players = JsonNodeFactory.instance.arrayNode();
    players.add(newPlayer(creatorId, creatorName, now));
    final GameRoomRecord draft =
        new GameRoomRecord(
            newRoomId(),
            engine.gameType(),
            request.channelId(),
            creatorId,
            creatorName,
            bet,
            RoomStatus.WAITING,
            engine.maxPlayers(),
            engine.minPlayers(),
            players,
            JsonNodeFactory.instance.objectNode(),
            JsonNodeFactory.instance.objectNode(),
            now,
            null,
            null,
            0);
    final ObjectNode gameData = engine.initializeGameData(GameTable.from(draft));
    final GameRoomRecord room =
        draft.withState(RoomStatus.WAITING, players, gameData, null, null);

    userService.spendCoins(creatorId, bet, engine.displayName() + "游戏下注 #" + room.id());
    roomRepository.insert(room);
    metrics.recordRoomEvent("created");
    logger.info(
        "room created room_id={} game_type={} channel_id={} creator_id={} bet={}",
        room.id(),
        room.gameType(),
        room.channelId(),
        creatorId,
        bet);

    final String message =
        String.join(
            "\n",
            engine.displayName() + " #" + room.id() + " 已创建！",
            "创建者: " + creatorName,
            "下注金额: " + bet + " 金币",
            "当前玩家: 1/" + room.maxPlayers(),
            room.minPlayers() + "人以上可开始游戏");
    return RoomCommandResponse.of(message, toResponse(room, engine));
  }

  @Transactional
  public RoomCommandResponse joinRoom(String roomId, String userId, String username) {
    final GameRoomRecord room = requireRoom(roomId);
    final GameEngine engine = requireEngine(room.gameType());
    if (room.status() != RoomStatus.WAITING) {
      throw new RoomNotJoinableException(
          "room is not accepting players: " + roomId + " status=" + room.status().value());
    }
    if (room.hasPlayer(userId)) {
      throw new RoomNotJoinableException("already joined: " + roomId);
    }
    if (room.isFull()) {
      throw new RoomNotJoinableException("room is full: " + roomId + " max=" + room.maxPlayers());
    }
    final UserRecord user = userService.getOrCreate(userId, username);
    if (!user.canAfford(room.betAmount())) {
      throw new InsufficientCoinsException(userId, user.coins(), room.betAmount());
    }

    userService.spendCoins(userId, room.betAmount(), engine.displayName() + "游戏下注 #" + roomId);
    final ArrayNode players = room.players().deepCopy();
    players.add(newPlayer(userId, username, Instant.now(clock)));
    final GameRoomRecord saved =
        save(
            room.withState(
                RoomStatus.WAITING, players, room.gameData(), room.startedAt(), null));
    metrics.recordRoomEvent("joined");
    logger.info(
        "room joined room_id={} user_id={} players={}/{}",
        roomId,
        userId,
        saved.playerCount(),
        saved.maxPlayers());

    final boolean canStart = saved.playerCount() >= saved.minPlayers();
    final String message =
        String.join(
            "\n",
            username + " 已加入 " + engine.displayName() + " #" + roomId + "！",
            "当前玩家: " + saved.playerCount() + "/" + saved.maxPlayers(),
            canStart
                ? "创建者 " + saved.creatorName() + " 可以开始游戏"
                : "等待更多玩家加入（至少" + saved.minPlayers() + "人）");
    return RoomCommandResponse.of(message, toResponse(saved, engine));
  }

  @Transactional
  public RoomCommandResponse startRoom(String roomId, String userId) {
    final GameRoomRecord room = requireRoom(roomId);
    final GameEngine engine = requireEngine(room.gameType());
    if (!room.isCreatedBy(userId)) {
      throw new RoomAccessDeniedException("only the creator can start room " + roomId);
    }
    requireTransition(room, RoomStatus.PLAYING);
    final GameTable table = GameTable.from(room);
    if (room.playerCount() < room.minPlayers() || !engine.canStart(table)) {
      throw new InvalidRoomTransitionException(
          "at least " + room.minPlayers() + " players are required to start room " + roomId);
    }

    final String message = engine.start(table);
    final GameRoomRecord saved =
        save(
            room.withState(
                RoomStatus.PLAYING, table.players(), table.gameData(), Instant.now(clock), null));
    metrics.recordRoomEvent("started");
    logger.info("room started room_id={} players={}", roomId, saved.playerCount());
    return RoomCommandResponse.of(message, toResponse(saved, engine));
  }

  @Transactional
  public RoomCommandResponse processAction(
      String roomId, String userId, GameActionRequest request) {
    final GameRoomRecord room = requireRoom(roomId);
    final GameEngine engine = requireEngine(room.gameType());
    if (room.status() != RoomStatus.PLAYING) {
      throw new InvalidRoomTransitionException(
          "room is not playing: " + roomId + " status=" + room.status().value());
    }
    if (!room.hasPlayer(userId)) {
      throw new GameActionRejectedException("user is not a player of room " + roomId);
    }

    final GameTable table = GameTable.from(room);
    final GameActionResult result;
    try {
      result = engine.processAction(table, userId, request.action(), request.params());
    } catch (GameActionRejectedException ex) {
      metrics.recordAction(room.gameType(), "rejected");
      throw ex;
    }
    metrics.recordAction(room.gameType(), "accepted");

    if (engine.isFinished(table)) {
      final Settlement settlement = finish(room, table, engine);
      return new RoomCommandResponse(
          result.message(),
          toResponse(settlement.room(), engine),
          false,
          settlement.response());
    }
    final GameRoomRecord saved =
        save(
            room.withState(
                RoomStatus.PLAYING,
                table.players(),
                table.gameData(),
                room.startedAt(),
                null));
    return new RoomCommandResponse(
        result.message(), toResponse(saved, engine), result.gameContinues(), null);
  }

  @Transactional
  public RoomCommandResponse cancelRoom(String roomId, String userId) {
    final GameRoomRecord room = requireRoom(roomId);
    if (!room.isCreatedBy(userId)) {
      throw new RoomAccessDeniedException("only the creator can cancel room " + roomId);
    }
    requireTransition(room, RoomStatus.CANCELLED);

    final GameRoomRecord saved =
        save(
            room.withState(
                RoomStatus.CANCELLED,
                room.players(),
                room.gameData(),
                room.startedAt(),
                Instant.now(clock)));
    for (String playerId : room.playerIds()) {
      userService.addCoins(playerId, room.betAmount(), "游戏取消退款 #" + roomId);
    }
    metrics.recordRoomEvent("cancelled");
    logger.info("room cancelled room_id={} refunded_players={}", roomId, room.playerCount());

    final String message = "游戏房间 #" + roomId + " 已取消，所有玩家的金币已退还。";
    return RoomCommandResponse.of(
        message, toResponse(saved, engineRegistry.find(room.gameType()).orElse(null)));
  }

  public RoomResponse getRoom(String roomId) {
    final GameRoomRecord room = requireRoom(roomId);
    return toResponse(room, engineRegistry.find(room.gameType()).orElse(null));
  }

  public ChannelRoomsResponse listChannelRooms(String channelId, String gameType) {
    final String type = gameType == null || gameType.isBlank() ? null : gameType;
    final List<RoomResponse> playing =
        toResponses(roomRepository.findByChannel(channelId, type, RoomStatus.PLAYING));
    final List<RoomResponse> waiting =
        toResponses(roomRepository.findByChannel(channelId, type, RoomStatus.WAITING));
    return new ChannelRoomsResponse(channelId, playing, waiting);
  }

  public RoomListResponse listUserRooms(String userId, String status) {
    final RoomStatus filter =
        status == null || status.isBlank() ? null : RoomStatus.fromValue(status);
    return new RoomListResponse(toResponses(roomRepository.findByUser(userId, filter)));
  }

  private Settlement finish(GameRoomRecord room, GameTable table, GameEngine engine) {
    final Instant now = Instant.now(clock);
    final GameResult result = engine.result(table);
    // 先にルームを finished で確定させ、同時に届いた行動による二重精算を防ぐ
    final GameRoomRecord finished =
        save(
            room.withState(
                RoomStatus.FINISHED, table.players(), table.gameData(), room.startedAt(), now));

    final long pot = finished.pot();
    final List<String> winners = result.winners();
    final long prize = winners.isEmpty() ? 0 : pot / winners.size();
    for (String winnerId : winners) {
      userService.addCoins(winnerId, prize, engine.displayName() + "游戏获胜 #" + room.id());
      if (properties.winnerExperience() > 0) {
        userService.addExperience(winnerId, properties.winnerExperience());
      }
    }

    final ObjectNode details = JsonNodeFactory.instance.objectNode();
    details.put("room_id", room.id());
    details.put("total_players", finished.playerCount());
    details.set("game_result", result.details());
    for (String playerId : finished.playerIds()) {
      final boolean winner = result.isWinner(playerId);
      recordRepository.insert(
          new GameResultRecord(
              null,
              playerId,
              room.gameType(),
              room.betAmount(),
              winner ? prize : 0,
              winner ? GameOutcome.WIN : GameOutcome.LOSE,
              details,
              now));
    }
    metrics.recordRoomEvent("finished");
    metrics.recordPayout(room.gameType(), prize * winners.size());
    logger.info(
        "room finished room_id={} pot={} winners={} prize_per_winner={}",
        room.id(),
        pot,
        winners,
        prize);
    return new Settlement(finished, new SettlementResponse(pot, prize, winners));
  }

  private GameRoomRecord save(GameRoomRecord room) {
    if (!roomRepository.updateIfVersionMatches(room)) {
      throw new RoomConcurrentModificationException(room.id(), room.version());
    }
    return room.nextVersion();
  }

  private GameRoomRecord requireRoom(String roomId) {
    return roomRepository.findById(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
  }

  private GameEngine requireEngine(String gameType) {
    return engineRegistry
        .find(gameType)
        .orElseThrow(() -> new UnsupportedGameTypeException(gameType));
  }

  private void requireTransition(GameRoomRecord room, RoomStatus next) {
    if (!room.status().canTransitionTo(next)) {
      throw new InvalidRoomTransitionException(
          "room "
              + room.id()
              + " cannot move from "
              + room.status().value()
              + " to "
              + next.value());
    }
  }

  private String newRoomId() {
    for (int attempt = 0; attempt < ROOM_ID_ATTEMPTS; attempt++) {
      final String candidate = Ids.newShortId(ROOM_ID_LENGTH);
      if (roomRepository.findById(candidate).isEmpty()) {
        return candidate;
      }
    }
    throw new IllegalStateException("failed to allocate a unique room id");
  }

  private ObjectNode newPlayer(String userId, String username, Instant joinedAt) {
    final ObjectNode player = JsonNodeFactory.instance.objectNode();
    player.put("user_id", userId);
    player.put("username", username);
    player.put("joined_at", joinedAt.toString());
    return player;
  }

  private List<RoomResponse> toResponses(List<GameRoomRecord> rooms) {
    return rooms.stream()
        .map(room -> toResponse(room, engineRegistry.find(room.gameType()).orElse(null)))
        .toList();
  }

  private RoomResponse toResponse(GameRoomRecord room, GameEngine engine) {
    final String gameName = engine == null ? room.gameType() : engine.displayName();
    return RoomResponse.of(room, gameName, statusText(room, engine));
  }

  private String statusText(GameRoomRecord room, GameEngine engine) {
    if (engine != null && room.status() == RoomStatus.PLAYING) {
      return engine.statusText(GameTable.from(room));
    }
    return switch (room.status()) {
      case WAITING -> "等待中 " + room.playerCount() + "/" + room.maxPlayers() + " 名玩家";
      case PLAYING -> "进行中";
      case FINISHED -> "已结束";
      case CANCELLED -> "已取消";
    };
  }

  private record Settlement(GameRoomRecord room, SettlementResponse response) {}
}
