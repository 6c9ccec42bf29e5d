/*
 * どこで: Minigame エンジン層
 * 何を: ロシアンルーレット (6 穴シリンダー / 弾 1 発) のルールを実装する
 * なぜ: 統合 game_rooms テーブル上で動く最初のエンジンとして旧専用テーブルの挙動を引き継ぐため
 */
package com.example.minigame.engine;

import com.example.minigame.api.GameActionRejectedException;
import com.example.minigame.model.RoomStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

@Component
public class RussianRouletteEngine implements GameEngine {

  public static final String GAME_TYPE = "russian_roulette";
  static final String ACTION_SHOOT = "shoot";
  static final int CHAMBER_COUNT = 6;
  static final int MAX_SHOTS_PER_TURN = 3;

  private static final String BULLET_POSITION = "bullet_position";
  private static final String CURRENT_POSITION = "current_position";
  private static final String CURRENT_PLAYER_INDEX = "current_player_index";
  private static final String CHAMBER_COUNT_KEY = "chamber_count";
  private static final String BULLETS_COUNT = "bullets_count";
  private static final String IS_ALIVE = "is_alive";
  private static final String SHOTS_FIRED = "shots_fired";

  private final Random random;

  public RussianRouletteEngine() {
    this(new SecureRandom());
  }

  @VisibleForTesting
  public RussianRouletteEngine(Random random) {
    this.random = random;
  }

  @Override
  public String gameType() {
    return GAME_TYPE;
  }

  @Override
  public String displayName() {
    return "俄罗斯轮盘";
  }

  @Override
  public int minPlayers() {
    return 2;
  }

  @Override
  public int maxPlayers() {
    return 6;
  }

  @Override
  public long minBet() {
    return 100;
  }

  @Override
  public long maxBet() {
    return 10_000;
  }

  @Override
  public String rules() {
    return String.join(
        "\n",
        displayName() + "游戏规则",
        "• 转轮有" + CHAMBER_COUNT + "个位置，其中1个位置有子弹",
        "• 玩家轮流开枪，每次可开1-" + MAX_SHOTS_PER_TURN + "枪",
        "• 有人中弹即游戏结束，存活的玩家平分奖池",
        "• 玩家数量: " + minPlayers() + "-" + maxPlayers() + " 人",
        "• 下注范围: " + minBet() + "-" + maxBet() + " 金币",
        "• 创建或加入时立即扣除下注，取消房间会全额退还");
  }

  @Override
  public ObjectNode initializeGameData(GameTable table) {
    final ObjectNode data = JsonNodeFactory.instance.objectNode();
    // 弾の位置は開始時に決める
    data.put(BULLET_POSITION, 0);
    data.put(CURRENT_POSITION, 1);
    data.put(CURRENT_PLAYER_INDEX, 0);
    data.put(CHAMBER_COUNT_KEY, CHAMBER_COUNT);
    data.put(BULLETS_COUNT, 1);
    return data;
  }

  @Override
  public boolean canStart(GameTable table) {
    return table.playerCount() >= minPlayers();
  }

  @Override
  public String start(GameTable table) {
    final ObjectNode data = table.gameData();
    final int chambers = chamberCount(data);
    data.put(BULLET_POSITION, 1 + random.nextInt(chambers));
    data.put(CURRENT_POSITION, 1);
    data.put(CURRENT_PLAYER_INDEX, 0);
    if (!data.has(BULLETS_COUNT)) {
      data.put(BULLETS_COUNT, 1);
    }
    data.put(CHAMBER_COUNT_KEY, chambers);

    final List<ObjectNode> order = new ArrayList<>();
    for (int i = 0; i < table.playerCount(); i++) {
      order.add(table.player(i));
    }
    Collections.shuffle(order, random);
    for (ObjectNode player : order) {
      player.put(IS_ALIVE, true);
      player.put(SHOTS_FIRED, 0);
    }
    table.replacePlayers(order);

    return String.join(
        "\n",
        displayName() + " #" + table.roomId() + " 开始！",
        "参与玩家: " + usernames(table.players()),
        "奖池金额: " + table.pot() + " 金币",
        "转轮弹仓: " + chambers + " 个位置，" + data.path(BULLETS_COUNT).asInt(1) + " 颗子弹",
        "轮到 " + currentPlayer(table).path("username").asText() + " 开枪！");
  }

  @Override
  public GameActionResult processAction(
      GameTable table, String userId, String action, JsonNode params) {
    if (!ACTION_SHOOT.equals(action)) {
      throw new GameActionRejectedException("无效的游戏动作：" + action);
    }
    final ObjectNode shooter = currentPlayer(table);
    if (!shooter.path("user_id").asText().equals(userId)) {
      throw new GameActionRejectedException(
          "现在是 " + shooter.path("username").asText() + " 的回合！");
    }
    final int shots = resolveShots(params);

    final ObjectNode data = table.gameData();
    final int chambers = chamberCount(data);
    final int bullet = data.path(BULLET_POSITION).asInt();
    final String name = shooter.path("username").asText();
    final StringJoiner lines = new StringJoiner("\n");
    boolean hit = false;
    for (int shot = 1; shot <= shots; shot++) {
      final int position = data.path(CURRENT_POSITION).asInt(1);
      if (position == bullet) {
        hit = true;
        shooter.put(IS_ALIVE, false);
        lines.add("第" + shot + "枪：" + name + " 中弹出局！");
        break;
      }
      lines.add("第" + shot + "枪：空枪，" + name + " 安全！");
      data.put(CURRENT_POSITION, position >= chambers ? 1 : position + 1);
    }
    shooter.put(SHOTS_FIRED, shooter.path(SHOTS_FIRED).asInt() + shots);

    if (hit || aliveCount(table) <= 1) {
      return new GameActionResult(lines.toString(), false);
    }
    advanceToNextAlivePlayer(table);
    lines.add("轮到 " + currentPlayer(table).path("username").asText() + " 开枪！");
    return new GameActionResult(lines.toString(), true);
  }

  @Override
  public String statusText(GameTable table) {
    if (table.status() != RoomStatus.PLAYING) {
      return "游戏未在进行中";
    }
    final ObjectNode data = table.gameData();
    final String current = currentPlayer(table).path("user_id").asText();
    final StringJoiner alive = new StringJoiner("\n");
    final StringJoiner dead = new StringJoiner("\n");
    for (JsonNode player : table.players()) {
      final String line =
          player.path("username").asText() + " (开枪" + player.path(SHOTS_FIRED).asInt() + "次)";
      if (player.path(IS_ALIVE).asBoolean(true)) {
        final String marker = player.path("user_id").asText().equals(current) ? "> " : "  ";
        alive.add(marker + line);
      } else {
        dead.add("  " + line);
      }
    }
    final StringBuilder text =
        new StringBuilder()
            .append(displayName())
            .append(" #")
            .append(table.roomId())
            .append(" 进行中\n")
            .append("奖池: ")
            .append(table.pot())
            .append(" 金币\n")
            .append("转轮位置: ")
            .append(data.path(CURRENT_POSITION).asInt(1))
            .append('/')
            .append(chamberCount(data))
            .append('\n')
            .append("存活玩家:\n")
            .append(alive);
    if (dead.length() > 0) {
      text.append("\n阵亡玩家:\n").append(dead);
    }
    return text.toString();
  }

  /** 1 発しか無いため、誰かが被弾した時点で終局。 */
  @Override
  public boolean isFinished(GameTable table) {
    return aliveCount(table) <= 1 || aliveCount(table) < table.playerCount();
  }

  @Override
  public GameResult result(GameTable table) {
    final List<String> winners = new ArrayList<>();
    final ArrayNode winnerNames = JsonNodeFactory.instance.arrayNode();
    for (JsonNode player : table.players()) {
      if (player.path(IS_ALIVE).asBoolean(true)) {
        winners.add(player.path("user_id").asText());
        winnerNames.add(player.path("username").asText());
      }
    }
    final ObjectNode details = JsonNodeFactory.instance.objectNode();
    details.put("total_players", table.playerCount());
    details.put(BULLET_POSITION, table.gameData().path(BULLET_POSITION).asInt());
    details.put("final_position", table.gameData().path(CURRENT_POSITION).asInt());
    final ArrayNode winnerIds = details.putArray("winners");
    winners.forEach(winnerIds::add);
    details.set("winner_names", winnerNames);
    return new GameResult(winners, details);
  }

  private int resolveShots(JsonNode params) {
    final JsonNode shots = params == null ? null : params.get("shots");
    if (shots == null || shots.isNull()) {
      return 1;
    }
    if (!shots.canConvertToInt() || !shots.isIntegralNumber()) {
      throw new GameActionRejectedException("每次可以开1-" + MAX_SHOTS_PER_TURN + "枪！");
    }
    final int value = shots.asInt();
    if (value < 1 || value > MAX_SHOTS_PER_TURN) {
      throw new GameActionRejectedException("每次可以开1-" + MAX_SHOTS_PER_TURN + "枪！");
    }
    return value;
  }

  private ObjectNode currentPlayer(GameTable table) {
    final int index = table.gameData().path(CURRENT_PLAYER_INDEX).asInt();
    if (index < 0 || index >= table.playerCount()) {
      throw new IllegalStateException("current_player_index out of range: " + index);
    }
    return table.player(index);
  }

  private void advanceToNextAlivePlayer(GameTable table) {
    final ObjectNode data = table.gameData();
    int index = data.path(CURRENT_PLAYER_INDEX).asInt();
    for (int attempts = 0; attempts < table.playerCount(); attempts++) {
      index = (index + 1) % table.playerCount();
      if (table.player(index).path(IS_ALIVE).asBoolean(true)) {
        break;
      }
    }
    data.put(CURRENT_PLAYER_INDEX, index);
  }

  private long aliveCount(GameTable table) {
    long alive = 0;
    for (JsonNode player : table.players()) {
      if (player.path(IS_ALIVE).asBoolean(true)) {
        alive++;
      }
    }
    return alive;
  }

  private int chamberCount(ObjectNode data) {
    final int chambers = data.path(CHAMBER_COUNT_KEY).asInt(CHAMBER_COUNT);
    return chambers > 0 ? chambers : CHAMBER_COUNT;
  }

  private String usernames(ArrayNode players) {
    final StringJoiner names = new StringJoiner(", ");
    for (JsonNode player : players) {
      names.add(player.path("username").asText());
    }
    return names.toString();
  }
}
