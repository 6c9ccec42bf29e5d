/*
 * どこで: Minigame データアクセス
 * 何を: game_rooms の登録/更新/参照を行う
 * なぜ: version 条件付き UPDATE で 1 ルーム 1 ライターを保証するため
 */
package com.example.minigame.repository;

import static com.example.common.SqliteTimestamps.fromText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.minigame.model.GameRoomRecord;
import com.example.minigame.model.RoomStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class GameRoomRepository {

  private static final String COLUMNS =
      """
      id, game_type, channel_id, creator_id, creator_name, bet_amount, status, max_players,
      min_players, players, game_data, settings, created_at, started_at, finished_at, version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  public void insert(GameRoomRecord room) {
    final String sql =
        """
        INSERT INTO game_rooms (
          id, game_type, channel_id, creator_id, creator_name, bet_amount, status,
          max_players, min_players, players, game_data, settings, created_at,
          started_at, finished_at, version
        ) VALUES (
          :id, :gameType, :channelId, :creatorId, :creatorName, :betAmount, :status,
          :maxPlayers, :minPlayers, :players, :gameData, :settings, :createdAt,
          :startedAt, :finishedAt, :version
        )
        """;
    final MapSqlParameterSource params =
        stateParams(room)
            .addValue("gameType", room.gameType())
            .addValue("channelId", room.channelId())
            .addValue("creatorId", room.creatorId())
            .addValue("creatorName", room.creatorName())
            .addValue("betAmount", room.betAmount())
            .addValue("maxPlayers", room.maxPlayers())
            .addValue("minPlayers", room.minPlayers())
            .addValue("createdAt", toText(room.createdAt()))
            .addValue("version", room.version());
    jdbcTemplate.update(sql, params);
  }

  /**
   * 役割: ルームの可変列を保存する。
   * 動作: room.version() と DB の version が一致する場合のみ更新し、version を 1 進める。
   * 戻り値: 更新できた場合 true。他の書き込みが先行していた場合 false。
   */
  public boolean updateIfVersionMatches(GameRoomRecord room) {
    final String sql =
        """
        UPDATE game_rooms SET
          status = :status,
          players = :players,
          game_data = :gameData,
          settings = :settings,
          started_at = :startedAt,
          finished_at = :finishedAt,
          version = version + 1
        WHERE id = :id AND version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        stateParams(room).addValue("expectedVersion", room.version());
    return jdbcTemplate.update(sql, params) == 1;
  }

  public Optional<GameRoomRecord> findById(String roomId) {
    final String sql = "SELECT " + COLUMNS + " FROM game_rooms WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", roomId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 作成者または参加者として関わっているルーム。status が null なら全状態。 */
  public List<GameRoomRecord> findByUser(String userId, RoomStatus status) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(
                """
                 FROM game_rooms
                WHERE (creator_id = :userId
                  OR EXISTS (
                    SELECT 1
                    FROM json_each(
                      CASE WHEN json_valid(game_rooms.players) THEN game_rooms.players ELSE '[]' END
                    ) AS p
                    WHERE json_extract(p.value, '$.user_id') = :userId))
                """);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    if (status != null) {
      sql.append(" AND status = :status");
      params.addValue("status", status.value());
    }
    sql.append(" ORDER BY created_at DESC");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public List<GameRoomRecord> findByChannel(
      String channelId, String gameType, RoomStatus status) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM game_rooms WHERE channel_id = :channelId");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("channelId", channelId);
    if (gameType != null) {
      sql.append(" AND game_type = :gameType");
      params.addValue("gameType", gameType);
    }
    if (status != null) {
      sql.append(" AND status = :status");
      params.addValue("status", status.value());
    }
    sql.append(" ORDER BY created_at DESC");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  private MapSqlParameterSource stateParams(GameRoomRecord room) {
    return new MapSqlParameterSource()
        .addValue("id", room.id())
        .addValue("status", room.status().value())
        .addValue("players", jsonColumns.write(room.players()))
        .addValue("gameData", jsonColumns.write(room.gameData()))
        .addValue("settings", jsonColumns.write(room.settings()))
        .addValue("startedAt", toText(room.startedAt()))
        .addValue("finishedAt", toText(room.finishedAt()));
  }

  private GameRoomRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GameRoomRecord(
        rs.getString("id"),
        rs.getString("game_type"),
        rs.getString("channel_id"),
        rs.getString("creator_id"),
        rs.getString("creator_name"),
        rs.getLong("bet_amount"),
        RoomStatus.fromValue(rs.getString("status")),
        rs.getInt("max_players"),
        rs.getInt("min_players"),
        jsonColumns.readArray(rs.getString("players")),
        jsonColumns.readObject(rs.getString("game_data")),
        jsonColumns.readObject(rs.getString("settings")),
        fromText(rs.getString("created_at")),
        fromText(rs.getString("started_at")),
        fromText(rs.getString("finished_at")),
        rs.getLong("version"));
  }
}
