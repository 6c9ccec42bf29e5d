package com.example.minigame.repository;

import static com.example.common.SqliteTimestamps.fromText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.minigame.model.GameOutcome;
import com.example.minigame.model.GameResultRecord;
import com.example.minigame.model.GameStats;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class GameRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonColumns jsonColumns;

  public void insert(GameResultRecord record) {
    final String sql =
        """
        INSERT INTO game_records (
          user_id, game_type, coins_bet, coins_won, result, details, created_at
        ) VALUES (
          :userId, :gameType, :coinsBet, :coinsWon, :result, :details, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("gameType", record.gameType())
            .addValue("coinsBet", record.coinsBet())
            .addValue("coinsWon", record.coinsWon())
            .addValue("result", record.result().value())
            .addValue("details", jsonColumns.write(record.details()))
            .addValue("createdAt", toText(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /** gameType が null の場合は全種別を対象にする。新しい順。 */
  public List<GameResultRecord> findByUser(String userId, String gameType, int limit) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT id, user_id, game_type, coins_bet, coins_won, result, details, created_at
            FROM game_records
            WHERE user_id = :userId
            """);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    if (gameType != null) {
      sql.append(" AND game_type = :gameType");
      params.addValue("gameType", gameType);
    }
    sql.append(" ORDER BY created_at DESC, id DESC LIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public GameStats aggregate(String userId, String gameType) {
    final String sql =
        """
        SELECT
          COUNT(*) AS total_games,
          SUM(CASE WHEN result = 'win' THEN 1 ELSE 0 END) AS wins,
          SUM(coins_bet) AS total_bet,
          SUM(coins_won) AS total_won,
          SUM(coins_won - coins_bet) AS net_profit,
          AVG(coins_won - coins_bet) AS avg_profit,
          MAX(coins_won) AS max_win,
          MIN(coins_won - coins_bet) AS worst_loss
        FROM game_records
        WHERE user_id = :userId AND game_type = :gameType
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("gameType", gameType);
    // 集計関数は該当行が無くても 1 行返し、SUM/AVG/MAX/MIN は NULL (getLong/getDouble では 0)
    return jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new GameStats(
                    rs.getLong("total_games"),
                    rs.getLong("wins"),
                    rs.getLong("total_bet"),
                    rs.getLong("total_won"),
                    rs.getLong("net_profit"),
                    rs.getDouble("avg_profit"),
                    rs.getLong("max_win"),
                    rs.getLong("worst_loss")))
        .stream()
        .findFirst()
        .orElseGet(GameStats::empty);
  }

  private GameResultRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new GameResultRecord(
        rs.getLong("id"),
        rs.getString("user_id"),
        rs.getString("game_type"),
        rs.getLong("coins_bet"),
        rs.getLong("coins_won"),
        GameOutcome.fromValue(rs.getString("result")),
        jsonColumns.readNullable(rs.getString("details")),
        fromText(rs.getString("created_at")));
  }
}
