/*
 * どこで: Minigame データアクセス
 * 何を: check_in_records の追記と参照を行う
 * なぜ: UNIQUE(user_id, check_in_date) を同日 2 回目のチェックイン検出に使うため
 */
package com.example.minigame.repository;

import static com.example.common.SqliteTimestamps.fromDateText;
import static com.example.common.SqliteTimestamps.toDateText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.minigame.model.CheckInRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CheckInRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 同じ日の記録が既にあれば挿入せず false を返す。 */
  public boolean insertIfAbsent(CheckInRecord record, Instant createdAt) {
    final String sql =
        """
        INSERT OR IGNORE INTO check_in_records (
          user_id, check_in_date, coins_earned, consecutive_days, bonus_coins, created_at
        ) VALUES (
          :userId, :checkInDate, :coinsEarned, :consecutiveDays, :bonusCoins, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("checkInDate", toDateText(record.checkInDate()))
            .addValue("coinsEarned", record.coinsEarned())
            .addValue("consecutiveDays", record.consecutiveDays())
            .addValue("bonusCoins", record.bonusCoins())
            .addValue("createdAt", toText(createdAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public List<CheckInRecord> findRecent(String userId, int limit) {
    final String sql =
        """
        SELECT user_id, check_in_date, coins_earned, consecutive_days, bonus_coins
        FROM check_in_records
        WHERE user_id = :userId
        ORDER BY check_in_date DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countByUserId(String userId) {
    final String sql = "SELECT COUNT(*) FROM check_in_records WHERE user_id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private CheckInRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CheckInRecord(
        rs.getString("user_id"),
        fromDateText(rs.getString("check_in_date")),
        rs.getLong("coins_earned"),
        rs.getInt("consecutive_days"),
        rs.getLong("bonus_coins"));
  }
}
