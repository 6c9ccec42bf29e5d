/*
 * どこで: Minigame データアクセス
 * 何を: users の登録/更新/残高増減/ランキング参照を行う
 * なぜ: 残高の増減を条件付き UPDATE で原子的に行い、同時ベットでも負残高を作らないため
 */
package com.example.minigame.repository;

import static com.example.common.SqliteTimestamps.fromText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.minigame.model.LeaderboardEntry;
import com.example.minigame.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private static final String COLUMNS =
      """
      user_id, username, coins, total_earned, total_spent, check_in_count, last_check_in,
      total_check_ins, level, experience, title, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(String userId) {
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE user_id = :userId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void insert(UserRecord user) {
    final String sql =
        """
        INSERT INTO users (
          user_id, username, coins, total_earned, total_spent, check_in_count, last_check_in,
          total_check_ins, level, experience, title, created_at, updated_at
        ) VALUES (
          :userId, :username, :coins, :totalEarned, :totalSpent, :checkInCount, :lastCheckIn,
          :totalCheckIns, :level, :experience, :title, :createdAt, :updatedAt
        )
        """;
    jdbcTemplate.update(sql, toParams(user));
  }

  /** 残高以外のプロフィール列を保存する。残高は addCoins/spendCoins でのみ変える。 */
  public void saveProfile(UserRecord user) {
    final String sql =
        """
        UPDATE users SET
          username = :username,
          check_in_count = :checkInCount,
          last_check_in = :lastCheckIn,
          total_check_ins = :totalCheckIns,
          level = :level,
          experience = :experience,
          title = :title,
          updated_at = :updatedAt
        WHERE user_id = :userId
        """;
    jdbcTemplate.update(sql, toParams(user));
  }

  public boolean addCoins(String userId, long amount, Instant now) {
    final String sql =
        """
        UPDATE users SET
          coins = coins + :amount,
          total_earned = total_earned + :amount,
          updated_at = :updatedAt
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("amount", amount)
            .addValue("updatedAt", toText(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  /** 残高が足りない場合は更新せず false を返す。 */
  public boolean spendCoins(String userId, long amount, Instant now) {
    final String sql =
        """
        UPDATE users SET
          coins = coins - :amount,
          total_spent = total_spent + :amount,
          updated_at = :updatedAt
        WHERE user_id = :userId AND coins >= :amount
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("amount", amount)
            .addValue("updatedAt", toText(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public List<LeaderboardEntry> findLeaderboard(int limit, int offset) {
    final String sql =
        """
        SELECT user_id, username, coins, title,
               ROW_NUMBER() OVER (ORDER BY coins DESC) AS rank
        FROM users
        ORDER BY coins DESC
        LIMIT :limit OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new LeaderboardEntry(
                rs.getInt("rank"),
                rs.getString("user_id"),
                rs.getString("username"),
                rs.getLong("coins"),
                rs.getString("title")));
  }

  public Optional<Integer> findRank(String userId) {
    final String sql =
        """
        WITH ranked_users AS (
          SELECT user_id, ROW_NUMBER() OVER (ORDER BY coins DESC) AS rank
          FROM users
        )
        SELECT rank FROM ranked_users WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getInt("rank")).stream().findFirst();
  }

  private MapSqlParameterSource toParams(UserRecord user) {
    return new MapSqlParameterSource()
        .addValue("userId", user.userId())
        .addValue("username", user.username())
        .addValue("coins", user.coins())
        .addValue("totalEarned", user.totalEarned())
        .addValue("totalSpent", user.totalSpent())
        .addValue("checkInCount", user.checkInCount())
        .addValue("lastCheckIn", toText(user.lastCheckIn()))
        .addValue("totalCheckIns", user.totalCheckIns())
        .addValue("level", user.level())
        .addValue("experience", user.experience())
        .addValue("title", user.title())
        .addValue("createdAt", toText(user.createdAt()))
        .addValue("updatedAt", toText(user.updatedAt()));
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String title = rs.getString("title");
    return new UserRecord(
        rs.getString("user_id"),
        rs.getString("username"),
        rs.getLong("coins"),
        rs.getLong("total_earned"),
        rs.getLong("total_spent"),
        rs.getInt("check_in_count"),
        fromText(rs.getString("last_check_in")),
        rs.getInt("total_check_ins"),
        rs.getInt("level"),
        rs.getInt("experience"),
        title == null ? UserRecord.DEFAULT_TITLE : title,
        fromText(rs.getString("created_at")),
        fromText(rs.getString("updated_at")));
  }
}
