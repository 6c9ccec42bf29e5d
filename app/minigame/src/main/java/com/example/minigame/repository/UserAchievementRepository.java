package com.example.minigame.repository;

import static com.example.common.SqliteTimestamps.fromText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.minigame.model.UserAchievementRecord;
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
public class UserAchievementRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<UserAchievementRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT user_id, achievement_id, achieved_at, notified
        FROM user_achievements
        WHERE user_id = :userId
        ORDER BY achieved_at DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean exists(String userId, String achievementId) {
    final String sql =
        """
        SELECT COUNT(*) FROM user_achievements
        WHERE user_id = :userId AND achievement_id = :achievementId
        """;
    final Integer count =
        jdbcTemplate.queryForObject(sql, keyParams(userId, achievementId), Integer.class);
    return count != null && count > 0;
  }

  /** 既に獲得済みなら何もしない。新規に記録できた場合のみ true。 */
  public boolean insertIfAbsent(String userId, String achievementId, Instant achievedAt) {
    final String sql =
        """
        INSERT OR IGNORE INTO user_achievements (user_id, achievement_id, achieved_at, notified)
        VALUES (:userId, :achievementId, :achievedAt, 0)
        """;
    final MapSqlParameterSource params =
        keyParams(userId, achievementId).addValue("achievedAt", toText(achievedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public List<UserAchievementRecord> findUnnotified(String userId) {
    final String sql =
        """
        SELECT user_id, achievement_id, achieved_at, notified
        FROM user_achievements
        WHERE user_id = :userId AND notified = 0
        ORDER BY achieved_at ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public void markNotified(String userId, String achievementId) {
    final String sql =
        """
        UPDATE user_achievements SET notified = 1
        WHERE user_id = :userId AND achievement_id = :achievementId
        """;
    jdbcTemplate.update(sql, keyParams(userId, achievementId));
  }

  private MapSqlParameterSource keyParams(String userId, String achievementId) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("achievementId", achievementId);
  }

  private UserAchievementRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserAchievementRecord(
        rs.getString("user_id"),
        rs.getString("achievement_id"),
        fromText(rs.getString("achieved_at")),
        rs.getBoolean("notified"));
  }
}
