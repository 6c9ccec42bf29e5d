package com.example.minigame.repository;

import static com.example.common.SqliteTimestamps.fromText;
import static com.example.common.SqliteTimestamps.toText;

import com.example.minigame.model.AchievementRecord;
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
public class AchievementRepository {

  private static final String COLUMNS =
      """
      id, name, description, category, condition_type, condition_value, reward_coins,
      reward_title, icon, is_hidden, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<AchievementRecord> findAll() {
    final String sql = "SELECT " + COLUMNS + " FROM achievements ORDER BY category, id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<AchievementRecord> findByCategory(String category) {
    final String sql =
        "SELECT " + COLUMNS + " FROM achievements WHERE category = :category ORDER BY id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("category", category);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<AchievementRecord> findById(String achievementId) {
    final String sql = "SELECT " + COLUMNS + " FROM achievements WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", achievementId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** カタログの投入。既存 id は内容を置き換える。 */
  public void upsert(AchievementRecord achievement, Instant now) {
    final String sql =
        """
        INSERT OR REPLACE INTO achievements (
          id, name, description, category, condition_type, condition_value,
          reward_coins, reward_title, icon, is_hidden, created_at
        ) VALUES (
          :id, :name, :description, :category, :conditionType, :conditionValue,
          :rewardCoins, :rewardTitle, :icon, :hidden, :createdAt
        )
        """;
    final Instant createdAt = achievement.createdAt() == null ? now : achievement.createdAt();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", achievement.id())
            .addValue("name", achievement.name())
            .addValue("description", achievement.description())
            .addValue("category", achievement.category())
            .addValue("conditionType", achievement.conditionType())
            .addValue("conditionValue", achievement.conditionValue())
            .addValue("rewardCoins", achievement.rewardCoins())
            .addValue("rewardTitle", achievement.rewardTitle())
            .addValue("icon", achievement.icon())
            .addValue("hidden", achievement.hidden() ? 1 : 0)
            .addValue("createdAt", toText(createdAt));
    jdbcTemplate.update(sql, params);
  }

  private AchievementRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AchievementRecord(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("category"),
        rs.getString("condition_type"),
        rs.getInt("condition_value"),
        rs.getLong("reward_coins"),
        rs.getString("reward_title"),
        rs.getString("icon"),
        rs.getBoolean("is_hidden"),
        fromText(rs.getString("created_at")));
  }
}
