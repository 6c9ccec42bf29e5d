/*
 * どこで: Minigame スキーマ移行のテスト
 * 何を: 旧 roulette_games の行が game_rooms へ引き継がれることを検証する
 * なぜ: 稼働中の SQLite ファイルを上書きせずに新スキーマへ移すため
 */
package com.example.minigame.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.Map;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class MigrationTest {

  private static final String LEGACY_TABLE =
      """
      CREATE TABLE roulette_games (
          id TEXT PRIMARY KEY,
          channel_id TEXT NOT NULL,
          creator_id TEXT NOT NULL,
          creator_name TEXT NOT NULL,
          bet_amount INTEGER NOT NULL,
          status TEXT NOT NULL DEFAULT 'waiting',
          max_players INTEGER NOT NULL DEFAULT 6,
          players TEXT NOT NULL DEFAULT '[]',
          bullet_position INTEGER DEFAULT 0,
          current_position INTEGER DEFAULT 1,
          current_player_index INTEGER DEFAULT 0,
          created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
          started_at TIMESTAMP NULL,
          finished_at TIMESTAMP NULL
      )
      """;

  private static final String LEGACY_ROW =
      """
      INSERT INTO roulette_games (
          id, channel_id, creator_id, creator_name, bet_amount, status, max_players,
          players, bullet_position, current_position, current_player_index
      ) VALUES (
          'legacy01', 'c1', 'u1', 'alice', 200, 'playing', 6,
          '[{"user_id":"u1","username":"alice"},{"user_id":"u2","username":"bob"}]',
          3, 2, 1
      )
      """;

  @TempDir Path tempDir;

  private DriverManagerDataSource dataSource;
  private JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeEach
  void setUp() {
    dataSource = new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("legacy.db"));
    jdbcTemplate = new JdbcTemplate(dataSource);
  }

  @Test
  void legacyRouletteRowsMoveIntoGameRooms() throws Exception {
    flyway("1").migrate();
    jdbcTemplate.execute(LEGACY_TABLE);
    jdbcTemplate.execute(LEGACY_ROW);

    flyway(null).migrate();

    final Map<String, Object> row =
        jdbcTemplate.queryForMap("SELECT * FROM game_rooms WHERE id = 'legacy01'");
    final JsonNode gameData = objectMapper.readTree((String) row.get("game_data"));
    assertThat(row.get("game_type")).isEqualTo("russian_roulette");
    assertThat(row.get("status")).isEqualTo("playing");
    assertThat(((Number) row.get("min_players")).intValue()).isEqualTo(2);
    assertThat(((Number) row.get("version")).intValue()).isZero();
    assertThat(gameData.path("bullet_position").asInt()).isEqualTo(3);
    assertThat(gameData.path("current_position").asInt()).isEqualTo(2);
    assertThat(gameData.path("current_player_index").asInt()).isEqualTo(1);
    assertThat(tableExists("roulette_games")).isFalse();
  }

  @Test
  void freshDatabaseMigratesWithoutLegacyTable() {
    flyway(null).migrate();

    assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM game_rooms", Integer.class))
        .isZero();
    assertThat(tableExists("roulette_games")).isFalse();
  }

  @Test
  void rerunningTheCopyDoesNotDuplicateRooms() {
    flyway("1").migrate();
    jdbcTemplate.execute(LEGACY_TABLE);
    jdbcTemplate.execute(LEGACY_ROW);
    flyway(null).migrate();

    jdbcTemplate.execute(LEGACY_TABLE);
    jdbcTemplate.execute(LEGACY_ROW);
    new ResourceDatabasePopulator(new ClassPathResource("db/migration/V2__unified_game_rooms.sql"))
        .execute(dataSource);

    assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM game_rooms", Integer.class))
        .isEqualTo(1);
    assertThat(tableExists("roulette_games")).isFalse();
  }

  private Flyway flyway(String target) {
    final var configuration =
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration");
    if (target != null) {
      configuration.target(target);
    }
    return configuration.load();
  }

  private boolean tableExists(String name) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
            Integer.class,
            name);
    return count != null && count > 0;
  }
}
