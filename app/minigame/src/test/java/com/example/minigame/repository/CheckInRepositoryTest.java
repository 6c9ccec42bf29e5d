/*
 * どこで: CheckInRepository の統合テスト
 * 何を: (user_id, check_in_date) の一意性と直近履歴の並び順を検証する
 * なぜ: 同日の二重チェックインが DB レベルで必ず弾かれることを保証するため
 */
package com.example.minigame.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.minigame.AbstractSqliteTest;
import com.example.minigame.model.CheckInRecord;
import com.example.minigame.model.UserRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CheckInRepositoryTest extends AbstractSqliteTest {

  private static final Instant NOW = Instant.parse("2026-03-02T01:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

  @Autowired private CheckInRepository checkInRepository;
  @Autowired private UserRepository userRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    TestTables.truncate(jdbcTemplate);
    userRepository.insert(UserRecord.newcomer("u1", "alice", 1000, NOW));
  }

  @Test
  void secondRecordForSameDateIsIgnored() {
    final boolean first =
        checkInRepository.insertIfAbsent(new CheckInRecord("u1", TODAY, 100, 1, 0), NOW);
    final boolean second =
        checkInRepository.insertIfAbsent(new CheckInRecord("u1", TODAY, 999, 2, 0), NOW);

    assertThat(first).isTrue();
    assertThat(second).isFalse();
    assertThat(checkInRepository.countByUserId("u1")).isEqualTo(1);
    assertThat(checkInRepository.findRecent("u1", 5).get(0).coinsEarned()).isEqualTo(100);
  }

  @Test
  void recentRecordsAreNewestFirst() {
    checkInRepository.insertIfAbsent(new CheckInRecord("u1", TODAY.minusDays(2), 100, 1, 0), NOW);
    checkInRepository.insertIfAbsent(new CheckInRecord("u1", TODAY, 100, 1, 0), NOW);
    checkInRepository.insertIfAbsent(new CheckInRecord("u1", TODAY.minusDays(1), 100, 2, 0), NOW);

    final List<CheckInRecord> recent = checkInRepository.findRecent("u1", 2);

    assertThat(recent)
        .extracting(CheckInRecord::checkInDate)
        .containsExactly(TODAY, TODAY.minusDays(1));
    assertThat(checkInRepository.countByUserId("u1")).isEqualTo(3);
  }
}
