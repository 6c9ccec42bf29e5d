package com.example.minigame.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.minigame.api.AchievementNotFoundException;
import com.example.minigame.api.response.AchievementGrantResponse;
import com.example.minigame.api.response.UserAchievementsResponse;
import com.example.minigame.model.AchievementRecord;
import com.example.minigame.model.UserAchievementRecord;
import com.example.minigame.model.UserRecord;
import com.example.minigame.repository.AchievementRepository;
import com.example.minigame.repository.UserAchievementRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AchievementServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final AchievementRecord CHECK_IN_7 =
      AchievementRecord.of(
          "check_in_7", "每日一签", "连续签到7天", "签到", "consecutive_days", 7, 300, "守时");

  @Mock private AchievementRepository achievementRepository;
  @Mock private UserAchievementRepository userAchievementRepository;
  @Mock private UserService userService;

  private AchievementService service;

  @BeforeEach
  void setUp() {
    service =
        new AchievementService(
            achievementRepository,
            userAchievementRepository,
            userService,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void seedDefaultsUpsertsWholeCatalogue() {
    final int seeded = service.seedDefaults();

    assertThat(seeded).isEqualTo(20);
    verify(achievementRepository, times(20)).upsert(any(), eq(NOW));
  }

  @Test
  void grantPaysRewardAndAppliesTitleOnce() {
    final UserRecord user = UserRecord.newcomer("u1", "alice", 1000, NOW);
    when(achievementRepository.findById("check_in_7")).thenReturn(Optional.of(CHECK_IN_7));
    when(userService.getUser("u1")).thenReturn(user);
    when(userAchievementRepository.insertIfAbsent("u1", "check_in_7", NOW)).thenReturn(true);
    when(userService.setTitle("u1", "守时")).thenReturn(user.withTitle("守时", NOW));

    final AchievementGrantResponse response = service.grant("u1", "check_in_7");

    assertThat(response.granted()).isTrue();
    assertThat(response.rewardCoins()).isEqualTo(300);
    assertThat(response.title()).isEqualTo("守时");
    verify(userService).addCoins(eq("u1"), eq(300L), anyString());
  }

  @Test
  void grantIsNoOpWhenAlreadyAchieved() {
    when(achievementRepository.findById("check_in_7")).thenReturn(Optional.of(CHECK_IN_7));
    when(userService.getUser("u1")).thenReturn(UserRecord.newcomer("u1", "alice", 1000, NOW));
    when(userAchievementRepository.insertIfAbsent("u1", "check_in_7", NOW)).thenReturn(false);

    final AchievementGrantResponse response = service.grant("u1", "check_in_7");

    assertThat(response.granted()).isFalse();
    assertThat(response.rewardCoins()).isZero();
    verify(userService, never()).addCoins(anyString(), anyLong(), anyString());
    verify(userService, never()).setTitle(anyString(), anyString());
  }

  @Test
  void grantRejectsUnknownAchievement() {
    when(achievementRepository.findById("nope")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.grant("u1", "nope"))
        .isInstanceOf(AchievementNotFoundException.class);
  }

  @Test
  void pendingReturnsUnnotifiedAndMarksThem() {
    when(userAchievementRepository.findUnnotified("u1"))
        .thenReturn(List.of(new UserAchievementRecord("u1", "check_in_7", NOW, false)));
    when(achievementRepository.findAll()).thenReturn(List.of(CHECK_IN_7));

    final UserAchievementsResponse response = service.pending("u1");

    assertThat(response.totalAchievements()).isEqualTo(1);
    assertThat(response.achieved().get(0).name()).isEqualTo("每日一签");
    assertThat(response.achieved().get(0).category()).isEqualTo("签到");
    verify(userAchievementRepository).markNotified("u1", "check_in_7");
  }

  @Test
  void catalogFiltersByCategory() {
    when(achievementRepository.findByCategory("签到")).thenReturn(List.of(CHECK_IN_7));

    assertThat(service.catalog("签到").achievements())
        .extracting(a -> a.id())
        .containsExactly("check_in_7");
    verify(achievementRepository, never()).findAll();
  }
}
