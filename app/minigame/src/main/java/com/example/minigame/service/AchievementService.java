/*
 * どこで: Minigame サービス層
 * 何を: 実績カタログの登録/参照と、ユーザーへの実績付与・通知待ちの払い出しを行う
 * なぜ: 付与記録と報酬 (金币/称号) の反映を 1 トランザクションにまとめ、二重付与を防ぐため
 */
package com.example.minigame.service;

import com.example.minigame.api.AchievementNotFoundException;
import com.example.minigame.api.response.AchievementGrantResponse;
import com.example.minigame.api.response.AchievementResponse;
import com.example.minigame.api.response.AchievementsResponse;
import com.example.minigame.api.response.UserAchievementsResponse;
import com.example.minigame.model.AchievementRecord;
import com.example.minigame.model.UserAchievementRecord;
import com.example.minigame.model.UserRecord;
import com.example.minigame.repository.AchievementRepository;
import com.example.minigame.repository.UserAchievementRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AchievementService {

  private static final Logger logger = LoggerFactory.getLogger(AchievementService.class);

  private final AchievementRepository achievementRepository;
  private final UserAchievementRepository userAchievementRepository;
  private final UserService userService;
  private final Clock clock;

  /** 標準カタログを upsert する。既存行の定義は上書きされる。 */
  @Transactional
  public int seedDefaults() {
    final Instant now = Instant.now(clock);
    for (AchievementRecord achievement : DefaultAchievements.ALL) {
      achievementRepository.upsert(achievement, now);
    }
    logger.info("achievement catalogue seeded count={}", DefaultAchievements.ALL.size());
    return DefaultAchievements.ALL.size();
  }

  public AchievementsResponse catalog(String category) {
    final List<AchievementRecord> achievements =
        category == null || category.isBlank()
            ? achievementRepository.findAll()
            : achievementRepository.findByCategory(category);
    return new AchievementsResponse(achievements.stream().map(AchievementResponse::from).toList());
  }

  public UserAchievementsResponse userAchievements(String userId) {
    userService.getUser(userId);
    return toResponse(userId, userAchievementRepository.findByUserId(userId));
  }

  /** 未通知の実績を返し、同時に通知済みへ更新する。2 回目の呼び出しでは返らない。 */
  @Transactional
  public UserAchievementsResponse pending(String userId) {
    final List<UserAchievementRecord> unnotified = userAchievementRepository.findUnnotified(userId);
    for (UserAchievementRecord record : unnotified) {
      userAchievementRepository.markNotified(userId, record.achievementId());
    }
    return toResponse(userId, unnotified);
  }

  @Transactional
  public AchievementGrantResponse grant(String userId, String achievementId) {
    final AchievementRecord achievement =
        achievementRepository
            .findById(achievementId)
            .orElseThrow(() -> new AchievementNotFoundException(achievementId));
    final UserRecord user = userService.getUser(userId);
    if (!userAchievementRepository.insertIfAbsent(userId, achievementId, Instant.now(clock))) {
      return new AchievementGrantResponse(userId, achievementId, false, 0, user.title());
    }

    userService.addCoins(userId, achievement.rewardCoins(), "成就奖励 " + achievement.name());
    String title = user.title();
    if (achievement.rewardTitle() != null && !achievement.rewardTitle().isBlank()) {
      title = userService.setTitle(userId, achievement.rewardTitle()).title();
    }
    logger.info(
        "achievement granted user_id={} achievement_id={} reward_coins={}",
        userId,
        achievementId,
        achievement.rewardCoins());
    return new AchievementGrantResponse(
        userId, achievementId, true, achievement.rewardCoins(), title);
  }

  private UserAchievementsResponse toResponse(
      String userId, List<UserAchievementRecord> records) {
    final Map<String, AchievementRecord> catalog =
        achievementRepository.findAll().stream()
            .collect(Collectors.toMap(AchievementRecord::id, Function.identity()));
    final List<UserAchievementsResponse.Item> items =
        records.stream()
            .map(
                record -> {
                  final AchievementRecord achievement = catalog.get(record.achievementId());
                  return new UserAchievementsResponse.Item(
                      record.achievementId(),
                      achievement == null ? record.achievementId() : achievement.name(),
                      achievement == null ? null : achievement.category(),
                      record.achievedAt() == null ? null : record.achievedAt().toString(),
                      record.notified());
                })
            .toList();
    return new UserAchievementsResponse(userId, items.size(), items);
  }
}
