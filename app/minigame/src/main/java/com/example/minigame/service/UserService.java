/*
 * どこで: Minigame サービス層
 * 何を: プレイヤーの取得/自動登録、残高の増減、経験値、称号、ランキングを扱う
 * なぜ: ルーム・チェックイン・実績の各サービスが同じ残高ルールを共有するため
 */
package com.example.minigame.service;

import com.example.minigame.api.InsufficientCoinsException;
import com.example.minigame.api.UserNotFoundException;
import com.example.minigame.api.response.LeaderboardResponse;
import com.example.minigame.api.response.UserProfileResponse;
import com.example.minigame.config.MinigameProperties;
import com.example.minigame.model.LeaderboardEntry;
import com.example.minigame.model.UserRecord;
import com.example.minigame.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class UserService {

  private static final Logger logger = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final MinigameProperties properties;
  private final Clock clock;

  /**
   * 役割: 初めて見るプレイヤーを初期所持金付きで登録し、既存なら表示名を最新化する。
   * 前提: userId/username はボット側で解決済みで空でない。
   */
  @Transactional
  public UserRecord getOrCreate(String userId, String username) {
    requireText(userId, "user_id is required");
    requireText(username, "username is required");
    final Instant now = Instant.now(clock);
    final Optional<UserRecord> existing = userRepository.findById(userId);
    if (existing.isEmpty()) {
      final UserRecord created =
          UserRecord.newcomer(userId, username, properties.initialCoins(), now);
      userRepository.insert(created);
      logger.info("user registered user_id={} initial_coins={}", userId, created.coins());
      return created;
    }
    final UserRecord user = existing.get();
    if (!user.username().equals(username)) {
      final UserRecord renamed = user.withUsername(username, now);
      userRepository.saveProfile(renamed);
      return renamed;
    }
    return user;
  }

  public UserRecord getUser(String userId) {
    return userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
  }

  public Optional<UserRecord> findUser(String userId) {
    return userRepository.findById(userId);
  }

  /** 残高不足の場合は何も変えずに InsufficientCoinsException を送出する。 */
  @Transactional
  public void spendCoins(String userId, long amount, String reason) {
    requirePositive(amount);
    if (!userRepository.spendCoins(userId, amount, Instant.now(clock))) {
      final UserRecord user = getUser(userId);
      throw new InsufficientCoinsException(userId, user.coins(), amount);
    }
    logger.info("coins spent user_id={} amount={} reason={}", userId, amount, reason);
  }

  @Transactional
  public void addCoins(String userId, long amount, String reason) {
    if (amount == 0) {
      return;
    }
    requirePositive(amount);
    if (!userRepository.addCoins(userId, amount, Instant.now(clock))) {
      throw new UserNotFoundException(userId);
    }
    logger.info("coins added user_id={} amount={} reason={}", userId, amount, reason);
  }

  /** @return レベルが上がった場合 true */
  @Transactional
  public boolean addExperience(String userId, int experience) {
    final UserRecord user = getUser(userId);
    final UserRecord updated = user.withExperienceGained(experience, Instant.now(clock));
    userRepository.saveProfile(updated);
    return updated.level() > user.level();
  }

  @Transactional
  public UserRecord setTitle(String userId, String title) {
    requireText(title, "title is required");
    final UserRecord updated = getUser(userId).withTitle(title, Instant.now(clock));
    userRepository.saveProfile(updated);
    return updated;
  }

  /** 連続日数と累計回数を更新する。残高は addCoins 側で動かす。 */
  @Transactional
  public UserRecord markCheckedIn(String userId, int consecutiveDays) {
    final UserRecord updated = getUser(userId).withCheckIn(consecutiveDays, Instant.now(clock));
    userRepository.saveProfile(updated);
    return updated;
  }

  public UserProfileResponse getProfile(String userId) {
    final UserRecord user = getUser(userId);
    final Integer rank = userRepository.findRank(userId).orElse(null);
    return UserProfileResponse.from(user, rank);
  }

  public LeaderboardResponse getLeaderboard(Integer limit, Integer offset) {
    final MinigameProperties.Leaderboard config = properties.leaderboard();
    final int resolvedLimit =
        limit == null ? config.defaultLimit() : Math.min(Math.max(limit, 1), config.maxLimit());
    final int resolvedOffset = offset == null ? 0 : Math.max(offset, 0);
    final List<LeaderboardEntry> entries =
        userRepository.findLeaderboard(resolvedLimit, resolvedOffset);
    return LeaderboardResponse.from(entries, resolvedLimit, resolvedOffset);
  }

  private void requirePositive(long amount) {
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be positive");
    }
  }

  private void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
