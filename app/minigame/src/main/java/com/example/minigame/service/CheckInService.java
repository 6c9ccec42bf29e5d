/*
 * どこで: Minigame サービス層
 * 何を: 1 日 1 回のチェックインと、その統計を扱う
 * なぜ: 日付の境界を業務タイムゾーンの Clock に揃え、同日二重付与を DB の一意制約で防ぐため
 */
package com.example.minigame.service;

import com.example.minigame.api.AlreadyCheckedInException;
import com.example.minigame.api.response.CheckInResponse;
import com.example.minigame.api.response.CheckInStatsResponse;
import com.example.minigame.config.MinigameProperties;
import com.example.minigame.model.CheckInRecord;
import com.example.minigame.model.UserRecord;
import com.example.minigame.repository.CheckInRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CheckInService {

  private static final Logger logger = LoggerFactory.getLogger(CheckInService.class);
  private static final int RECENT_DAYS = 30;
  private static final int RECENT_ITEMS = 7;

  private final CheckInRepository checkInRepository;
  private final UserService userService;
  private final MinigameProperties properties;
  private final Clock clock;

  @Transactional
  public CheckInResponse checkIn(String userId, String username) {
    final boolean newUser = userService.findUser(userId).isEmpty();
    final UserRecord user = userService.getOrCreate(userId, username);
    final Instant now = Instant.now(clock);
    final LocalDate today = LocalDate.now(clock);
    final LocalDate lastDate = lastCheckInDate(user);
    if (today.equals(lastDate)) {
      throw new AlreadyCheckedInException(userId);
    }
    final int consecutiveDays =
        today.minusDays(1).equals(lastDate) ? user.checkInCount() + 1 : 1;
    final long reward = properties.checkIn().rewardCoins();

    final CheckInRecord record = new CheckInRecord(userId, today, reward, consecutiveDays, 0);
    if (!checkInRepository.insertIfAbsent(record, now)) {
      throw new AlreadyCheckedInException(userId);
    }
    userService.addCoins(userId, record.totalCoins(), "每日签到");
    final UserRecord updated = userService.markCheckedIn(userId, consecutiveDays);
    logger.info(
        "checked in user_id={} date={} consecutive_days={} reward={}",
        userId,
        today,
        consecutiveDays,
        record.totalCoins());

    return new CheckInResponse(
        userId,
        today.toString(),
        record.coinsEarned(),
        record.bonusCoins(),
        record.totalCoins(),
        consecutiveDays,
        updated.totalCheckIns(),
        user.coins() + record.totalCoins(),
        newUser);
  }

  public CheckInStatsResponse stats(String userId) {
    final UserRecord user = userService.getUser(userId);
    final LocalDate today = LocalDate.now(clock);
    final boolean canCheckIn = !today.equals(lastCheckInDate(user));
    final List<CheckInRecord> recent = checkInRepository.findRecent(userId, RECENT_DAYS);
    final long recentCoins = recent.stream().mapToLong(CheckInRecord::totalCoins).sum();
    return new CheckInStatsResponse(
        userId,
        user.checkInCount(),
        checkInRepository.countByUserId(userId),
        canCheckIn,
        (canCheckIn ? today : today.plusDays(1)).toString(),
        recentCoins,
        recent.stream().limit(RECENT_ITEMS).map(CheckInStatsResponse::toItem).toList());
  }

  private LocalDate lastCheckInDate(UserRecord user) {
    if (user.lastCheckIn() == null) {
      return null;
    }
    return LocalDate.ofInstant(user.lastCheckIn(), clock.getZone());
  }
}
