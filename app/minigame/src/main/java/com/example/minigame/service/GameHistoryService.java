package com.example.minigame.service;

import com.example.minigame.api.response.GameRecordsResponse;
import com.example.minigame.api.response.GameStatsResponse;
import com.example.minigame.repository.GameRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** ゲーム種別ごとの戦績一覧と集計を返す。 */
@Service
@RequiredArgsConstructor
public class GameHistoryService {

  static final int RECORD_LIMIT = 50;

  private final GameRecordRepository recordRepository;
  private final UserService userService;

  public GameRecordsResponse records(String userId, String gameType) {
    userService.getUser(userId);
    return GameRecordsResponse.from(
        userId, gameType, recordRepository.findByUser(userId, gameType, RECORD_LIMIT));
  }

  public GameStatsResponse stats(String userId, String gameType) {
    userService.getUser(userId);
    return GameStatsResponse.from(userId, gameType, recordRepository.aggregate(userId, gameType));
  }
}
