package com.example.minigame.api;

import com.example.minigame.api.response.GameRecordsResponse;
import com.example.minigame.api.response.GameStatsResponse;
import com.example.minigame.api.response.LeaderboardResponse;
import com.example.minigame.api.response.UserProfileResponse;
import com.example.minigame.service.GameHistoryService;
import com.example.minigame.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** プロフィール、ランキング、ゲーム別戦績の参照 API。 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class UserController {

  private final UserService userService;
  private final GameHistoryService gameHistoryService;

  @GetMapping("/users/{user_id}")
  public UserProfileResponse profile(@PathVariable("user_id") String userId) {
    return userService.getProfile(userId);
  }

  @GetMapping("/leaderboard")
  public LeaderboardResponse leaderboard(
      @RequestParam(value = "limit", required = false) Integer limit,
      @RequestParam(value = "offset", required = false) Integer offset) {
    return userService.getLeaderboard(limit, offset);
  }

  @GetMapping("/users/{user_id}/games/{game_type}/records")
  public GameRecordsResponse records(
      @PathVariable("user_id") String userId, @PathVariable("game_type") String gameType) {
    return gameHistoryService.records(userId, gameType);
  }

  @GetMapping("/users/{user_id}/games/{game_type}/stats")
  public GameStatsResponse stats(
      @PathVariable("user_id") String userId, @PathVariable("game_type") String gameType) {
    return gameHistoryService.stats(userId, gameType);
  }
}
