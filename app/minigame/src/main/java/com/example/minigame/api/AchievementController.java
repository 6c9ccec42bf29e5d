package com.example.minigame.api;

import com.example.minigame.api.response.AchievementGrantResponse;
import com.example.minigame.api.response.AchievementsResponse;
import com.example.minigame.api.response.UserAchievementsResponse;
import com.example.minigame.service.AchievementService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class AchievementController {

  private final AchievementService achievementService;

  @GetMapping("/achievements")
  public AchievementsResponse catalog(
      @RequestParam(value = "category", required = false) String category) {
    return achievementService.catalog(category);
  }

  @GetMapping("/users/{user_id}/achievements")
  public UserAchievementsResponse userAchievements(@PathVariable("user_id") String userId) {
    return achievementService.userAchievements(userId);
  }

  @GetMapping("/me/achievements/pending")
  public UserAchievementsResponse pending(
      @RequestHeader(GameRoomController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId) {
    return achievementService.pending(userId);
  }

  @PostMapping("/users/{user_id}/achievements/{achievement_id}")
  public AchievementGrantResponse grant(
      @PathVariable("user_id") String userId,
      @PathVariable("achievement_id") String achievementId) {
    return achievementService.grant(userId, achievementId);
  }
}
