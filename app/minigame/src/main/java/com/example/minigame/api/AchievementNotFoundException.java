package com.example.minigame.api;

public class AchievementNotFoundException extends RuntimeException {
  public AchievementNotFoundException(String achievementId) {
    super("achievement not found: " + achievementId);
  }
}
