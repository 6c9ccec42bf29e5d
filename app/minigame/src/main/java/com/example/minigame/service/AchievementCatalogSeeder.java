package com.example.minigame.service;

import com.example.minigame.config.MinigameProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** 起動時に標準の実績カタログを登録する。minigame.seed-achievements=false で無効化できる。 */
@Component
@RequiredArgsConstructor
public class AchievementCatalogSeeder implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(AchievementCatalogSeeder.class);

  private final MinigameProperties properties;
  private final AchievementService achievementService;

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.seedAchievements()) {
      logger.info("achievement seeding disabled");
      return;
    }
    achievementService.seedDefaults();
  }
}
