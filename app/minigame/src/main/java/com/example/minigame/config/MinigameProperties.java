/*
 * どこで: Minigame 設定
 * 何を: 初期所持金/チェックイン報酬/ランキング上限などの値を保持する
 * なぜ: 環境ごとの経済パラメータをコード外へ出し、テストで上書きしやすくするため
 */
package com.example.minigame.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "minigame")
public record MinigameProperties(
    Long initialCoins,
    Integer winnerExperience,
    Boolean seedAchievements,
    CheckIn checkIn,
    Leaderboard leaderboard) {

  public MinigameProperties {
    initialCoins = initialCoins == null || initialCoins < 0 ? 1000L : initialCoins;
    winnerExperience = winnerExperience == null || winnerExperience < 0 ? 10 : winnerExperience;
    seedAchievements = seedAchievements == null || seedAchievements;
    checkIn = checkIn == null ? new CheckIn(null) : checkIn;
    leaderboard = leaderboard == null ? new Leaderboard(null, null) : leaderboard;
  }

  public record CheckIn(Long rewardCoins) {
    public CheckIn {
      rewardCoins = rewardCoins == null || rewardCoins < 0 ? 100L : rewardCoins;
    }
  }

  public record Leaderboard(Integer defaultLimit, Integer maxLimit) {
    public Leaderboard {
      maxLimit = maxLimit == null || maxLimit <= 0 ? 50 : maxLimit;
      defaultLimit =
          defaultLimit == null || defaultLimit <= 0 ? 10 : Math.min(defaultLimit, maxLimit);
    }
  }
}
