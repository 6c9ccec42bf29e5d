package com.example.minigame.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** granted が false の場合は獲得済みで、報酬は再付与していない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AchievementGrantResponse(
    String userId, String achievementId, boolean granted, long rewardCoins, String title) {}
