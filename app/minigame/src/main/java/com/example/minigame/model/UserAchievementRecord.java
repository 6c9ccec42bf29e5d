package com.example.minigame.model;

import java.time.Instant;

public record UserAchievementRecord(
    String userId, String achievementId, Instant achievedAt, boolean notified) {}
