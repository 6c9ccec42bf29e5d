package com.example.minigame.model;

public record LeaderboardEntry(
    int rank, String userId, String username, long score, String title) {}
