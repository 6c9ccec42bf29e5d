package com.example.minigame.engine;

public record GameActionResult(String message, boolean gameContinues) {}
