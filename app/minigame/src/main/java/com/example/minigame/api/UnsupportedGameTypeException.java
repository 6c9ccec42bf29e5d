package com.example.minigame.api;

public class UnsupportedGameTypeException extends RuntimeException {
  public UnsupportedGameTypeException(String gameType) {
    super("unsupported game type: " + gameType);
  }
}
