package com.example.minigame.model;

public enum GameOutcome {
  WIN("win"),
  LOSE("lose");

  private final String value;

  GameOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static GameOutcome fromValue(String result) {
    for (GameOutcome outcome : values()) {
      if (outcome.value.equalsIgnoreCase(result)) {
        return outcome;
      }
    }
    throw new IllegalArgumentException("unsupported game result: " + result);
  }
}
