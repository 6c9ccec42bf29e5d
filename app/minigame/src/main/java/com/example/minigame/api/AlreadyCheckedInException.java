package com.example.minigame.api;

public class AlreadyCheckedInException extends RuntimeException {
  public AlreadyCheckedInException(String userId) {
    super("already checked in today: " + userId);
  }
}
