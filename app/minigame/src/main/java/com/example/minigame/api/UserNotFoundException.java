package com.example.minigame.api;

public class UserNotFoundException extends RuntimeException {
  public UserNotFoundException(String userId) {
    super("user not found: " + userId);
  }
}
