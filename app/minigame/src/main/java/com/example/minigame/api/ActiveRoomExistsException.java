package com.example.minigame.api;

public class ActiveRoomExistsException extends RuntimeException {
  public ActiveRoomExistsException(String userId) {
    super("user already has an active room: " + userId);
  }
}
