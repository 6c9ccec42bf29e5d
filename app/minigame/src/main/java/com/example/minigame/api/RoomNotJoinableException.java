package com.example.minigame.api;

public class RoomNotJoinableException extends RuntimeException {
  public RoomNotJoinableException(String message) {
    super(message);
  }
}
