/*
 * どこで: Minigame API
 * 何を: ルーム未検出を表現する
 * なぜ: join/start/action/cancel の 404 応答へ変換するため
 */
package com.example.minigame.api;

public class RoomNotFoundException extends RuntimeException {
  public RoomNotFoundException(String roomId) {
    super("room not found: " + roomId);
  }
}
