/*
 * どこで: Minigame API
 * 何を: 作成者以外による start/cancel を表現する
 * なぜ: 403 応答へ変換するため
 */
package com.example.minigame.api;

public class RoomAccessDeniedException extends RuntimeException {
  public RoomAccessDeniedException(String message) {
    super(message);
  }
}
