package com.example.minigame.api;

/** 楽観ロックの version が一致せず、ルーム更新が 0 行だった場合に送出する。 */
public class RoomConcurrentModificationException extends RuntimeException {
  public RoomConcurrentModificationException(String roomId, long expectedVersion) {
    super(
        "room was modified concurrently: "
            + roomId
            + " (expected version "
            + expectedVersion
            + ")");
  }
}
