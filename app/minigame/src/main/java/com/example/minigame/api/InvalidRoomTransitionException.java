/*
 * どこで: Minigame API
 * 何を: 許可されていないルーム状態遷移 (409) を表す
 * なぜ: 開始済みルームの取消や終了済みルームへの操作を明確に拒否するため
 */
package com.example.minigame.api;

public class InvalidRoomTransitionException extends RuntimeException {
  public InvalidRoomTransitionException(String message) {
    super(message);
  }
}
