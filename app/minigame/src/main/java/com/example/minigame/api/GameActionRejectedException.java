/*
 * どこで: Minigame API
 * 何を: エンジンがゲームルール違反として拒否したアクションを表す
 * なぜ: 手番違い/不正パラメータなどをルーム状態を変えずに 409 で返すため
 */
package com.example.minigame.api;

public class GameActionRejectedException extends RuntimeException {
  public GameActionRejectedException(String message) {
    super(message);
  }
}
