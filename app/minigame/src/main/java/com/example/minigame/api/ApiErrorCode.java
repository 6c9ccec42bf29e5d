/*
 * どこで: Minigame API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ 409 でも「満員」「残高不足」「手番違い」などをボット側で出し分けられるようにするため
 */
package com.example.minigame.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNSUPPORTED_GAME_TYPE,
  ROOM_NOT_FOUND,
  USER_NOT_FOUND,
  ACHIEVEMENT_NOT_FOUND,
  ROOM_ACCESS_DENIED,
  ROOM_NOT_JOINABLE,
  ROOM_STATE_CONFLICT,
  ACTIVE_ROOM_EXISTS,
  INSUFFICIENT_COINS,
  GAME_ACTION_REJECTED,
  ALREADY_CHECKED_IN,
  ROOM_CONCURRENT_MODIFICATION,
  INTERNAL_ERROR
}
