/*
 * どこで: Minigame ドメインモデル
 * 何を: ゲームルームの状態と許可される遷移を定義する
 * なぜ: waiting→playing→finished / waiting→cancelled 以外の遷移を型で防ぐため
 */
package com.example.minigame.model;

import java.util.Set;

public enum RoomStatus {
  WAITING("waiting"),
  PLAYING("playing"),
  FINISHED("finished"),
  CANCELLED("cancelled");

  private final String value;

  RoomStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isActive() {
    return this == WAITING || this == PLAYING;
  }

  public boolean canTransitionTo(RoomStatus next) {
    return allowedNext().contains(next);
  }

  private Set<RoomStatus> allowedNext() {
    return switch (this) {
      case WAITING -> Set.of(PLAYING, CANCELLED);
      case PLAYING -> Set.of(FINISHED);
      case FINISHED, CANCELLED -> Set.of();
    };
  }

  /**
   * 役割: DB/API の status 文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static RoomStatus fromValue(String status) {
    for (RoomStatus roomStatus : values()) {
      if (roomStatus.value.equalsIgnoreCase(status)) {
        return roomStatus;
      }
    }
    throw new IllegalArgumentException("unsupported room status: " + status);
  }
}
