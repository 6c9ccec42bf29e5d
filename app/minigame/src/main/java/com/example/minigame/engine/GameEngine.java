/*
 * どこで: Minigame エンジン層
 * 何を: ゲーム種別ごとのルール実装が満たす契約を定義する
 * なぜ: ルームのライフサイクル (作成/参加/開始/行動/精算) をゲーム種別から切り離すため
 */
package com.example.minigame.engine;

import com.example.minigame.api.GameActionRejectedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * ゲームルールの実装。
 *
 * <p>実装はステートレスな Spring Bean とし、状態は全て {@link GameTable} (ルームの {@code players} と
 * {@code game_data} の作業コピー) 上で読み書きする。{@link GameEngineRegistry} が {@link #gameType()} で引き当てる。
 */
public interface GameEngine {

  /** game_rooms.game_type に保存される識別子。 */
  String gameType();

  String displayName();

  int minPlayers();

  int maxPlayers();

  long minBet();

  long maxBet();

  /** 利用者向けのルール説明文。 */
  String rules();

  /** ルーム作成時の game_data を返す。 */
  ObjectNode initializeGameData(GameTable table);

  boolean canStart(GameTable table);

  /**
   * ゲームを開始し、table の players/game_data を開始状態へ書き換える。
   *
   * @return 開始アナウンス
   */
  String start(GameTable table);

  /**
   * プレイヤーの行動を適用する。
   *
   * @throws GameActionRejectedException ルール違反 (手番違い、未知のアクション、範囲外パラメータ)。
   *     この場合 table は変更しない
   */
  GameActionResult processAction(GameTable table, String userId, String action, JsonNode params);

  /** 進行中ルームの状況表示。 */
  String statusText(GameTable table);

  boolean isFinished(GameTable table);

  GameResult result(GameTable table);
}
