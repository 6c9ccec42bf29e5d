package com.example.minigame.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * 終局結果。
 *
 * @param winners 賞金を等分する user_id の一覧。空なら配当なし
 * @param details game_records.details の game_result にそのまま保存するエンジン固有の内訳
 */
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "details は保存直前に一度だけシリアライズされる値オブジェクトのため")
public record GameResult(List<String> winners, ObjectNode details) {

  public GameResult {
    winners = winners == null ? List.of() : List.copyOf(winners);
  }

  public boolean isWinner(String userId) {
    return winners.contains(userId);
  }
}
