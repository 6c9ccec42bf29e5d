package com.example.minigame.model;

/** game_records をゲーム種別単位で集計した値。記録が無い場合は全て 0。 */
public record GameStats(
    long totalGames,
    long wins,
    long totalBet,
    long totalWon,
    long netProfit,
    double avgProfit,
    long maxWin,
    long worstLoss) {

  public static GameStats empty() {
    return new GameStats(0, 0, 0, 0, 0, 0.0, 0, 0);
  }

  public double winRate() {
    return totalGames == 0 ? 0.0 : (double) wins / totalGames;
  }
}
