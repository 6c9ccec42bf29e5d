/*
 * どこで: Minigame ドメインモデル
 * 何を: game_records テーブルの 1 行 (プレイヤー 1 人分の対局結果)
 * なぜ: 精算結果を追記専用の監査ログとして残すため
 */
package com.example.minigame.model;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;

@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "details は Jackson のツリーで、読み取り専用として扱うため")
public record GameResultRecord(
    Long id,
    String userId,
    String gameType,
    long coinsBet,
    long coinsWon,
    GameOutcome result,
    JsonNode details,
    Instant createdAt) {}
