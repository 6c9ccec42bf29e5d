/*
 * どこで: Minigame API リクエスト DTO
 * 何を: ルーム作成 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.minigame.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateRoomRequest(
    @NotBlank(message = "game_type is required") String gameType,
    @NotBlank(message = "channel_id is required") String channelId,
    @NotNull(message = "bet_amount is required") @Positive(message = "bet_amount must be positive")
        Long betAmount) {}
