package com.example.minigame.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

/** エラー応答。message はボットがチャットへそのまま流すため、空にはしない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message) {

  static ApiErrorResponse of(ApiErrorCode code, String message) {
    if (message == null || message.isBlank()) {
      return new ApiErrorResponse(code, code.name().toLowerCase(Locale.ROOT).replace('_', ' '));
    }
    return new ApiErrorResponse(code, message);
  }
}
