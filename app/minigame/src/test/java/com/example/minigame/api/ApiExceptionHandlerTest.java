package com.example.minigame.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void roomNotFoundReturns404() {
    final var response = handler.handleRoomNotFound(new RoomNotFoundException("abcd1234"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.ROOM_NOT_FOUND);
  }

  @Test
  void accessDeniedReturns403() {
    final var response = handler.handleRoomAccessDenied(new RoomAccessDeniedException("no"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.ROOM_ACCESS_DENIED, "no"));
  }

  @Test
  void insufficientCoinsReturns409() {
    final var response =
        handler.handleInsufficientCoins(new InsufficientCoinsException("u1", 50, 200));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.INSUFFICIENT_COINS);
    assertThat(response.getBody().message()).contains("balance=50");
  }

  @Test
  void concurrentModificationReturns409() {
    final var response =
        handler.handleConcurrentModification(
            new RoomConcurrentModificationException("abcd1234", 3));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.ROOM_CONCURRENT_MODIFICATION);
  }

  @Test
  void unsupportedGameTypeReturns400() {
    final var response =
        handler.handleUnsupportedGameType(new UnsupportedGameTypeException("poker"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.UNSUPPORTED_GAME_TYPE);
  }

  @Test
  void runtimeErrorHidesDetails() {
    final var response = handler.handleRuntime(new IllegalStateException("db path leaked"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.INTERNAL_ERROR);
    assertThat(response.getBody().message()).doesNotContain("db path");
  }

  @Test
  void blankMessageFallsBackToCodeText() {
    final var response =
        handler.handleInvalidRoomTransition(new InvalidRoomTransitionException(""));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().message()).isEqualTo("room state conflict");
  }
}
