/*
 * どこで: Minigame API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: ボット側がエラーコードだけでメッセージを出し分けられるよう、応答形式を統一するため
 */
package com.example.minigame.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(RoomNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRoomNotFound(RoomNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.ROOM_NOT_FOUND, ex);
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleUserNotFound(UserNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.USER_NOT_FOUND, ex);
  }

  @ExceptionHandler(AchievementNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAchievementNotFound(
      AchievementNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.ACHIEVEMENT_NOT_FOUND, ex);
  }

  @ExceptionHandler(UnsupportedGameTypeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnsupportedGameType(
      UnsupportedGameTypeException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.UNSUPPORTED_GAME_TYPE, ex);
  }

  @ExceptionHandler(RoomAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleRoomAccessDenied(RoomAccessDeniedException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.ROOM_ACCESS_DENIED, ex);
  }

  @ExceptionHandler(RoomNotJoinableException.class)
  public ResponseEntity<ApiErrorResponse> handleRoomNotJoinable(RoomNotJoinableException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ROOM_NOT_JOINABLE, ex);
  }

  @ExceptionHandler(ActiveRoomExistsException.class)
  public ResponseEntity<ApiErrorResponse> handleActiveRoomExists(ActiveRoomExistsException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ACTIVE_ROOM_EXISTS, ex);
  }

  @ExceptionHandler(InvalidRoomTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRoomTransition(
      InvalidRoomTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ROOM_STATE_CONFLICT, ex);
  }

  @ExceptionHandler(InsufficientCoinsException.class)
  public ResponseEntity<ApiErrorResponse> handleInsufficientCoins(InsufficientCoinsException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.INSUFFICIENT_COINS, ex);
  }

  @ExceptionHandler(GameActionRejectedException.class)
  public ResponseEntity<ApiErrorResponse> handleGameActionRejected(
      GameActionRejectedException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.GAME_ACTION_REJECTED, ex);
  }

  @ExceptionHandler(AlreadyCheckedInException.class)
  public ResponseEntity<ApiErrorResponse> handleAlreadyCheckedIn(AlreadyCheckedInException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.ALREADY_CHECKED_IN, ex);
  }

  @ExceptionHandler(RoomConcurrentModificationException.class)
  public ResponseEntity<ApiErrorResponse> handleConcurrentModification(
      RoomConcurrentModificationException ex) {
    // 同時操作の負け側。クライアントは再取得してから再送すればよい。
    logger.warn("room update lost the version race: {}", ex.getMessage());
    return error(HttpStatus.CONFLICT, ApiErrorCode.ROOM_CONCURRENT_MODIFICATION, ex);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiErrorResponse.of(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, RuntimeException ex) {
    return ResponseEntity.status(status).body(ApiErrorResponse.of(code, ex.getMessage()));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(ApiErrorResponse.of(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
