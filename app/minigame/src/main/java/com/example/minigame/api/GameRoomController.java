/*
 * どこで: Minigame API
 * 何を: ゲーム一覧とルームのライフサイクル (作成/参加/開始/行動/取消/参照) のエンドポイントを提供する
 * なぜ: チャットボット側はコマンドをこの API へ中継するだけで済むようにするため
 */
package com.example.minigame.api;

import com.example.minigame.api.request.CreateRoomRequest;
import com.example.minigame.api.request.GameActionRequest;
import com.example.minigame.api.response.ChannelRoomsResponse;
import com.example.minigame.api.response.GameCatalogResponse;
import com.example.minigame.api.response.RoomCommandResponse;
import com.example.minigame.api.response.RoomListResponse;
import com.example.minigame.api.response.RoomResponse;
import com.example.minigame.service.GameRoomService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class GameRoomController {

  static final String HEADER_USER_ID = "X-User-Id";
  static final String HEADER_USER_NAME = "X-User-Name";

  private final GameRoomService gameRoomService;

  @GetMapping("/games")
  public GameCatalogResponse games() {
    return gameRoomService.availableGames();
  }

  @PostMapping("/rooms")
  public ResponseEntity<RoomCommandResponse> create(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @RequestHeader(HEADER_USER_NAME) @NotBlank(message = "X-User-Name is required")
          String username,
      @Valid @RequestBody CreateRoomRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(gameRoomService.createRoom(userId, username, request));
  }

  @GetMapping("/rooms/{room_id}")
  public RoomResponse get(@PathVariable("room_id") String roomId) {
    return gameRoomService.getRoom(roomId);
  }

  @PostMapping("/rooms/{room_id}/join")
  public RoomCommandResponse join(
      @PathVariable("room_id") String roomId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @RequestHeader(HEADER_USER_NAME) @NotBlank(message = "X-User-Name is required")
          String username) {
    return gameRoomService.joinRoom(roomId, userId, username);
  }

  @PostMapping("/rooms/{room_id}/start")
  public RoomCommandResponse start(
      @PathVariable("room_id") String roomId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
    return gameRoomService.startRoom(roomId, userId);
  }

  @PostMapping("/rooms/{room_id}/actions")
  public RoomCommandResponse action(
      @PathVariable("room_id") String roomId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @Valid @RequestBody GameActionRequest request) {
    return gameRoomService.processAction(roomId, userId, request);
  }

  @PostMapping("/rooms/{room_id}/cancel")
  public RoomCommandResponse cancel(
      @PathVariable("room_id") String roomId,
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId) {
    return gameRoomService.cancelRoom(roomId, userId);
  }

  @GetMapping("/channels/{channel_id}/rooms")
  public ChannelRoomsResponse channelRooms(
      @PathVariable("channel_id") String channelId,
      @RequestParam(value = "game_type", required = false) String gameType) {
    return gameRoomService.listChannelRooms(channelId, gameType);
  }

  @GetMapping("/me/rooms")
  public RoomListResponse myRooms(
      @RequestHeader(HEADER_USER_ID) @NotBlank(message = "X-User-Id is required") String userId,
      @RequestParam(value = "status", required = false) String status) {
    return gameRoomService.listUserRooms(userId, status);
  }
}
