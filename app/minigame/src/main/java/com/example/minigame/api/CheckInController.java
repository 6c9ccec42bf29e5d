package com.example.minigame.api;

import com.example.minigame.api.response.CheckInResponse;
import com.example.minigame.api.response.CheckInStatsResponse;
import com.example.minigame.service.CheckInService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/me/check-ins")
@RequiredArgsConstructor
@Validated
public class CheckInController {

  private final CheckInService checkInService;

  @PostMapping
  public CheckInResponse checkIn(
      @RequestHeader(GameRoomController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId,
      @RequestHeader(GameRoomController.HEADER_USER_NAME)
          @NotBlank(message = "X-User-Name is required")
          String username) {
    return checkInService.checkIn(userId, username);
  }

  @GetMapping
  public CheckInStatsResponse stats(
      @RequestHeader(GameRoomController.HEADER_USER_ID)
          @NotBlank(message = "X-User-Id is required")
          String userId) {
    return checkInService.stats(userId);
  }
}
